/*
 * どこで: Attendance 分類層
 * 何を: 投稿テキストを勤怠イベントへ分類する分類器の境界を定義する
 * なぜ: ルール分類と AI 分類をオーケストレータから同じ形で扱うため
 */
package com.example.attendance.classifier;

import com.example.attendance.model.ClassifiedEvent;
import java.util.Optional;

public interface AttendanceClassifier {

  boolean isAvailable();

  /**
   * 役割: 1 投稿を分類する。
   * 動作: 分類できなかった場合 (外部障害を含む) は例外ではなく Optional.empty() を返す。
   */
  Optional<ClassifiedEvent> classify(String text);
}
