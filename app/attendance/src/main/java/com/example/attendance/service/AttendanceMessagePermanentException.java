/*
 * どこで: Attendance サービス層
 * 何を: 再処理しても回復しない投稿 (必須項目欠落・形式不正) を示す例外
 * なぜ: NATS 再配信を止めて破棄する判断と、HTTP 400 応答の判断に使うため
 */
package com.example.attendance.service;

public class AttendanceMessagePermanentException extends RuntimeException {

  public AttendanceMessagePermanentException(String message) {
    super(message);
  }

  public AttendanceMessagePermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
