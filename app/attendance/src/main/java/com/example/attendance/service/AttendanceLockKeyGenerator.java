/*
 * どこで: Attendance サービス補助
 * 何を: (tenantId, userId) から 64-bit advisory lock のキーを生成する
 * なぜ: 同一ユーザーの状態更新を複数プロセス間でも直列化するため
 */
package com.example.attendance.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class AttendanceLockKeyGenerator {

  // SHA-256 の先頭 8byte を 64-bit advisory lock のキーにする。
  static final int LOCK_KEY_BYTES = 8;

  public long generate(String tenantId, String userId) {
    // tenantId と userId を ":" で連結した UTF-8 文字列をハッシュ対象にする。
    final byte[] hashed = hash(tenantId + ":" + userId);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
