/*
 * どこで: Pairing サービス補助
 * 何を: 形式 + 開催日から 64-bit advisory lock のキーを生成する
 * なぜ: 同じ大会への同時生成を DB 側で直列化し、二重登録を防ぐため
 */
package com.debateleague.pairing.service;

import com.debateleague.pairing.model.EventFormat;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

@Component
public class EventLockKeyGenerator {

  // SHA-256 の先頭 8byte を 64-bit のキーとして使う
  static final int LOCK_KEY_BYTES = 8;

  public long generate(EventFormat format, LocalDate eventDate) {
    final byte[] hashed = hash("pairing:" + format.value() + ":" + eventDate);
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String eventKey) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(eventKey.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
