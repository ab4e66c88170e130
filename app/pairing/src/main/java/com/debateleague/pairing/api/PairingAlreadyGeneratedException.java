/*
 * どこで: Pairing API
 * 何を: 同じ形式/開催日の組み合わせが生成済みであることを表現する
 * なぜ: 再実行で生成結果と History が二重に記録されないよう 409 で拒否するため
 */
package com.debateleague.pairing.api;

public class PairingAlreadyGeneratedException extends RuntimeException {
  public PairingAlreadyGeneratedException(String format, String eventDate) {
    super("pairings already generated: format=" + format + " eventDate=" + eventDate);
  }
}
