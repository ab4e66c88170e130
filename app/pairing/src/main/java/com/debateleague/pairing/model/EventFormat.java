/*
 * どこで: Pairing ドメインモデル
 * 何を: サポートする大会形式を定義する
 * なぜ: format 入力の妥当性を列挙型で固定するため
 */
package com.debateleague.pairing.model;

public enum EventFormat {
  TEAM("team", 1),
  SINGLE("single", 2);

  private final String value;
  private final int roundsPerEvent;

  EventFormat(String value, int roundsPerEvent) {
    this.value = value;
    this.roundsPerEvent = roundsPerEvent;
  }

  public String value() {
    return value;
  }

  public int roundsPerEvent() {
    return roundsPerEvent;
  }

  /**
   * 役割: API や DB の format 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static EventFormat fromValue(String format) {
    for (EventFormat eventFormat : values()) {
      if (eventFormat.value.equalsIgnoreCase(format)) {
        return eventFormat;
      }
    }
    throw new IllegalArgumentException("unsupported format: " + format);
  }
}
