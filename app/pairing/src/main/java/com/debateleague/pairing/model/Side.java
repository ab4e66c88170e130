/*
 * どこで: Pairing ドメインモデル
 * 何を: 対戦で担当するサイドを定義する
 * なぜ: History 行と生成結果で同じ表記を使うため
 */
package com.debateleague.pairing.model;

public enum Side {
  PROPOSITION,
  OPPOSITION,
  BYE;

  public Side opposite() {
    return switch (this) {
      case PROPOSITION -> OPPOSITION;
      case OPPOSITION -> PROPOSITION;
      case BYE -> BYE;
    };
  }
}
