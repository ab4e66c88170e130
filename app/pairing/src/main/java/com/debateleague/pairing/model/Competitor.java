/*
 * どこで: Pairing ドメインモデル
 * 何を: 名簿上の競技者を表現する
 * なぜ: Unit 形成と History 参照の起点を固定するため
 */
package com.debateleague.pairing.model;

public record Competitor(String name, EventFormat format, String partnerName, boolean novice) {

  public boolean hasPartner() {
    return partnerName != null && !partnerName.isBlank();
  }
}
