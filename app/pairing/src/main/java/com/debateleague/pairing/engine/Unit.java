/*
 * どこで: Pairing エンジン
 * 何を: 実際に対戦を組む単位 (個人/チーム/単独代替) を表現する
 * なぜ: 形式ごとの差をエンジン内部で吸収するため
 */
package com.debateleague.pairing.engine;

import java.util.List;

// key はメンバー名を辞書順に連結した識別子。fallback は相方不在で作った 1 人 Unit
public record Unit(
    String key, List<String> members, boolean fallback, boolean novice, CompetitorHistory history) {

  public Unit {
    members = List.copyOf(members);
  }

  public String label(String fallbackMarker) {
    return fallback ? key + " " + fallbackMarker : key;
  }
}
