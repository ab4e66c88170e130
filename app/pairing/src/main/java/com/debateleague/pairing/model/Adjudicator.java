/*
 * どこで: Pairing ドメインモデル
 * 何を: 審査員と利害関係者 (conflict set) を表現する
 * なぜ: 担当不可の組み合わせを割当前に判定するため
 */
package com.debateleague.pairing.model;

import java.util.Collection;
import java.util.Set;

public record Adjudicator(String name, EventFormat format, Set<String> conflicts) {

  public Adjudicator {
    conflicts = conflicts == null ? Set.of() : Set.copyOf(conflicts);
  }

  public boolean conflictsWithAny(Collection<String> competitorNames) {
    for (String competitorName : competitorNames) {
      if (conflicts.contains(competitorName)) {
        return true;
      }
    }
    return false;
  }
}
