/*
 * どこで: Pairing ドメインモデル
 * 何を: 1 形式分の競技者/審査員/会場をまとめる
 * なぜ: 出欠フィルタと整合性チェックを同じ単位で扱うため
 */
package com.debateleague.pairing.model;

import java.util.List;
import java.util.Set;

public record Roster(
    EventFormat format,
    List<Competitor> competitors,
    List<Adjudicator> adjudicators,
    List<Venue> venues) {

  public Roster {
    competitors = List.copyOf(competitors);
    adjudicators = List.copyOf(adjudicators);
    venues = List.copyOf(venues);
  }

  // 出席者 (競技者/審査員) だけを残す。会場は人ではないので常に利用可能
  public Roster presentOnly(Set<String> presentNames) {
    return new Roster(
        format,
        competitors.stream().filter(c -> presentNames.contains(c.name())).toList(),
        adjudicators.stream().filter(a -> presentNames.contains(a.name())).toList(),
        venues);
  }
}
