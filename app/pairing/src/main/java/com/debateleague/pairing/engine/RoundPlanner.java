/*
 * どこで: Pairing エンジン
 * 何を: 1 ラウンド分の Unit 形成 → BYE 選択 → 組み合わせ → 資源割当を実行する
 * なぜ: チーム形式と 2 ラウンド形式で同じ手順を共有するため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.model.Adjudicator;
import com.debateleague.pairing.model.Competitor;
import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.Venue;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoundPlanner {

  private final UnitFormation unitFormation;
  private final ByeSelector byeSelector;
  private final RoundPairingOptimizer optimizer;
  private final ResourceAssignor resourceAssignor;

  public RoundResult plan(
      int roundNumber,
      EventFormat format,
      List<Competitor> competitors,
      List<Adjudicator> adjudicators,
      List<Venue> venues,
      HistoryView view,
      String excludedByeKey) {
    final List<Unit> pool =
        new ArrayList<>(
            format == EventFormat.TEAM
                ? unitFormation.formTeams(competitors, view)
                : unitFormation.formSingles(competitors, view));
    // 組み合わせ探索の前に資源不足を検出する
    resourceAssignor.requireSufficient(pool.size() / 2, adjudicators.size(), venues.size());

    final Unit bye = byeSelector.select(pool, excludedByeKey).orElse(null);
    final List<Pairing> pairings = new ArrayList<>(optimizer.pair(roundNumber, pool));
    final int unused = resourceAssignor.assign(pairings, adjudicators, venues, view).size();
    if (bye != null) {
      pairings.add(Pairing.bye(roundNumber, bye));
    }
    return new RoundResult(pairings, bye, unused);
  }
}
