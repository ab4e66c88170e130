/*
 * どこで: Pairing エンジン
 * 何を: 同日 2 ラウンド形式の 2 回分の割当を順に計算する
 * なぜ: 第 1 ラウンドを「記録済みとみなした」History で第 2 ラウンドを組むため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.model.Adjudicator;
import com.debateleague.pairing.model.Competitor;
import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.Side;
import com.debateleague.pairing.model.Venue;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TwoRoundOrchestrator {

  private final RoundPlanner roundPlanner;

  /**
   * 役割: 2 ラウンド分の割当を返す。
   * 動作: 第 2 ラウンドは元の view の複製へ第 1 ラウンド結果を反映したものを使い、第 1 ラウンドの BYE
   *     対象を除外して BYE を選ぶ。審査員と会場は各ラウンドで全員/全室を使える。
   */
  public List<RoundResult> run(
      List<Competitor> competitors,
      List<Adjudicator> adjudicators,
      List<Venue> venues,
      HistoryView view) {
    final RoundResult first =
        roundPlanner.plan(1, EventFormat.SINGLE, competitors, adjudicators, venues, view, null);
    final HistoryView simulated = simulate(view, first.pairings());
    final RoundResult second =
        roundPlanner.plan(
            2, EventFormat.SINGLE, competitors, adjudicators, venues, simulated, first.byeKey());
    return List.of(first, second);
  }

  // base の複製へ、pairings を記録済みとみなして書き込む
  public HistoryView simulate(HistoryView base, List<Pairing> pairings) {
    final HistoryView simulated = base.copy();
    for (Pairing pairing : pairings) {
      if (pairing.isBye()) {
        for (String member : pairing.sideA().members()) {
          simulated.competitorForUpdate(member).recordBye();
        }
        continue;
      }
      foldSide(simulated, pairing, pairing.sideA(), pairing.sideB(), Side.PROPOSITION);
      foldSide(simulated, pairing, pairing.sideB(), pairing.sideA(), Side.OPPOSITION);
      if (pairing.venue() != null) {
        for (String adjudicator : pairing.adjudicators()) {
          simulated.adjudicatorForUpdate(adjudicator).recordVenue(pairing.venue());
        }
      }
    }
    return simulated;
  }

  private void foldSide(HistoryView view, Pairing pairing, Unit unit, Unit opponent, Side side) {
    for (String member : unit.members()) {
      final CompetitorHistory history = view.competitorForUpdate(member);
      history.recordSide(side);
      history.recordOpponent(opponent.key());
      pairing.adjudicators().forEach(history::recordAdjudicator);
    }
  }
}
