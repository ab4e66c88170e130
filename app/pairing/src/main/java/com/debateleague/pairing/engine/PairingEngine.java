/*
 * どこで: Pairing エンジン
 * 何を: 大会形式ごとに 1 回分の割当計算を振り分ける
 * なぜ: 呼び出し側が形式を意識せず結果を受け取れるようにするため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.Roster;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PairingEngine {

  private final RoundPlanner roundPlanner;
  private final TwoRoundOrchestrator twoRoundOrchestrator;

  /**
   * 役割: 出席者だけの名簿から 1 大会分の全ラウンドを計算する。
   * 動作: 呼び出し間で状態を持たず、view は読み取り専用として扱う。
   */
  public List<RoundResult> generate(Roster presentRoster, HistoryView view) {
    if (presentRoster.format() == EventFormat.SINGLE) {
      return twoRoundOrchestrator.run(
          presentRoster.competitors(), presentRoster.adjudicators(), presentRoster.venues(), view);
    }
    return List.of(
        roundPlanner.plan(
            1,
            EventFormat.TEAM,
            presentRoster.competitors(),
            presentRoster.adjudicators(),
            presentRoster.venues(),
            view,
            null));
  }
}
