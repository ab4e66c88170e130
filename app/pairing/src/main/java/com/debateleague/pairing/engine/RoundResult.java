package com.debateleague.pairing.engine;

import java.util.List;

// 1 ラウンド分の対戦 (BYE 含む)。byeUnit は人数が偶数なら null
public record RoundResult(List<Pairing> pairings, Unit byeUnit, int unusedAdjudicators) {

  public RoundResult {
    pairings = List.copyOf(pairings);
  }

  public String byeKey() {
    return byeUnit == null ? null : byeUnit.key();
  }

  public int totalPenalty() {
    return pairings.stream().mapToInt(Pairing::penalty).sum();
  }
}
