/*
 * どこで: Pairing エンジン
 * 何を: 競技者 1 人分の過去実績 (BYE 回数/サイド回数/対戦相手/審査員) を保持する
 * なぜ: ペナルティ計算の参照を O(1) にするため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.model.Side;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.util.EnumMap;
import java.util.Map;

public final class CompetitorHistory {

  private int byeCount;
  private final Map<Side, Integer> sideCounts = new EnumMap<>(Side.class);
  private final Multiset<String> opponents = HashMultiset.create();
  private final Multiset<String> adjudicators = HashMultiset.create();

  CompetitorHistory() {}

  public int byeCount() {
    return byeCount;
  }

  public int sideCount(Side side) {
    return sideCounts.getOrDefault(side, 0);
  }

  // PROPOSITION 回数 - OPPOSITION 回数
  public int sideImbalance() {
    return sideCount(Side.PROPOSITION) - sideCount(Side.OPPOSITION);
  }

  public int opponentCount(String unitKey) {
    return opponents.count(unitKey);
  }

  public int adjudicatorCount(String adjudicatorName) {
    return adjudicators.count(adjudicatorName);
  }

  void recordBye() {
    byeCount++;
  }

  void recordSide(Side side) {
    sideCounts.merge(side, 1, Integer::sum);
  }

  void recordOpponent(String unitKey) {
    opponents.add(unitKey);
  }

  void recordAdjudicator(String adjudicatorName) {
    adjudicators.add(adjudicatorName);
  }

  CompetitorHistory copy() {
    final CompetitorHistory copy = new CompetitorHistory();
    copy.byeCount = byeCount;
    copy.sideCounts.putAll(sideCounts);
    copy.opponents.addAll(opponents);
    copy.adjudicators.addAll(adjudicators);
    return copy;
  }
}
