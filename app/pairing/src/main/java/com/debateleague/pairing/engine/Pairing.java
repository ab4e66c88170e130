/*
 * どこで: Pairing エンジン
 * 何を: 1 ラウンド分の対戦割当 (サイド/審査員/会場/ペナルティ) を保持する
 * なぜ: 最適化器が作成し、資源割当器が埋めて呼び出し側へ渡すため
 */
package com.debateleague.pairing.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Pairing {

  private final int roundNumber;
  private final Unit sideA;
  private final Unit sideB;
  private final List<String> adjudicators = new ArrayList<>();
  private String venue;
  private int penalty;

  Pairing(int roundNumber, Unit sideA, Unit sideB, int penalty) {
    this.roundNumber = roundNumber;
    this.sideA = sideA;
    this.sideB = sideB;
    this.penalty = penalty;
  }

  static Pairing bye(int roundNumber, Unit unit) {
    return new Pairing(roundNumber, unit, null, 0);
  }

  public int roundNumber() {
    return roundNumber;
  }

  public Unit sideA() {
    return sideA;
  }

  // BYE のときは null
  public Unit sideB() {
    return sideB;
  }

  public boolean isBye() {
    return sideB == null;
  }

  // 先頭が主審
  public List<String> adjudicators() {
    return Collections.unmodifiableList(adjudicators);
  }

  public String venue() {
    return venue;
  }

  public int penalty() {
    return penalty;
  }

  public List<String> competitorNames() {
    if (isBye()) {
      return sideA.members();
    }
    final List<String> names = new ArrayList<>(sideA.members());
    names.addAll(sideB.members());
    return names;
  }

  public String describe() {
    return isBye() ? sideA.key() + " (bye)" : sideA.key() + " vs " + sideB.key();
  }

  void addAdjudicator(String adjudicatorName, int cost) {
    adjudicators.add(adjudicatorName);
    penalty += cost;
  }

  void assignVenue(String venueName) {
    this.venue = venueName;
  }
}
