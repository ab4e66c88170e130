/*
 * どこで: Pairing エンジン
 * 何を: 1 回の実行で使う過去実績のスナップショットを保持する
 * なぜ: 外部ログを毎回再集計し、実行間で状態を持たないため
 */
package com.debateleague.pairing.engine;

import java.util.HashMap;
import java.util.Map;

public final class HistoryView {

  private final Map<String, CompetitorHistory> competitors = new HashMap<>();
  private final Map<String, AdjudicatorHistory> adjudicators = new HashMap<>();

  HistoryView() {}

  public static HistoryView empty() {
    return new HistoryView();
  }

  public CompetitorHistory competitor(String name) {
    final CompetitorHistory history = competitors.get(name);
    return history == null ? new CompetitorHistory() : history;
  }

  public AdjudicatorHistory adjudicator(String name) {
    final AdjudicatorHistory history = adjudicators.get(name);
    return history == null ? new AdjudicatorHistory() : history;
  }

  public boolean isEmpty() {
    return competitors.isEmpty() && adjudicators.isEmpty();
  }

  /**
   * 役割: 2 ラウンド目のシミュレーション用に独立した複製を作る。
   * 動作: 競技者/審査員ごとの集計を深くコピーし、複製への書き込みは元のビューへ届かない。
   */
  public HistoryView copy() {
    final HistoryView copy = new HistoryView();
    competitors.forEach((name, history) -> copy.competitors.put(name, history.copy()));
    adjudicators.forEach((name, history) -> copy.adjudicators.put(name, history.copy()));
    return copy;
  }

  CompetitorHistory competitorForUpdate(String name) {
    return competitors.computeIfAbsent(name, ignored -> new CompetitorHistory());
  }

  AdjudicatorHistory adjudicatorForUpdate(String name) {
    return adjudicators.computeIfAbsent(name, ignored -> new AdjudicatorHistory());
  }
}
