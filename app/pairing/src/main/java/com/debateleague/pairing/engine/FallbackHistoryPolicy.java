/*
 * どこで: Pairing エンジン
 * 何を: 複数の元競技者から Unit が引き継ぐ History を選ぶ規則を定義する
 * なぜ: 引き継ぎ元の選び方を差し替え可能にするため
 */
package com.debateleague.pairing.engine;

import java.util.List;

@FunctionalInterface
public interface FallbackHistoryPolicy {

  /**
   * 役割: Unit が引き継ぐ History の元競技者を選ぶ。
   * 動作: members は辞書順に並んだ状態で渡され、その中の 1 人の名前を返す。
   */
  String chooseMember(List<String> members, HistoryView view);
}
