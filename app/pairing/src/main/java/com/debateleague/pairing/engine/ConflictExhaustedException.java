/*
 * どこで: Pairing エンジン
 * 何を: 利害関係のない審査員が 1 人もいない対戦を表現する
 * なぜ: 審査員割当の第 1 パスで実行全体を失敗させるため
 */
package com.debateleague.pairing.engine;

public class ConflictExhaustedException extends PairingEngineException {

  private final String pairing;

  public ConflictExhaustedException(String pairing) {
    super("no conflict-free adjudicator for pairing: " + pairing);
    this.pairing = pairing;
  }

  public String pairing() {
    return pairing;
  }
}
