/*
 * どこで: Pairing API
 * 何を: 名簿の整合性違反 (重複会場/兼任/未登録の利害関係者/不正なペア) を表現する
 * なぜ: エンジン実行前に 422 応答へ変換するため
 */
package com.debateleague.pairing.api;

import java.util.List;

public class RosterIntegrityException extends RuntimeException {

  private final List<String> violations;

  public RosterIntegrityException(List<String> violations) {
    super("roster integrity violated: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> violations() {
    return violations;
  }
}
