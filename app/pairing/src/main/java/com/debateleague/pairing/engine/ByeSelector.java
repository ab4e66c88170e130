/*
 * どこで: Pairing エンジン
 * 何を: 奇数人数のラウンドで休み (BYE) となる Unit を選ぶ
 * なぜ: BYE 回数の少ない Unit へ順に割り振り、連続 BYE を避けるため
 */
package com.debateleague.pairing.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ByeSelector {

  private final Random random;

  /**
   * 役割: pool が奇数なら 1 Unit を取り除いて返す。偶数なら何もしない。
   * 動作: BYE 回数の昇順 (同数はランダム) で excludedKey 以外の先頭を選ぶ。
   *     候補が除外対象しか残らない場合は除外を無視して選ぶ。
   */
  public Optional<Unit> select(List<Unit> pool, String excludedKey) {
    if (pool.size() % 2 == 0) {
      return Optional.empty();
    }
    final List<Unit> candidates = new ArrayList<>(pool);
    Collections.shuffle(candidates, random);
    candidates.sort(Comparator.comparingInt(unit -> unit.history().byeCount()));
    final Unit chosen =
        candidates.stream()
            .filter(unit -> !unit.key().equals(excludedKey))
            .findFirst()
            .orElse(candidates.get(0));
    pool.remove(chosen);
    return Optional.of(chosen);
  }
}
