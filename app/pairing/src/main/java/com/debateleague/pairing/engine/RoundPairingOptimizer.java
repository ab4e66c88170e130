/*
 * どこで: Pairing エンジン
 * 何を: 偶数個の Unit を 2 つずつ対戦させる組み合わせを探索する
 * なぜ: 実力差/再戦を避けつつ、必ず完全な組み合わせを返すため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.config.PairingProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoundPairingOptimizer {

  private final PairingProperties properties;
  private final Random random;

  public List<Pairing> pair(int roundNumber, List<Unit> pool) {
    if (pool.size() % 2 != 0) {
      throw new IllegalArgumentException("pool size must be even: " + pool.size());
    }
    if (pool.isEmpty()) {
      return List.of();
    }
    final List<Unit> order = new ArrayList<>(pool);
    List<Pairing> best = null;
    int bestPenalty = Integer.MAX_VALUE;
    for (int i = 0; i < properties.searchIterations(); i++) {
      Collections.shuffle(order, random);
      final List<Pairing> candidate = new ArrayList<>(order.size() / 2);
      int total = 0;
      for (int j = 0; j < order.size(); j += 2) {
        final Pairing pairing = orient(roundNumber, order.get(j), order.get(j + 1));
        candidate.add(pairing);
        total += pairing.penalty();
      }
      if (total < bestPenalty) {
        best = candidate;
        bestPenalty = total;
      }
      if (bestPenalty == 0) {
        break;
      }
    }
    return best;
  }

  public int penalty(Unit first, Unit second) {
    int penalty = first.novice() != second.novice() ? properties.tierMismatchPenalty() : 0;
    final int encounters =
        first.history().opponentCount(second.key()) + second.history().opponentCount(first.key());
    penalty += properties.rematchPenalty() * encounters;
    return penalty;
  }

  // 各 Unit の過去のサイド偏りが小さくなる向きを選ぶ (同点はランダム)
  private Pairing orient(int roundNumber, Unit first, Unit second) {
    final int firstImbalance = first.history().sideImbalance();
    final int secondImbalance = second.history().sideImbalance();
    final int firstProposes = Math.abs(firstImbalance + 1) + Math.abs(secondImbalance - 1);
    final int secondProposes = Math.abs(firstImbalance - 1) + Math.abs(secondImbalance + 1);
    final boolean firstTakesProposition =
        firstProposes == secondProposes ? random.nextBoolean() : firstProposes < secondProposes;
    final int penalty = penalty(first, second);
    return firstTakesProposition
        ? new Pairing(roundNumber, first, second, penalty)
        : new Pairing(roundNumber, second, first, penalty);
  }
}
