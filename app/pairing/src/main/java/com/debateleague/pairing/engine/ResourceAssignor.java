/*
 * どこで: Pairing エンジン
 * 何を: 各対戦へ審査員 (パネル含む) と会場を割り当てる
 * なぜ: 利害関係者を絶対に担当させず、同じ審査員の偏りを抑えるため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.config.PairingProperties;
import com.debateleague.pairing.model.Adjudicator;
import com.debateleague.pairing.model.Venue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

// 第 1 パス: 全対戦に 1 人ずつ (難しい対戦から)、第 2 パス: 余りをパネルへ、第 3 パス: 会場
@Component
@RequiredArgsConstructor
public class ResourceAssignor {

  private static final Logger logger = LoggerFactory.getLogger(ResourceAssignor.class);

  private final PairingProperties properties;
  private final Random random;

  public void requireSufficient(int matches, int adjudicatorCount, int venueCount) {
    if (adjudicatorCount < matches) {
      throw new ResourceShortageException("adjudicators", matches, adjudicatorCount);
    }
    if (venueCount < matches) {
      throw new ResourceShortageException("venues", matches, venueCount);
    }
  }

  /**
   * 役割: BYE 以外の対戦へ審査員と会場を割り当てる。
   * 動作: 資源数の不足、または利害関係のない審査員がいない対戦がある場合は例外を送出し、途中結果は返さない。
   *     戻り値はパネル割当後も残った (どの対戦とも利害関係がある) 審査員。
   */
  public List<Adjudicator> assign(
      List<Pairing> pairings,
      List<Adjudicator> adjudicators,
      List<Venue> venues,
      HistoryView view) {
    final List<Pairing> matches =
        pairings.stream()
            .filter(p -> !p.isBye())
            .sorted(Comparator.comparingInt(Pairing::penalty).reversed())
            .toList();
    requireSufficient(matches.size(), adjudicators.size(), venues.size());
    if (matches.isEmpty()) {
      return List.copyOf(adjudicators);
    }
    final List<Adjudicator> pool = new ArrayList<>(adjudicators);
    Collections.shuffle(pool, random);

    final Map<Pairing, Adjudicator> primaries = coverAll(matches, pool, view);
    final Set<String> used = new HashSet<>();
    for (Pairing pairing : matches) {
      final Adjudicator primary = primaries.get(pairing);
      used.add(primary.name());
      pairing.addAdjudicator(primary.name(), readjudicationPenalty(primary, pairing, view));
    }

    final List<Adjudicator> unused = new ArrayList<>();
    for (Adjudicator adjudicator : pool) {
      if (used.contains(adjudicator.name())) {
        continue;
      }
      final Pairing target = bestPanelFor(adjudicator, matches, view);
      if (target == null) {
        logger.debug("adjudicator left unused name={} reason=conflicts", adjudicator.name());
        unused.add(adjudicator);
        continue;
      }
      target.addAdjudicator(adjudicator.name(), readjudicationPenalty(adjudicator, target, view));
    }

    assignVenues(matches, venues, view);
    return unused;
  }

  // 対戦の各競技者について 重み x (過去に担当された回数)^2 を合計する
  public int readjudicationPenalty(Adjudicator adjudicator, Pairing pairing, HistoryView view) {
    int penalty = 0;
    for (String competitor : pairing.competitorNames()) {
      final int seen = view.competitor(competitor).adjudicatorCount(adjudicator.name());
      penalty += properties.readjudicationWeight() * seen * seen;
    }
    return penalty;
  }

  /**
   * 役割: 全対戦へ利害関係のない主審を 1 人ずつ決める。
   * 動作: 難しい対戦から順に再担当ペナルティ最小の審査員を選び、同点なら残りの対戦で担当できる数が
   *     少ない審査員を優先する。空きがない対戦は増加路で既存の割当を組み替え、それでも
   *     割り当てられない場合だけ ConflictExhaustedException を送出する。
   */
  private Map<Pairing, Adjudicator> coverAll(
      List<Pairing> matches, List<Adjudicator> pool, HistoryView view) {
    final Map<Pairing, Adjudicator> primaries = new LinkedHashMap<>();
    final Map<String, Pairing> coveredBy = new HashMap<>();
    for (Pairing pairing : matches) {
      final Adjudicator chosen =
          bestAdjudicatorFor(pairing, matches, pool, primaries, coveredBy, view);
      if (chosen != null) {
        primaries.put(pairing, chosen);
        coveredBy.put(chosen.name(), pairing);
        continue;
      }
      if (!reassign(pairing, pool, primaries, coveredBy, new HashSet<>())) {
        throw new ConflictExhaustedException(pairing.describe());
      }
      logger.debug("primary adjudicators reshuffled to cover pairing={}", pairing.describe());
    }
    return primaries;
  }

  private Adjudicator bestAdjudicatorFor(
      Pairing pairing,
      List<Pairing> matches,
      List<Adjudicator> pool,
      Map<Pairing, Adjudicator> primaries,
      Map<String, Pairing> coveredBy,
      HistoryView view) {
    Adjudicator best = null;
    int bestCost = Integer.MAX_VALUE;
    int bestReach = Integer.MAX_VALUE;
    for (Adjudicator adjudicator : pool) {
      if (coveredBy.containsKey(adjudicator.name())
          || adjudicator.conflictsWithAny(pairing.competitorNames())) {
        continue;
      }
      final int cost = readjudicationPenalty(adjudicator, pairing, view);
      final int reach = uncoveredReach(adjudicator, pairing, matches, primaries);
      if (cost < bestCost || (cost == bestCost && reach < bestReach)) {
        best = adjudicator;
        bestCost = cost;
        bestReach = reach;
      }
    }
    return best;
  }

  // まだ主審のいない他の対戦のうち、この審査員が担当できる数
  private int uncoveredReach(
      Adjudicator adjudicator,
      Pairing current,
      List<Pairing> matches,
      Map<Pairing, Adjudicator> primaries) {
    int reach = 0;
    for (Pairing other : matches) {
      if (other != current
          && !primaries.containsKey(other)
          && !adjudicator.conflictsWithAny(other.competitorNames())) {
        reach++;
      }
    }
    return reach;
  }

  // 二部マッチングの増加路探索。担当中の対戦を別の審査員へ移せるなら空けてもらう
  private boolean reassign(
      Pairing pairing,
      List<Adjudicator> pool,
      Map<Pairing, Adjudicator> primaries,
      Map<String, Pairing> coveredBy,
      Set<String> visited) {
    for (Adjudicator adjudicator : pool) {
      if (adjudicator.conflictsWithAny(pairing.competitorNames())
          || !visited.add(adjudicator.name())) {
        continue;
      }
      final Pairing holder = coveredBy.get(adjudicator.name());
      if (holder == null || reassign(holder, pool, primaries, coveredBy, visited)) {
        primaries.put(pairing, adjudicator);
        coveredBy.put(adjudicator.name(), pairing);
        return true;
      }
    }
    return false;
  }

  private Pairing bestPanelFor(Adjudicator adjudicator, List<Pairing> matches, HistoryView view) {
    Pairing best = null;
    int bestCost = Integer.MAX_VALUE;
    for (Pairing pairing : matches) {
      if (adjudicator.conflictsWithAny(pairing.competitorNames())) {
        continue;
      }
      final int cost =
          readjudicationPenalty(adjudicator, pairing, view)
              + properties.panelSizePenalty() * pairing.adjudicators().size();
      if (cost < bestCost) {
        best = pairing;
        bestCost = cost;
      }
    }
    return best;
  }

  private void assignVenues(List<Pairing> matches, List<Venue> venues, HistoryView view) {
    final Set<String> taken = new HashSet<>();
    for (Pairing pairing : matches) {
      final AdjudicatorHistory primary = view.adjudicator(pairing.adjudicators().get(0));
      Venue chosen = null;
      int chosenCount = -1;
      for (Venue venue : venues) {
        if (taken.contains(venue.name())) {
          continue;
        }
        final int count = primary.venueCount(venue.name());
        if (count > chosenCount) {
          chosen = venue;
          chosenCount = count;
        }
      }
      // 事前チェックで会場数は対戦数以上が保証されている
      taken.add(chosen.name());
      pairing.assignVenue(chosen.name());
    }
  }
}
