/*
 * どこで: Pairing サービス層
 * 何を: エンジン実行前に名簿の整合性を検査する
 * なぜ: 入力不備をエンジン内部へ持ち込まず、1 つのエラーでまとめて報告するため
 */
package com.debateleague.pairing.service;

import com.debateleague.pairing.api.RosterIntegrityException;
import com.debateleague.pairing.model.Adjudicator;
import com.debateleague.pairing.model.Competitor;
import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.Roster;
import com.debateleague.pairing.model.Venue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class RosterIntegrityChecker {

  /**
   * 役割: 名簿全体 (出欠適用前) の整合性を検査する。
   * 動作: 違反をすべて集めてから RosterIntegrityException を 1 回だけ送出する。違反がなければ何もしない。
   */
  public void check(Roster roster) {
    final List<String> violations = new ArrayList<>();
    final Map<String, Competitor> competitors = new HashMap<>();
    for (Competitor competitor : roster.competitors()) {
      if (competitors.put(competitor.name(), competitor) != null) {
        violations.add("duplicate competitor: " + competitor.name());
      }
    }
    checkVenues(roster.venues(), violations);
    checkAdjudicators(roster.adjudicators(), competitors, violations);
    if (roster.format() == EventFormat.TEAM) {
      checkPartnerships(competitors, violations);
    }
    if (!violations.isEmpty()) {
      throw new RosterIntegrityException(violations);
    }
  }

  private void checkVenues(List<Venue> venues, List<String> violations) {
    final Set<String> seen = new HashSet<>();
    for (Venue venue : venues) {
      if (!seen.add(venue.name())) {
        violations.add("duplicate venue: " + venue.name());
      }
    }
  }

  private void checkAdjudicators(
      List<Adjudicator> adjudicators,
      Map<String, Competitor> competitors,
      List<String> violations) {
    for (Adjudicator adjudicator : adjudicators) {
      if (competitors.containsKey(adjudicator.name())) {
        violations.add("listed as both adjudicator and competitor: " + adjudicator.name());
      }
      adjudicator.conflicts().stream()
          .filter(name -> !competitors.containsKey(name))
          .sorted()
          .forEach(
              name ->
                  violations.add(
                      "conflict entry not in roster: " + adjudicator.name() + " -> " + name));
    }
  }

  private void checkPartnerships(Map<String, Competitor> competitors, List<String> violations) {
    competitors.values().stream()
        .filter(Competitor::hasPartner)
        .sorted((a, b) -> a.name().compareTo(b.name()))
        .forEach(
            competitor -> {
              final Competitor partner = competitors.get(competitor.partnerName());
              if (partner == null) {
                violations.add(
                    "partner not in roster: "
                        + competitor.name()
                        + " -> "
                        + competitor.partnerName());
              } else if (!competitor.name().equals(partner.partnerName())) {
                violations.add(
                    "partnership not mutual: " + competitor.name() + " -> " + partner.name());
              } else if (competitor.novice() != partner.novice()) {
                violations.add(
                    "partnership tier mismatch: " + competitor.name() + " -> " + partner.name());
              }
            });
  }
}
