/*
 * どこで: Pairing エンジン
 * 何を: 出席競技者から対戦単位 (Unit) を作る
 * なぜ: チーム形式の相方欠席を単独 Unit で補い、全員を必ず 1 つの Unit に入れるため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.config.PairingProperties;
import com.debateleague.pairing.model.Competitor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UnitFormation {

  private final PairingProperties properties;
  private final FallbackHistoryPolicy fallbackHistoryPolicy;

  // 2 ラウンド形式: 競技者 1 人 = 1 Unit
  public List<Unit> formSingles(List<Competitor> competitors, HistoryView view) {
    return competitors.stream()
        .sorted(Comparator.comparing(Competitor::name))
        .map(
            competitor ->
                new Unit(
                    competitor.name(),
                    List.of(competitor.name()),
                    false,
                    competitor.novice(),
                    view.competitor(competitor.name())))
        .toList();
  }

  /**
   * 役割: チーム形式の Unit を作る。
   * 動作: 相方が出席していて相互に指名している場合は 2 人 Unit、それ以外は単独 Unit にする。
   *     名前順に処理するため、入力順に関係なく同じ Unit 集合になる。
   */
  public List<Unit> formTeams(List<Competitor> competitors, HistoryView view) {
    final Map<String, Competitor> available = new LinkedHashMap<>();
    competitors.stream()
        .sorted(Comparator.comparing(Competitor::name))
        .forEach(c -> available.put(c.name(), c));
    final Set<String> claimed = new HashSet<>();
    final List<Unit> units = new ArrayList<>();
    for (Competitor competitor : available.values()) {
      if (!claimed.add(competitor.name())) {
        continue;
      }
      final Competitor partner = mutualPartner(competitor, available);
      if (partner != null && claimed.add(partner.name())) {
        units.add(toUnit(List.of(competitor.name(), partner.name()), false, competitor, view));
      } else {
        units.add(toUnit(List.of(competitor.name()), true, competitor, view));
      }
    }
    return units;
  }

  // メンバー名を辞書順に並べて連結した正規キー (対戦相手の識別にも使う)
  public static String unitKey(Collection<String> memberNames, String delimiter) {
    return String.join(delimiter, memberNames.stream().sorted().toList());
  }

  private Competitor mutualPartner(Competitor competitor, Map<String, Competitor> available) {
    if (!competitor.hasPartner()) {
      return null;
    }
    final Competitor partner = available.get(competitor.partnerName());
    if (partner == null || !competitor.name().equals(partner.partnerName())) {
      return null;
    }
    return partner;
  }

  private Unit toUnit(
      List<String> memberNames, boolean fallback, Competitor representative, HistoryView view) {
    final List<String> sorted = memberNames.stream().sorted().toList();
    final String inheritFrom = fallbackHistoryPolicy.chooseMember(sorted, view);
    return new Unit(
        unitKey(sorted, properties.unitKeyDelimiter()),
        sorted,
        fallback,
        representative.novice(),
        view.competitor(inheritFrom));
  }
}
