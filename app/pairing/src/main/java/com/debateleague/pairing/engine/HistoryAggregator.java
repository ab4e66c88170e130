/*
 * どこで: Pairing エンジン
 * 何を: History フィードの行を HistoryView へ集計する
 * なぜ: パネル対戦の非正規化行を 1 試合 1 回として数え直すため
 */
package com.debateleague.pairing.engine;

import com.debateleague.pairing.model.HistoryRecord;
import com.debateleague.pairing.model.Side;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HistoryAggregator {

  private static final Logger logger = LoggerFactory.getLogger(HistoryAggregator.class);

  /**
   * 役割: 1 形式分の History 行から HistoryView を作る。
   * 動作: 同一 (日付, ラウンド, 競技者) の行は BYE/サイド/対戦相手を 1 回だけ数え、審査員は行ごとに数える。
   *     審査員の会場利用は (日付, ラウンド, 審査員) ごとに 1 回数える。競技者名のない行は読み飛ばす。
   */
  public HistoryView aggregate(List<HistoryRecord> rows) {
    final HistoryView view = new HistoryView();
    final Set<String> seenOccupancies = new HashSet<>();
    final Set<String> seenVenueUses = new HashSet<>();
    int skipped = 0;
    for (HistoryRecord row : rows) {
      if (row == null || isBlank(row.competitorName())) {
        skipped++;
        continue;
      }
      final CompetitorHistory history = view.competitorForUpdate(row.competitorName());
      final String matchKey = row.eventDate() + "|" + row.roundNumber();
      if (seenOccupancies.add(matchKey + "|" + row.competitorName())) {
        recordOccupancy(history, row);
      }
      if (!isBlank(row.adjudicatorName())) {
        history.recordAdjudicator(row.adjudicatorName());
        if (!isBlank(row.venueName())
            && seenVenueUses.add(matchKey + "|" + row.adjudicatorName())) {
          view.adjudicatorForUpdate(row.adjudicatorName()).recordVenue(row.venueName());
        }
      }
    }
    if (skipped > 0) {
      logger.debug("history rows skipped reason=missing_competitor count={}", skipped);
    }
    return view;
  }

  private void recordOccupancy(CompetitorHistory history, HistoryRecord row) {
    if (row.side() == Side.BYE) {
      history.recordBye();
      return;
    }
    if (row.side() != null) {
      history.recordSide(row.side());
    }
    if (!isBlank(row.opponentUnit())) {
      history.recordOpponent(row.opponentUnit());
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
