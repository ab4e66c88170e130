/*
 * どこで: Pairing サービス層
 * 何を: エンジン結果を生成結果行と History 行へ変換する
 * なぜ: パネル対戦を「競技者 x 審査員」ごとの行へ非正規化して記録するため
 */
package com.debateleague.pairing.service;

import com.debateleague.pairing.config.PairingProperties;
import com.debateleague.pairing.engine.Pairing;
import com.debateleague.pairing.engine.RoundResult;
import com.debateleague.pairing.engine.Unit;
import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.GeneratedPairingRow;
import com.debateleague.pairing.model.HistoryRecord;
import com.debateleague.pairing.model.Side;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PairingResultMapper {

  private final PairingProperties properties;

  public List<GeneratedPairingRow> toGeneratedRows(List<RoundResult> rounds) {
    final List<GeneratedPairingRow> rows = new ArrayList<>();
    for (RoundResult round : rounds) {
      for (Pairing pairing : round.pairings()) {
        rows.add(
            new GeneratedPairingRow(
                pairing.roundNumber(),
                pairing.sideA().label(properties.fallbackMarker()),
                pairing.isBye()
                    ? properties.noOpponentLabel()
                    : pairing.sideB().label(properties.fallbackMarker()),
                String.join(properties.adjudicatorDelimiter(), pairing.adjudicators()),
                pairing.venue(),
                pairing.penalty()));
      }
    }
    return rows;
  }

  public List<HistoryRecord> toHistoryRecords(
      LocalDate eventDate, EventFormat format, List<RoundResult> rounds) {
    final List<HistoryRecord> records = new ArrayList<>();
    for (RoundResult round : rounds) {
      for (Pairing pairing : round.pairings()) {
        if (pairing.isBye()) {
          for (String member : pairing.sideA().members()) {
            records.add(
                new HistoryRecord(
                    eventDate,
                    format,
                    pairing.roundNumber(),
                    member,
                    pairing.sideA().fallback(),
                    Side.BYE,
                    null,
                    null,
                    null));
          }
          continue;
        }
        addSide(records, eventDate, format, pairing, Side.PROPOSITION);
        addSide(records, eventDate, format, pairing, Side.OPPOSITION);
      }
    }
    return records;
  }

  private void addSide(
      List<HistoryRecord> records,
      LocalDate eventDate,
      EventFormat format,
      Pairing pairing,
      Side side) {
    final Unit unit = side == Side.PROPOSITION ? pairing.sideA() : pairing.sideB();
    final Unit opponent = side == Side.PROPOSITION ? pairing.sideB() : pairing.sideA();
    for (String member : unit.members()) {
      for (String adjudicator : pairing.adjudicators()) {
        records.add(
            new HistoryRecord(
                eventDate,
                format,
                pairing.roundNumber(),
                member,
                unit.fallback(),
                side,
                opponent.key(),
                adjudicator,
                pairing.venue()));
      }
    }
  }
}
