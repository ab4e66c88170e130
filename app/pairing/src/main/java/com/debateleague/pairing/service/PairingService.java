package com.debateleague.pairing.service;

import com.debateleague.common.TraceIds;
import com.debateleague.pairing.api.InvalidPairingRequestException;
import com.debateleague.pairing.api.PairingAlreadyGeneratedException;
import com.debateleague.pairing.api.response.PairingListResponse;
import com.debateleague.pairing.api.response.PairingPayload;
import com.debateleague.pairing.api.response.PairingRunResponse;
import com.debateleague.pairing.engine.HistoryAggregator;
import com.debateleague.pairing.engine.HistoryView;
import com.debateleague.pairing.engine.PairingEngine;
import com.debateleague.pairing.engine.RoundResult;
import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.GeneratedPairingRow;
import com.debateleague.pairing.model.Roster;
import com.debateleague.pairing.repository.AttendanceRepository;
import com.debateleague.pairing.repository.GeneratedPairingRepository;
import com.debateleague.pairing.repository.HistoryRepository;
import com.debateleague.pairing.repository.RosterRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PairingService {

  private static final Logger logger = LoggerFactory.getLogger(PairingService.class);

  private final RosterRepository rosterRepository;
  private final AttendanceRepository attendanceRepository;
  private final HistoryRepository historyRepository;
  private final GeneratedPairingRepository generatedPairingRepository;
  private final RosterIntegrityChecker integrityChecker;
  private final HistoryAggregator historyAggregator;
  private final PairingEngine pairingEngine;
  private final PairingResultMapper resultMapper;
  private final PairingMetrics metrics;
  private final EventLockKeyGenerator lockKeyGenerator;
  private final Clock clock;

  /**
   * 役割: 1 大会分の組み合わせを生成し、生成結果と History を保存する。
   * 動作: 名簿検査 → 出欠適用 → History 集計 → エンジン実行がすべて成功した後にだけ書き込む。
   *     いずれかが失敗した場合は 1 つの例外を送出し、何も保存しない。
   *     同じ形式/開催日が生成済みなら PairingAlreadyGeneratedException で拒否する。
   */
  @Transactional
  public PairingRunResponse generate(String format, LocalDate eventDate) {
    final EventFormat eventFormat = parseFormat(format);
    if (eventDate == null) {
      throw new InvalidPairingRequestException("event_date is required");
    }
    final Instant startedAt = Instant.now(clock);
    try {
      generatedPairingRepository.lockEvent(lockKeyGenerator.generate(eventFormat, eventDate));
      if (generatedPairingRepository.existsByEvent(eventFormat, eventDate)) {
        throw new PairingAlreadyGeneratedException(eventFormat.value(), eventDate.toString());
      }
      final Roster roster = rosterRepository.loadRoster(eventFormat);
      integrityChecker.check(roster);
      final Roster present = roster.presentOnly(attendanceRepository.findPresentNames(eventDate));
      final HistoryView view =
          historyAggregator.aggregate(historyRepository.findByFormat(eventFormat));
      final List<RoundResult> rounds = pairingEngine.generate(present, view);

      final List<GeneratedPairingRow> rows = resultMapper.toGeneratedRows(rounds);
      final String runId = TraceIds.newRunId(eventFormat.value());
      // 書き込みは全ステップ成功後のこの 2 回だけ (同一トランザクション)
      generatedPairingRepository.insertAll(runId, eventDate, eventFormat, rows, Instant.now(clock));
      historyRepository.insertAll(resultMapper.toHistoryRecords(eventDate, eventFormat, rounds));

      recordSuccess(eventFormat, eventDate, runId, rounds);
      return new PairingRunResponse(
          runId,
          eventFormat.value(),
          eventDate.toString(),
          rows.stream().map(PairingPayload::from).toList());
    } catch (RuntimeException ex) {
      logger.warn(
          "pairing generation failed format={} eventDate={} error={} reason={}",
          eventFormat.value(),
          eventDate,
          ex.getClass().getSimpleName(),
          ex.getMessage());
      metrics.recordRun(eventFormat.value(), "failed");
      throw ex;
    } finally {
      metrics.recordDuration(eventFormat.value(), Duration.between(startedAt, Instant.now(clock)));
    }
  }

  public PairingListResponse list(String format, LocalDate eventDate) {
    final EventFormat eventFormat = parseFormat(format);
    if (eventDate == null) {
      throw new InvalidPairingRequestException("event_date is required");
    }
    final List<PairingPayload> pairings =
        generatedPairingRepository.findByEvent(eventFormat, eventDate).stream()
            .map(PairingPayload::from)
            .toList();
    return new PairingListResponse(eventFormat.value(), eventDate.toString(), pairings);
  }

  private EventFormat parseFormat(String format) {
    if (format == null || format.isBlank()) {
      throw new InvalidPairingRequestException("format is required");
    }
    try {
      return EventFormat.fromValue(format);
    } catch (IllegalArgumentException ex) {
      throw new InvalidPairingRequestException(ex.getMessage());
    }
  }

  private void recordSuccess(
      EventFormat format, LocalDate eventDate, String runId, List<RoundResult> rounds) {
    final int totalPenalty = rounds.stream().mapToInt(RoundResult::totalPenalty).sum();
    final int unused = rounds.stream().mapToInt(RoundResult::unusedAdjudicators).sum();
    final long pairings = rounds.stream().mapToLong(round -> round.pairings().size()).sum();
    final long byes = rounds.stream().filter(round -> round.byeUnit() != null).count();
    metrics.recordRun(format.value(), "generated");
    metrics.recordPenalty(format.value(), totalPenalty);
    metrics.recordUnusedAdjudicators(format.value(), unused);
    logger.info(
        "pairings generated format={} eventDate={} runId={} pairings={} byes={} totalPenalty={}",
        format.value(),
        eventDate,
        runId,
        pairings,
        byes,
        totalPenalty);
  }
}
