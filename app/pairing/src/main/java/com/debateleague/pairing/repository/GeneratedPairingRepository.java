/*
 * どこで: Pairing データアクセス
 * 何を: 生成した組み合わせを generated_pairings へ保存/参照する
 * なぜ: 表示層が読む生成結果テーブルを更新するため
 */
package com.debateleague.pairing.repository;

import static com.debateleague.common.JdbcTimestampUtils.toSqlDate;
import static com.debateleague.common.JdbcTimestampUtils.toTimestamp;

import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.GeneratedPairingRow;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class GeneratedPairingRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockEvent(long lockKey) {
    // 同一大会 (形式 + 開催日) の生成をトランザクション内で直列化する
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public boolean existsByEvent(EventFormat format, LocalDate eventDate) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM generated_pairings
          WHERE format = :format AND event_date = :eventDate
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("format", format.value())
            .addValue("eventDate", toSqlDate(eventDate));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public int insertAll(
      String runId,
      LocalDate eventDate,
      EventFormat format,
      List<GeneratedPairingRow> rows,
      Instant createdAt) {
    if (rows.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO generated_pairings (
          run_id, event_date, format, round_number, side_a, side_b,
          adjudicators, venue, penalty, created_at
        ) VALUES (
          :runId, :eventDate, :format, :roundNumber, :sideA, :sideB,
          :adjudicators, :venue, :penalty, :createdAt
        )
        """;
    final MapSqlParameterSource[] batch =
        rows.stream()
            .map(
                row ->
                    new MapSqlParameterSource()
                        .addValue("runId", runId)
                        .addValue("eventDate", toSqlDate(eventDate))
                        .addValue("format", format.value())
                        .addValue("roundNumber", row.roundNumber())
                        .addValue("sideA", row.sideA())
                        .addValue("sideB", row.sideB())
                        .addValue("adjudicators", row.adjudicators())
                        .addValue("venue", row.venue())
                        .addValue("penalty", row.penalty())
                        .addValue("createdAt", toTimestamp(createdAt)))
            .toArray(MapSqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch).length;
  }

  public List<GeneratedPairingRow> findByEvent(EventFormat format, LocalDate eventDate) {
    final String sql =
        """
        SELECT round_number, side_a, side_b, adjudicators, venue, penalty
        FROM generated_pairings
        WHERE format = :format AND event_date = :eventDate
        ORDER BY round_number, id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("format", format.value())
            .addValue("eventDate", toSqlDate(eventDate));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new GeneratedPairingRow(
                rs.getInt("round_number"),
                rs.getString("side_a"),
                rs.getString("side_b"),
                rs.getString("adjudicators"),
                rs.getString("venue"),
                rs.getInt("penalty")));
  }
}
