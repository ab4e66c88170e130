/*
 * どこで: Pairing データアクセス
 * 何を: 過去対戦 (history) の読み込みと今回結果の追記を行う
 * なぜ: 集計の入力と生成結果の記録を同じ行形式で扱うため
 */
package com.debateleague.pairing.repository;

import static com.debateleague.common.JdbcTimestampUtils.toSqlDate;

import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.HistoryRecord;
import com.debateleague.pairing.model.Side;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class HistoryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<HistoryRecord> findByFormat(EventFormat format) {
    final String sql =
        """
        SELECT event_date, format, round_number, competitor_name, fallback_unit,
               side, opponent_unit, adjudicator_name, venue_name
        FROM history
        WHERE format = :format
        ORDER BY event_date, round_number, id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("format", format.value());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int insertAll(List<HistoryRecord> records) {
    if (records.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO history (
          event_date, format, round_number, competitor_name, fallback_unit,
          side, opponent_unit, adjudicator_name, venue_name
        ) VALUES (
          :eventDate, :format, :roundNumber, :competitorName, :fallbackUnit,
          :side, :opponentUnit, :adjudicatorName, :venueName
        )
        """;
    final MapSqlParameterSource[] batch =
        records.stream().map(this::toParams).toArray(MapSqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch).length;
  }

  private MapSqlParameterSource toParams(HistoryRecord record) {
    return new MapSqlParameterSource()
        .addValue("eventDate", toSqlDate(record.eventDate()))
        .addValue("format", record.format().value())
        .addValue("roundNumber", record.roundNumber())
        .addValue("competitorName", record.competitorName())
        .addValue("fallbackUnit", record.fallbackUnit())
        .addValue("side", record.side() == null ? null : record.side().name())
        .addValue("opponentUnit", record.opponentUnit())
        .addValue("adjudicatorName", record.adjudicatorName())
        .addValue("venueName", record.venueName());
  }

  private HistoryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Date eventDate = rs.getDate("event_date");
    final String side = rs.getString("side");
    return new HistoryRecord(
        eventDate == null ? null : eventDate.toLocalDate(),
        EventFormat.fromValue(rs.getString("format")),
        rs.getInt("round_number"),
        rs.getString("competitor_name"),
        rs.getBoolean("fallback_unit"),
        side == null || side.isBlank() ? null : Side.valueOf(side),
        rs.getString("opponent_unit"),
        rs.getString("adjudicator_name"),
        rs.getString("venue_name"));
  }
}
