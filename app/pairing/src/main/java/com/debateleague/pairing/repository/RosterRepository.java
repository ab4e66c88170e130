/*
 * どこで: Pairing データアクセス
 * 何を: 形式ごとの競技者/審査員/会場の名簿を読み込む
 * なぜ: エンジンへ渡す入力を名簿テーブルから組み立てるため
 */
package com.debateleague.pairing.repository;

import com.debateleague.pairing.config.PairingProperties;
import com.debateleague.pairing.model.Adjudicator;
import com.debateleague.pairing.model.Competitor;
import com.debateleague.pairing.model.EventFormat;
import com.debateleague.pairing.model.Roster;
import com.debateleague.pairing.model.Venue;
import com.google.common.annotations.VisibleForTesting;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RosterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final PairingProperties properties;

  public Roster loadRoster(EventFormat format) {
    return new Roster(
        format, findCompetitors(format), findAdjudicators(format), findVenues(format));
  }

  public List<Competitor> findCompetitors(EventFormat format) {
    final String sql =
        """
        SELECT name, format, partner_name, novice
        FROM competitors
        WHERE format = :format
        ORDER BY name
        """;
    return jdbcTemplate.query(sql, formatParam(format), this::mapCompetitor);
  }

  public List<Adjudicator> findAdjudicators(EventFormat format) {
    final String sql =
        """
        SELECT name, format, conflicts
        FROM adjudicators
        WHERE format = :format
        ORDER BY name
        """;
    return jdbcTemplate.query(sql, formatParam(format), this::mapAdjudicator);
  }

  public List<Venue> findVenues(EventFormat format) {
    final String sql =
        """
        SELECT name, format
        FROM venues
        WHERE format = :format
        ORDER BY id
        """;
    return jdbcTemplate.query(
        sql,
        formatParam(format),
        (rs, rowNum) ->
            new Venue(rs.getString("name"), EventFormat.fromValue(rs.getString("format"))));
  }

  // 区切り文字で分割し、空要素と前後の空白を取り除く
  @VisibleForTesting
  Set<String> parseConflicts(String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(raw.split(Pattern.quote(properties.conflictDelimiter())))
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private MapSqlParameterSource formatParam(EventFormat format) {
    return new MapSqlParameterSource().addValue("format", format.value());
  }

  private Competitor mapCompetitor(ResultSet rs, int rowNum) throws SQLException {
    return new Competitor(
        rs.getString("name"),
        EventFormat.fromValue(rs.getString("format")),
        rs.getString("partner_name"),
        rs.getBoolean("novice"));
  }

  private Adjudicator mapAdjudicator(ResultSet rs, int rowNum) throws SQLException {
    return new Adjudicator(
        rs.getString("name"),
        EventFormat.fromValue(rs.getString("format")),
        parseConflicts(rs.getString("conflicts")));
  }
}
