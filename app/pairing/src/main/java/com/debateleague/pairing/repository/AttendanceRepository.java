/*
 * どこで: Pairing データアクセス
 * 何を: 開催日の出欠を読み込む
 * なぜ: present の人だけをエンジンへ見せるため
 */
package com.debateleague.pairing.repository;

import static com.debateleague.common.JdbcTimestampUtils.toSqlDate;

import com.debateleague.pairing.model.AttendanceStatus;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AttendanceRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Set<String> findPresentNames(LocalDate eventDate) {
    final String sql =
        """
        SELECT name
        FROM attendance
        WHERE event_date = :eventDate AND status = :status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventDate", toSqlDate(eventDate))
            .addValue("status", AttendanceStatus.PRESENT.name());
    return new HashSet<>(jdbcTemplate.queryForList(sql, params, String.class));
  }
}
