package com.debateleague.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void toTimestampKeepsInstant() {
    final Instant instant = Instant.parse("2026-10-19T09:00:00Z");

    assertThat(JdbcTimestampUtils.toTimestamp(instant).toInstant()).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
  }

  @Test
  void toSqlDateKeepsCalendarDate() {
    final LocalDate date = LocalDate.of(2026, 10, 19);

    assertThat(JdbcTimestampUtils.toSqlDate(date).toLocalDate()).isEqualTo(date);
    assertThat(JdbcTimestampUtils.toSqlDate(null)).isNull();
  }

  @Test
  void newRunIdCarriesPrefix() {
    assertThat(TraceIds.newRunId("team")).startsWith("team-").hasSize("team-".length() + 36);
  }
}
