/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalDate を SQL 型に明示変換する
 * なぜ: PostgreSQL JDBC が java.time 型の推論に失敗するケースを回避するため
 */
package com.debateleague.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // 開催日は時刻を持たないため DATE 列へそのまま渡す
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }
}
