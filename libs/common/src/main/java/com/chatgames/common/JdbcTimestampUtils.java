/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC へ渡す Instant を Timestamp に明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを回避するため
 */
package com.chatgames.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC。null はそのまま null としてバインドする
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
