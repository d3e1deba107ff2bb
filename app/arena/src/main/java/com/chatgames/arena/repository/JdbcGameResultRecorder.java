/*
 * どこで: Arena データアクセス
 * 何を: game_results へ結果を 1 行記録し、player_stats の勝敗を加算する
 * なぜ: 戦績を PostgreSQL に永続化し、同一セッションの二重記録を DB 制約で防ぐため
 */
package com.chatgames.arena.repository;

import static com.chatgames.common.JdbcTimestampUtils.toTimestamp;

import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.Player;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@ConditionalOnProperty(name = "arena.stats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class JdbcGameResultRecorder implements GameResultRecorder {

  private static final Logger logger = LoggerFactory.getLogger(JdbcGameResultRecorder.class);

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: 結果 1 件を記録し、両プレイヤーの勝敗を加算する。
   * 動作: 勝者なし(引き分け/合意/AFK/描画先消失)は両者に 1 敗を付ける。session_id が記録済みなら何もしない。
   */
  @Override
  @Transactional
  public void record(GameResult result) {
    if (!insertResult(result)) {
      logger.info("game result already recorded sessionId={}", result.sessionId());
      return;
    }
    final String gameId = result.kind().statsGameId();
    if (result.hasNoWinner()) {
      upsertStats(result.player1(), gameId, 0, 1, result.endedAt());
      upsertStats(result.player2(), gameId, 0, 1, result.endedAt());
      return;
    }
    upsertStats(result.winner(), gameId, 1, 0, result.endedAt());
    upsertStats(result.loser(), gameId, 0, 1, result.endedAt());
  }

  public Optional<PlayerStats> findStats(String userId, String gameId) {
    final String sql =
        """
        SELECT user_id, game_id, display_name, wins, losses
        FROM player_stats
        WHERE user_id = :userId AND game_id = :gameId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("gameId", gameId);
    final List<PlayerStats> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new PlayerStats(
                    rs.getString("user_id"),
                    rs.getString("game_id"),
                    rs.getString("display_name"),
                    rs.getInt("wins"),
                    rs.getInt("losses")));
    return rows.stream().findFirst();
  }

  private boolean insertResult(GameResult result) {
    final String sql =
        """
        INSERT INTO game_results (
          session_id, game_id, game_kind, channel_id, player1_id, player2_id, winner_id,
          player1_score, player2_score, end_reason, ended_at)
        VALUES (
          :sessionId, :gameId, :gameKind, :channelId, :player1Id, :player2Id, :winnerId,
          :player1Score, :player2Score, :endReason, :endedAt)
        ON CONFLICT (session_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", result.sessionId())
            .addValue("gameId", result.kind().statsGameId())
            .addValue("gameKind", result.kind().name())
            .addValue("channelId", result.channelId())
            .addValue("player1Id", result.player1().id())
            .addValue("player2Id", result.player2().id())
            .addValue("winnerId", result.winnerId())
            .addValue("player1Score", result.player1Score())
            .addValue("player2Score", result.player2Score())
            .addValue("endReason", result.reason().name())
            .addValue("endedAt", toTimestamp(result.endedAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  private void upsertStats(Player player, String gameId, int wins, int losses, Instant updatedAt) {
    final String sql =
        """
        INSERT INTO player_stats (user_id, game_id, display_name, wins, losses, updated_at)
        VALUES (:userId, :gameId, :displayName, :wins, :losses, :updatedAt)
        ON CONFLICT (user_id, game_id) DO UPDATE SET
          display_name = EXCLUDED.display_name,
          wins = player_stats.wins + EXCLUDED.wins,
          losses = player_stats.losses + EXCLUDED.losses,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", player.id())
            .addValue("gameId", gameId)
            .addValue("displayName", player.displayName())
            .addValue("wins", wins)
            .addValue("losses", losses)
            .addValue("updatedAt", toTimestamp(updatedAt));
    jdbcTemplate.update(sql, params);
  }
}
