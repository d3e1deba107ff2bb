/*
 * どこで: Arena セッション管理
 * 何を: セッションの終了確定 -> 結果記録 -> 登録解除 -> 終了描画を 1 経路で行う
 * なぜ: 決着/合意/AFK のどの経路でも記録は 1 回だけ、かつ終了済みセッションを登録に残さないため
 */
package com.chatgames.arena.session;

import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.render.ChannelUnreachableException;
import com.chatgames.arena.render.GameRenderer;
import com.chatgames.arena.repository.GameResultRecorder;
import com.chatgames.arena.service.ArenaMetrics;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SessionTerminator {

  private static final Logger logger = LoggerFactory.getLogger(SessionTerminator.class);

  private final SessionRegistry registry;
  private final GameResultRecorder recorder;
  private final GameRenderer renderer;
  private final ArenaMetrics metrics;
  private final Clock clock;

  /**
   * 役割: セッションを終了させる。
   * 動作:
   * - 既に終了済みなら何もせず空を返す(後着の終了要求は no-op)。
   * - 結果記録の失敗はログに残して続行し、登録解除は必ず行う。
   * - 描画先チャンネルが無くても終了は成立する。
   */
  public Optional<GameResult> finish(GameSession session, EndReason reason) {
    final Optional<GameResult> terminal = session.markTerminal(reason, clock.instant());
    if (terminal.isEmpty()) {
      return Optional.empty();
    }
    final GameResult result = terminal.get();
    try {
      recordResult(result);
    } finally {
      registry.remove(session.channelId(), session);
      if (reason == EndReason.COMPLETED) {
        registry.rememberFinished(session, result.endedAt());
      }
      metrics.updateActiveSessions(registry.activeCount());
    }
    metrics.recordSessionEnded(result.kind().value(), reason.name().toLowerCase(Locale.ROOT));
    logger.info(
        "session finished sessionId={} channelId={} kind={} reason={} winner={}",
        result.sessionId(),
        result.channelId(),
        result.kind().value(),
        reason,
        result.winnerId());
    renderGameOver(session, result);
    return terminal;
  }

  private void recordResult(GameResult result) {
    try {
      recorder.record(result);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("persist");
      logger.warn(
          "game result recording failed sessionId={} kind={}",
          result.sessionId(),
          result.kind().value(),
          ex);
    }
  }

  private void renderGameOver(GameSession session, GameResult result) {
    try {
      renderer.renderGameOver(session.snapshot(), result);
    } catch (ChannelUnreachableException ex) {
      metrics.recordDependencyError("channel_unreachable");
      logger.warn(
          "channel unreachable while rendering game over sessionId={} channelId={}",
          session.sessionId(),
          session.channelId());
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("render");
      logger.warn("game over rendering failed sessionId={}", session.sessionId(), ex);
    }
  }
}
