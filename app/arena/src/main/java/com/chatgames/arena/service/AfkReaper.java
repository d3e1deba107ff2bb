/*
 * どこで: Arena サービス層
 * 何を: 無操作時間が閾値を超えたセッションを AFK として終了させ、期限切れの再戦候補を掃除する
 * なぜ: 放置されたセッションでチャンネルが塞がり続けないようにするため
 */
package com.chatgames.arena.service;

import com.chatgames.arena.config.ArenaProperties;
import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.session.ConfirmationManager;
import com.chatgames.arena.session.GameSession;
import com.chatgames.arena.session.SessionRegistry;
import com.chatgames.arena.session.SessionTerminator;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AfkReaper {

  private static final Logger logger = LoggerFactory.getLogger(AfkReaper.class);

  private final SessionRegistry sessionRegistry;
  private final SessionTerminator terminator;
  private final ConfirmationManager confirmationManager;
  private final ArenaProperties properties;
  private final ArenaMetrics metrics;

  /**
   * 役割: 1 回分の AFK 判定を行う。
   * 動作: 無操作時間が afk-timeout を厳密に超えたセッションだけを終了させる。
   * 1 セッションの失敗は残りの判定を止めない。
   * 戻り値: この回で終了させたセッション数。
   */
  public int sweep(Instant now) {
    int reaped = 0;
    for (GameSession session : sessionRegistry.activeSessions()) {
      if (session.isTerminal() || session.idleFor(now).compareTo(properties.afkTimeout()) <= 0) {
        continue;
      }
      MDC.put("channel_id", session.channelId());
      MDC.put("session_id", session.sessionId());
      try {
        if (terminator.finish(session, EndReason.AFK).isPresent()) {
          confirmationManager.discardForSession(session.sessionId());
          reaped++;
          logger.info(
              "session reaped for inactivity sessionId={} idleSeconds={}",
              session.sessionId(),
              session.idleFor(now).toSeconds());
        }
      } catch (RuntimeException ex) {
        logger.warn("afk sweep failed sessionId={}", session.sessionId(), ex);
        metrics.recordDependencyError("reaper_loop");
      } finally {
        MDC.remove("session_id");
        MDC.remove("channel_id");
      }
    }
    final int evicted = sessionRegistry.evictFinishedBefore(now.minus(properties.rematchWindow()));
    if (evicted > 0) {
      logger.debug("rematch offers expired count={}", evicted);
    }
    return reaped;
  }
}
