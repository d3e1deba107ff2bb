package com.chatgames.arena.repository;

import com.chatgames.arena.model.GameResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** 戦績 DB を持たない構成向け。結果はログにだけ残す。 */
@Component
@ConditionalOnProperty(name = "arena.stats.enabled", havingValue = "false")
public class LoggingGameResultRecorder implements GameResultRecorder {

  private static final Logger logger = LoggerFactory.getLogger(LoggingGameResultRecorder.class);

  @Override
  public void record(GameResult result) {
    logger.info(
        "game result sessionId={} kind={} channelId={} player1={} player2={} winner={} reason={}",
        result.sessionId(),
        result.kind(),
        result.channelId(),
        result.player1().id(),
        result.player2().id(),
        result.winnerId(),
        result.reason());
  }
}
