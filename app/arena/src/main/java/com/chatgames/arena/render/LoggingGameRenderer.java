/*
 * どこで: Arena 描画連携
 * 何を: 描画要求をログ出力のみで処理する
 * なぜ: チャット基盤アダプタ未接続の環境でも API 経由で対戦を進め、挙動をログで追えるようにするため
 */
package com.chatgames.arena.render;

import com.chatgames.arena.model.ChallengeView;
import com.chatgames.arena.model.ConfirmationView;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.SessionSnapshot;
import com.chatgames.common.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingGameRenderer implements GameRenderer {

  private static final Logger logger = LoggerFactory.getLogger(LoggingGameRenderer.class);

  @Override
  public String renderChallenge(ChallengeView challenge) {
    final String messageRef = Ids.newId("msg");
    logger.info(
        "render challenge messageRef={} challengeId={} channelId={} kind={} proposer={} target={}",
        messageRef,
        challenge.challengeId(),
        challenge.channelId(),
        challenge.params().kind().value(),
        challenge.proposer().id(),
        challenge.target().id());
    return messageRef;
  }

  @Override
  public String renderConfirmation(ConfirmationView confirmation) {
    final String messageRef = Ids.newId("msg");
    logger.info(
        "render confirmation messageRef={} confirmationId={} channelId={} requester={} opponent={}",
        messageRef,
        confirmation.confirmationId(),
        confirmation.channelId(),
        confirmation.requester().id(),
        confirmation.opponent().id());
    return messageRef;
  }

  @Override
  public void renderBoard(SessionSnapshot session, String statusText) {
    logger.info(
        "render board sessionId={} channelId={} phase={} status={} cells={}",
        session.sessionId(),
        session.channelId(),
        session.phase(),
        statusText,
        session.cells());
  }

  @Override
  public void renderGameOver(SessionSnapshot session, GameResult result) {
    logger.info(
        "render game over sessionId={} channelId={} reason={} winner={} scores={}",
        session.sessionId(),
        session.channelId(),
        result.reason(),
        result.winnerId(),
        session.scores());
  }

  @Override
  public void deleteMessage(String channelId, String messageRef) {
    logger.info("delete message channelId={} messageRef={}", channelId, messageRef);
  }

  @Override
  public void editMessage(String channelId, String messageRef, String text) {
    logger.info("edit message channelId={} messageRef={} text={}", channelId, messageRef, text);
  }
}
