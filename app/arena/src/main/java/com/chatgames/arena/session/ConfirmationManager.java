/*
 * どこで: Arena セッション管理
 * 何を: 合意終了の確認待ちを生成 id で保持し、承認/辞退/期限切れを裁定する
 * なぜ: 同一セッションへの確認待ちを 1 件に限り、二重の終了処理を起こさないため
 */
package com.chatgames.arena.session;

import com.chatgames.arena.config.ArenaProperties;
import com.chatgames.arena.model.ActionResult;
import com.chatgames.arena.model.Decision;
import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.RejectionCode;
import com.chatgames.arena.schedule.GameScheduler;
import com.chatgames.common.Ids;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfirmationManager {

  private static final Logger logger = LoggerFactory.getLogger(ConfirmationManager.class);

  private final SessionTerminator terminator;
  private final GameScheduler scheduler;
  private final ArenaProperties properties;
  private final Clock clock;
  private final ConcurrentMap<String, PendingConfirmation> confirmations =
      new ConcurrentHashMap<>();
  // sessionId -> confirmationId
  private final ConcurrentMap<String, String> bySession = new ConcurrentHashMap<>();

  public ActionResult<PendingConfirmation> create(
      GameSession session,
      Player requester,
      Player opponent,
      Consumer<PendingConfirmation> onExpired) {
    final String confirmationId = Ids.newId("cnf");
    if (bySession.putIfAbsent(session.sessionId(), confirmationId) != null) {
      return ActionResult.rejected(
          RejectionCode.CONFIRMATION_PENDING, "an end request is already waiting for an answer");
    }
    final Instant now = clock.instant();
    final PendingConfirmation confirmation =
        new PendingConfirmation(
            confirmationId,
            session,
            requester,
            opponent,
            now,
            now.plus(properties.confirmationTimeout()));
    confirmations.put(confirmationId, confirmation);
    confirmation.attachExpiry(
        scheduler.after(
            properties.confirmationTimeout(),
            () -> expire(confirmationId).ifPresent(onExpired)));
    logger.info(
        "end request created confirmationId={} sessionId={} requester={}",
        confirmationId,
        session.sessionId(),
        requester.id());
    return ActionResult.ok(confirmation);
  }

  public Optional<PendingConfirmation> find(String confirmationId) {
    return Optional.ofNullable(confirmations.get(confirmationId));
  }

  /**
   * 役割: 確認待ちを承認/辞退で解決する。
   * 動作:
   * - 承認: セッションを合意終了として確定(結果記録を含む)してから確認待ちを外す。
   * - 辞退: 確認待ちだけを外し、セッションには触れない。
   * - 期限切れ/解決済みなら空(NotFound)。
   */
  public Optional<ConfirmationOutcome> resolve(String confirmationId, Decision decision) {
    final PendingConfirmation confirmation = confirmations.get(confirmationId);
    if (confirmation == null || !confirmation.claim()) {
      return Optional.empty();
    }
    confirmation.cancelExpiry();
    try {
      boolean ended = false;
      if (decision == Decision.ACCEPT) {
        ended = terminator.finish(confirmation.session(), EndReason.AGREEMENT).isPresent();
      }
      logger.info(
          "end request resolved confirmationId={} decision={} sessionEnded={}",
          confirmationId,
          decision,
          ended);
      return Optional.of(new ConfirmationOutcome(confirmation, decision, ended));
    } finally {
      discard(confirmation);
    }
  }

  public Optional<PendingConfirmation> expire(String confirmationId) {
    final PendingConfirmation confirmation = confirmations.get(confirmationId);
    if (confirmation == null || !confirmation.claim()) {
      return Optional.empty();
    }
    discard(confirmation);
    logger.info("end request expired confirmationId={}", confirmationId);
    return Optional.of(confirmation);
  }

  /** 描画失敗時の取り下げ。既に他経路で解決されていれば false。 */
  public boolean withdraw(PendingConfirmation confirmation) {
    if (!confirmation.claim()) {
      return false;
    }
    confirmation.cancelExpiry();
    discard(confirmation);
    return true;
  }

  /** セッションが別経路で終わったときに残った確認待ちを片付ける。 */
  public Optional<PendingConfirmation> discardForSession(String sessionId) {
    final String confirmationId = bySession.get(sessionId);
    if (confirmationId == null) {
      return Optional.empty();
    }
    final PendingConfirmation confirmation = confirmations.get(confirmationId);
    if (confirmation == null || !withdraw(confirmation)) {
      return Optional.empty();
    }
    return Optional.of(confirmation);
  }

  public int pendingCount() {
    return confirmations.size();
  }

  private void discard(PendingConfirmation confirmation) {
    confirmations.remove(confirmation.confirmationId(), confirmation);
    bySession.remove(confirmation.session().sessionId(), confirmation.confirmationId());
  }
}
