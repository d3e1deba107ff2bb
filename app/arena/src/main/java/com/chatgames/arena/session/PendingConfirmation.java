package com.chatgames.arena.session;

import com.chatgames.arena.model.ConfirmationView;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.schedule.CancelHandle;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** 合意終了の確認待ち。claim() を最初に取った解決経路(承認/辞退/期限切れ)だけが処理を進める。 */
public final class PendingConfirmation {

  private final String confirmationId;
  private final GameSession session;
  private final Player requester;
  private final Player opponent;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final AtomicBoolean claimed = new AtomicBoolean(false);

  private volatile String messageRef;
  private volatile CancelHandle expiry;

  public PendingConfirmation(
      String confirmationId,
      GameSession session,
      Player requester,
      Player opponent,
      Instant createdAt,
      Instant expiresAt) {
    this.confirmationId = confirmationId;
    this.session = session;
    this.requester = requester;
    this.opponent = opponent;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public ConfirmationView view() {
    return new ConfirmationView(
        confirmationId,
        session.sessionId(),
        session.channelId(),
        requester,
        opponent,
        createdAt,
        expiresAt);
  }

  boolean claim() {
    return claimed.compareAndSet(false, true);
  }

  void attachExpiry(CancelHandle handle) {
    this.expiry = handle;
    if (claimed.get()) {
      handle.cancel();
    }
  }

  void cancelExpiry() {
    final CancelHandle handle = expiry;
    if (handle != null) {
      handle.cancel();
    }
  }

  public void attachMessage(String ref) {
    this.messageRef = ref;
  }

  public Optional<String> messageRef() {
    return Optional.ofNullable(messageRef);
  }

  public String confirmationId() {
    return confirmationId;
  }

  public GameSession session() {
    return session;
  }

  public Player requester() {
    return requester;
  }

  public Player opponent() {
    return opponent;
  }
}
