package com.chatgames.arena.session;

import com.chatgames.arena.model.ChallengeParams;
import com.chatgames.arena.model.ChallengeView;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.schedule.CancelHandle;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** 承認待ちの挑戦。期限タイマーのハンドルを自身で保持し、解決時に取り消す。 */
public final class PendingChallenge {

  private final String challengeId;
  private final Player proposer;
  private final Player target;
  private final String channelId;
  private final ChallengeParams params;
  private final Instant createdAt;
  private final Instant expiresAt;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private volatile String messageRef;
  private volatile CancelHandle expiry;

  public PendingChallenge(
      String challengeId,
      Player proposer,
      Player target,
      String channelId,
      ChallengeParams params,
      Instant createdAt,
      Instant expiresAt) {
    this.challengeId = challengeId;
    this.proposer = proposer;
    this.target = target;
    this.channelId = channelId;
    this.params = params;
    this.createdAt = createdAt;
    this.expiresAt = expiresAt;
  }

  public ChallengeKey key() {
    return new ChallengeKey(target.id(), channelId);
  }

  public ChallengeView view() {
    return new ChallengeView(
        challengeId, channelId, proposer, target, params, createdAt, expiresAt);
  }

  public void attachMessage(String ref) {
    this.messageRef = ref;
  }

  public Optional<String> messageRef() {
    return Optional.ofNullable(messageRef);
  }

  void attachExpiry(CancelHandle handle) {
    this.expiry = handle;
    // close() が先に走っていた場合はここで取り消す
    if (closed.get()) {
      handle.cancel();
    }
  }

  void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    final CancelHandle handle = expiry;
    if (handle != null) {
      handle.cancel();
    }
  }

  public String challengeId() {
    return challengeId;
  }

  public Player proposer() {
    return proposer;
  }

  public Player target() {
    return target;
  }

  public String channelId() {
    return channelId;
  }

  public ChallengeParams params() {
    return params;
  }

  public Instant createdAt() {
    return createdAt;
  }
}
