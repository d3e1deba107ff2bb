/*
 * どこで: Arena セッション管理
 * 何を: 承認待ちの挑戦を (挑戦された側, チャンネル) 単位で保持し、承認/辞退/期限切れを裁定する
 * なぜ: 明示的な解決と期限タイマーが競合しても、先に取った側だけが効果を持つようにするため
 */
package com.chatgames.arena.session;

import com.chatgames.arena.config.ArenaProperties;
import com.chatgames.arena.model.ActionResult;
import com.chatgames.arena.model.ChallengeParams;
import com.chatgames.arena.model.Decision;
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
public class ChallengeManager {

  private static final Logger logger = LoggerFactory.getLogger(ChallengeManager.class);

  private final SessionRegistry sessionRegistry;
  private final GameScheduler scheduler;
  private final ArenaProperties properties;
  private final Clock clock;
  private final ConcurrentMap<ChallengeKey, PendingChallenge> challenges =
      new ConcurrentHashMap<>();

  /**
   * 役割: 挑戦を登録し、期限タイマーを開始する。
   * 動作:
   * - チャンネルに進行中セッションがあれば ALREADY_ACTIVE。
   * - 同じ (target, channel) の挑戦が残っていれば CHALLENGE_CONFLICT。
   * - 期限切れで除去できた場合だけ onExpired を呼ぶ。
   */
  public ActionResult<PendingChallenge> create(
      Player proposer,
      Player target,
      String channelId,
      ChallengeParams params,
      Consumer<PendingChallenge> onExpired) {
    if (sessionRegistry.get(channelId).isPresent()) {
      return ActionResult.rejected(
          RejectionCode.ALREADY_ACTIVE, "a game is already running in this channel");
    }
    final Instant now = clock.instant();
    final PendingChallenge challenge =
        new PendingChallenge(
            Ids.newId("chl"),
            proposer,
            target,
            channelId,
            params,
            now,
            now.plus(properties.challengeTimeout()));
    if (challenges.putIfAbsent(challenge.key(), challenge) != null) {
      return ActionResult.rejected(
          RejectionCode.CHALLENGE_CONFLICT,
          target.displayName() + " already has a pending challenge in this channel");
    }
    challenge.attachExpiry(
        scheduler.after(
            properties.challengeTimeout(),
            () -> expire(challenge.challengeId()).ifPresent(onExpired)));
    logger.info(
        "challenge created challengeId={} channelId={} proposer={} target={} kind={}",
        challenge.challengeId(),
        channelId,
        proposer.id(),
        target.id(),
        params.kind().value());
    return ActionResult.ok(challenge);
  }

  /** 期限切れや解決済みで見つからなければ空(NotFound)。 */
  public Optional<ChallengeOutcome> resolve(String targetId, String channelId, Decision decision) {
    final PendingChallenge removed = challenges.remove(new ChallengeKey(targetId, channelId));
    if (removed == null) {
      return Optional.empty();
    }
    removed.close();
    logger.info(
        "challenge resolved challengeId={} channelId={} decision={}",
        removed.challengeId(),
        channelId,
        decision);
    return Optional.of(new ChallengeOutcome(removed, decision));
  }

  /** タイマーから呼ばれる。同じ id の挑戦がまだ残っている場合だけ除去する。 */
  public Optional<PendingChallenge> expire(String challengeId) {
    for (PendingChallenge current : challenges.values()) {
      if (!current.challengeId().equals(challengeId)) {
        continue;
      }
      if (!challenges.remove(current.key(), current)) {
        return Optional.empty();
      }
      current.close();
      logger.info(
          "challenge expired challengeId={} channelId={}", challengeId, current.channelId());
      return Optional.of(current);
    }
    return Optional.empty();
  }

  /** 告知の描画に失敗したときなど、登録直後の挑戦を取り下げる。 */
  public boolean withdraw(PendingChallenge challenge) {
    if (!challenges.remove(challenge.key(), challenge)) {
      return false;
    }
    challenge.close();
    return true;
  }

  public Optional<PendingChallenge> find(String targetId, String channelId) {
    return Optional.ofNullable(challenges.get(new ChallengeKey(targetId, channelId)));
  }

  public int pendingCount() {
    return challenges.size();
  }
}
