/*
 * どこで: Arena サービス層
 * 何を: 挑戦/承認/着手/終了要求/確認応答/再戦の入口を提供し、各レジストリとエンジンへ振り分ける
 * なぜ: ゲーム種別ごとに散らばりがちな受付処理を 1 箇所に集め、先着優先の裁定を一貫させるため
 */
package com.chatgames.arena.service;

import com.chatgames.arena.client.PlayerDirectory;
import com.chatgames.arena.config.ArenaProperties;
import com.chatgames.arena.config.MemoryMatchProperties;
import com.chatgames.arena.game.GameEngine;
import com.chatgames.arena.game.GameMove;
import com.chatgames.arena.game.MoveOutcome;
import com.chatgames.arena.game.memory.EmojiCategories;
import com.chatgames.arena.game.memory.GridSize;
import com.chatgames.arena.model.ActionResult;
import com.chatgames.arena.model.ChallengeOptions;
import com.chatgames.arena.model.ChallengeParams;
import com.chatgames.arena.model.ChallengeResolution;
import com.chatgames.arena.model.ChallengeView;
import com.chatgames.arena.model.ConfirmationResolution;
import com.chatgames.arena.model.ConfirmationView;
import com.chatgames.arena.model.Decision;
import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.model.GameKind;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.MoveResult;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.Rejection;
import com.chatgames.arena.model.RejectionCode;
import com.chatgames.arena.model.SessionSnapshot;
import com.chatgames.arena.render.ChannelUnreachableException;
import com.chatgames.arena.render.GameRenderer;
import com.chatgames.arena.schedule.GameScheduler;
import com.chatgames.arena.session.ChallengeManager;
import com.chatgames.arena.session.ChallengeOutcome;
import com.chatgames.arena.session.ConfirmationManager;
import com.chatgames.arena.session.ConfirmationOutcome;
import com.chatgames.arena.session.FinishedSession;
import com.chatgames.arena.session.GameSession;
import com.chatgames.arena.session.PendingChallenge;
import com.chatgames.arena.session.PendingConfirmation;
import com.chatgames.arena.session.SessionRegistry;
import com.chatgames.arena.session.SessionTerminator;
import com.chatgames.common.Ids;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class GameDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(GameDispatcher.class);

  private final PlayerDirectory playerDirectory;
  private final SessionRegistry sessionRegistry;
  private final ChallengeManager challengeManager;
  private final ConfirmationManager confirmationManager;
  private final SessionTerminator terminator;
  private final GameFactory gameFactory;
  private final GameRenderer renderer;
  private final GameScheduler scheduler;
  private final ArenaProperties arenaProperties;
  private final MemoryMatchProperties memoryProperties;
  private final ArenaMetrics metrics;
  private final Clock clock;

  /**
   * 役割: proposer から target への挑戦を受け付ける。
   * 動作: 自分自身への挑戦、進行中ゲームのあるチャンネル、同じ相手への重複挑戦を拒否する。
   * 告知を描画できないチャンネルでは挑戦を取り下げて CHANNEL_UNREACHABLE を返す。
   */
  public ActionResult<ChallengeView> challenge(
      String proposerRef, String targetRef, String channelId, ChallengeOptions options) {
    final Optional<Player> proposer = playerDirectory.lookup(proposerRef);
    if (proposer.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + proposerRef);
    }
    final Optional<Player> target = playerDirectory.lookup(targetRef);
    if (target.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + targetRef);
    }
    if (proposer.get().id().equals(target.get().id())) {
      return reject(RejectionCode.SELF_CHALLENGE, "you cannot challenge yourself");
    }
    final ActionResult<ChallengeParams> params = toParams(options);
    if (!params.isOk()) {
      return reject(params.rejection());
    }

    final ActionResult<PendingChallenge> created =
        challengeManager.create(
            proposer.get(), target.get(), channelId, params.payload(), this::onChallengeExpired);
    if (!created.isOk()) {
      return reject(created.rejection());
    }
    final PendingChallenge challenge = created.payload();
    try {
      challenge.attachMessage(renderer.renderChallenge(challenge.view()));
    } catch (ChannelUnreachableException ex) {
      challengeManager.withdraw(challenge);
      metrics.recordDependencyError("channel_unreachable");
      logger.warn("challenge withdrawn, channel unreachable channelId={}", channelId);
      return reject(RejectionCode.CHANNEL_UNREACHABLE, "channel is not reachable");
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("render");
      logger.warn("challenge rendering failed challengeId={}", challenge.challengeId(), ex);
    }
    metrics.recordChallenge("created");
    return ActionResult.ok(challenge.view());
  }

  /**
   * 役割: target が挑戦に答える。
   * 動作: 承認ならエンジンを生成してセッションを登録する。期限切れ/解決済みは ALREADY_RESOLVED。
   */
  public ActionResult<ChallengeResolution> resolveChallenge(
      String targetRef, String channelId, Decision decision) {
    final Optional<Player> target = playerDirectory.lookup(targetRef);
    if (target.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + targetRef);
    }
    final Optional<ChallengeOutcome> outcome =
        challengeManager.resolve(target.get().id(), channelId, decision);
    if (outcome.isEmpty()) {
      return reject(RejectionCode.ALREADY_RESOLVED, "no pending challenge for you in this channel");
    }
    final PendingChallenge challenge = outcome.get().challenge();
    if (decision == Decision.DECLINE) {
      metrics.recordChallenge("declined");
      challenge
          .messageRef()
          .ifPresent(ref -> editQuietly(channelId, ref, "challenge declined"));
      return ActionResult.ok(new ChallengeResolution(challenge.view(), decision, null));
    }

    final GameEngine engine;
    try {
      engine = gameFactory.create(challenge.params(), challenge.proposer(), challenge.target());
    } catch (IllegalArgumentException | IllegalStateException ex) {
      logger.warn("engine creation failed challengeId={}", challenge.challengeId(), ex);
      return reject(RejectionCode.INVALID_PARAMS, ex.getMessage());
    }
    final GameSession session =
        new GameSession(Ids.newId("ses"), channelId, engine, clock.instant());
    if (!sessionRegistry.tryCreate(channelId, session)) {
      return reject(RejectionCode.ALREADY_ACTIVE, "a game is already running in this channel");
    }
    metrics.recordChallenge("accepted");
    metrics.updateActiveSessions(sessionRegistry.activeCount());
    logger.info(
        "session started sessionId={} channelId={} kind={}",
        session.sessionId(),
        channelId,
        engine.kind().value());
    challenge.messageRef().ifPresent(ref -> deleteQuietly(channelId, ref));
    final SessionSnapshot snapshot = session.snapshot();
    renderBoardOrDrop(session, snapshot, startText(snapshot));
    return ActionResult.ok(new ChallengeResolution(challenge.view(), decision, snapshot));
  }

  /**
   * 役割: 進行中セッションへ 1 手を適用する。
   * 動作: 同一セッションへの着手はセッションロックで直列化する。決着したらその場で終了処理まで行う。
   */
  public ActionResult<MoveResult> move(String playerRef, String channelId, GameMove move) {
    final Optional<Player> player = playerDirectory.lookup(playerRef);
    if (player.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + playerRef);
    }
    final Optional<GameSession> found = sessionRegistry.get(channelId);
    if (found.isEmpty()) {
      return reject(RejectionCode.NO_ACTIVE_GAME, "no game is running in this channel");
    }
    final GameSession session = found.get();
    if (!session.engine().hasPlayer(player.get().id())) {
      return reject(RejectionCode.NOT_A_PLAYER, "you are not playing in this game");
    }

    final AppliedMove applied;
    try {
      applied = session.withLock(() -> apply(session, player.get(), move));
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("engine");
      logger.error(
          "engine failed to apply move sessionId={} move={}", session.sessionId(), move, ex);
      return reject(RejectionCode.UNKNOWN_ENGINE_STATE, "the game could not apply this move");
    }
    if (applied.outcome().isRejected()) {
      return reject(applied.outcome().rejection());
    }

    final MoveOutcome outcome = applied.outcome();
    GameResult result = null;
    if (applied.gameOver()) {
      result = terminator.finish(session, EndReason.COMPLETED).orElse(null);
      confirmationManager.discardForSession(session.sessionId());
    }
    final SessionSnapshot snapshot =
        outcome.hideAfterDelay()
            ? session.snapshot().withCells(outcome.revealedCells())
            : session.snapshot();
    if (result == null) {
      renderBoardOrDrop(session, snapshot, outcome.message());
      if (outcome.hideAfterDelay()) {
        scheduleHide(session);
      }
    }
    return ActionResult.ok(
        new MoveResult(snapshot, outcome.event(), outcome.message(), outcome.action(), result));
  }

  private AppliedMove apply(GameSession session, Player player, GameMove move) {
    if (session.isTerminal()) {
      return new AppliedMove(
          MoveOutcome.rejected(Rejection.of(RejectionCode.GAME_OVER, "game is already over")),
          false);
    }
    final MoveOutcome outcome = session.engine().play(player, move);
    if (!outcome.isRejected()) {
      session.touch(clock.instant());
    }
    return new AppliedMove(outcome, session.engine().isOver());
  }

  /** 役割: プレイヤーが合意終了を申し出る。相手側だけが応答できる確認待ちを作る。 */
  public ActionResult<ConfirmationView> requestEnd(String playerRef, String channelId) {
    final Optional<Player> player = playerDirectory.lookup(playerRef);
    if (player.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + playerRef);
    }
    final Optional<GameSession> found = sessionRegistry.get(channelId);
    if (found.isEmpty()) {
      return reject(RejectionCode.NO_ACTIVE_GAME, "no game is running in this channel");
    }
    final GameSession session = found.get();
    final Optional<Player> opponent = session.engine().opponentOf(player.get().id());
    if (opponent.isEmpty()) {
      return reject(RejectionCode.NOT_A_PLAYER, "only players can end this game");
    }
    if (session.isTerminal()) {
      return reject(RejectionCode.GAME_OVER, "game is already over");
    }

    final ActionResult<PendingConfirmation> created =
        confirmationManager.create(
            session, player.get(), opponent.get(), this::onConfirmationExpired);
    if (!created.isOk()) {
      return reject(created.rejection());
    }
    final PendingConfirmation confirmation = created.payload();
    try {
      confirmation.attachMessage(renderer.renderConfirmation(confirmation.view()));
    } catch (ChannelUnreachableException ex) {
      confirmationManager.withdraw(confirmation);
      metrics.recordDependencyError("channel_unreachable");
      logger.warn("end request withdrawn, channel unreachable channelId={}", channelId);
      return reject(RejectionCode.CHANNEL_UNREACHABLE, "channel is not reachable");
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("render");
      logger.warn(
          "end request rendering failed confirmationId={}", confirmation.confirmationId(), ex);
    }
    return ActionResult.ok(confirmation.view());
  }

  /** 役割: 終了要求に相手が答える。要求者本人や第三者の応答は NOT_OPPONENT。 */
  public ActionResult<ConfirmationResolution> resolveConfirmation(
      String confirmationId, String responderRef, Decision decision) {
    final Optional<Player> responder = playerDirectory.lookup(responderRef);
    if (responder.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + responderRef);
    }
    final Optional<PendingConfirmation> pending = confirmationManager.find(confirmationId);
    if (pending.isEmpty()) {
      return reject(RejectionCode.ALREADY_RESOLVED, "this end request is no longer pending");
    }
    if (!pending.get().opponent().is(responder.get().id())) {
      return reject(RejectionCode.NOT_OPPONENT, "only the opponent can answer this request");
    }
    final Optional<ConfirmationOutcome> outcome =
        confirmationManager.resolve(confirmationId, decision);
    if (outcome.isEmpty()) {
      return reject(RejectionCode.ALREADY_RESOLVED, "this end request is no longer pending");
    }
    final PendingConfirmation confirmation = outcome.get().confirmation();
    final String channelId = confirmation.session().channelId();
    confirmation
        .messageRef()
        .ifPresent(
            ref ->
                editQuietly(
                    channelId,
                    ref,
                    decision == Decision.ACCEPT ? "game ended by agreement" : "the game goes on"));
    return ActionResult.ok(
        new ConfirmationResolution(confirmation.view(), decision, outcome.get().sessionEnded()));
  }

  /**
   * 役割: 決着済みの対戦を同じ 2 人で再開する。
   * 動作: 受付期間内に最初に押したプレイヤーだけが成功し、後着は ALREADY_RESOLVED。
   */
  public ActionResult<SessionSnapshot> rematch(String playerRef, String channelId) {
    final Optional<Player> player = playerDirectory.lookup(playerRef);
    if (player.isEmpty()) {
      return reject(RejectionCode.UNKNOWN_USER, "unknown user: " + playerRef);
    }
    final Optional<FinishedSession> finished = sessionRegistry.finished(channelId);
    if (finished.isEmpty()) {
      return reject(RejectionCode.NO_REMATCH, "there is no finished game to replay");
    }
    final FinishedSession entry = finished.get();
    final Instant now = clock.instant();
    if (entry.finishedAt().plus(arenaProperties.rematchWindow()).isBefore(now)) {
      sessionRegistry.claimFinished(channelId, entry);
      return reject(RejectionCode.NO_REMATCH, "the rematch window has closed");
    }
    if (!entry.session().engine().hasPlayer(player.get().id())) {
      return reject(RejectionCode.NOT_A_PLAYER, "only the previous players can start a rematch");
    }
    final Optional<GameSession> started =
        sessionRegistry.tryRematch(
            channelId,
            entry,
            claimed ->
                new GameSession(
                    Ids.newId("ses"),
                    channelId,
                    gameFactory.rematch(claimed.session().engine()),
                    now));
    if (started.isEmpty()) {
      return sessionRegistry.get(channelId).isPresent()
          ? reject(RejectionCode.ALREADY_ACTIVE, "a game is already running in this channel")
          : reject(RejectionCode.ALREADY_RESOLVED, "the rematch was already started");
    }
    final GameSession session = started.get();
    metrics.updateActiveSessions(sessionRegistry.activeCount());
    logger.info(
        "rematch started sessionId={} previousSessionId={} channelId={}",
        session.sessionId(),
        entry.session().sessionId(),
        channelId);
    final SessionSnapshot snapshot = session.snapshot();
    renderBoardOrDrop(session, snapshot, "rematch! " + startText(snapshot));
    return ActionResult.ok(snapshot);
  }

  public Optional<SessionSnapshot> currentSession(String channelId) {
    return sessionRegistry.get(channelId).map(GameSession::snapshot);
  }

  private ActionResult<ChallengeParams> toParams(ChallengeOptions options) {
    final String requestedKind = options == null ? null : options.kind();
    final Optional<GameKind> kind = GameKind.fromValue(requestedKind);
    if (kind.isEmpty()) {
      return ActionResult.rejected(RejectionCode.INVALID_PARAMS, "unknown game: " + requestedKind);
    }
    if (kind.get() != GameKind.MEMORY_MATCH) {
      return ActionResult.ok(ChallengeParams.of(kind.get()));
    }
    String category = null;
    if (options.category() != null && !options.category().isBlank()) {
      category = options.category().trim().toLowerCase(Locale.ROOT);
      if (!EmojiCategories.exists(category)) {
        return ActionResult.rejected(
            RejectionCode.INVALID_PARAMS,
            "unknown category: " + options.category() + ", choose from " + EmojiCategories.names());
      }
    }
    final Optional<GridSize> grid = memoryProperties.resolveGrid(options.grid());
    if (grid.isEmpty()) {
      return ActionResult.rejected(
          RejectionCode.INVALID_PARAMS,
          "unsupported grid: " + options.grid() + ", choose from " + memoryProperties.grids());
    }
    return ActionResult.ok(ChallengeParams.memory(category, grid.get()));
  }

  private void onChallengeExpired(PendingChallenge challenge) {
    MDC.put("channel_id", challenge.channelId());
    try {
      metrics.recordChallenge("expired");
      challenge
          .messageRef()
          .ifPresent(ref -> editQuietly(challenge.channelId(), ref, "challenge expired"));
    } finally {
      MDC.remove("channel_id");
    }
  }

  private void onConfirmationExpired(PendingConfirmation confirmation) {
    final String channelId = confirmation.session().channelId();
    MDC.put("channel_id", channelId);
    try {
      confirmation
          .messageRef()
          .ifPresent(ref -> editQuietly(channelId, ref, "end request expired, the game goes on"));
    } finally {
      MDC.remove("channel_id");
    }
  }

  private void scheduleHide(GameSession session) {
    scheduler.after(
        memoryProperties.revealDelay(),
        () -> {
          final boolean stillActive =
              sessionRegistry.get(session.channelId()).filter(session::equals).isPresent();
          if (!stillActive || session.isTerminal()) {
            return;
          }
          final SessionSnapshot snapshot = session.snapshot();
          final String turn =
              snapshot.currentPlayer() == null ? "" : snapshot.currentPlayer().displayName();
          renderBoardOrDrop(session, snapshot, "cards hidden, " + turn + "'s turn");
        });
  }

  // 描画先が消えたチャンネルのセッションは UNREACHABLE として終了させる
  private void renderBoardOrDrop(GameSession session, SessionSnapshot snapshot, String text) {
    try {
      renderer.renderBoard(snapshot, text);
    } catch (ChannelUnreachableException ex) {
      metrics.recordDependencyError("channel_unreachable");
      logger.warn(
          "ending session, channel unreachable sessionId={} channelId={}",
          session.sessionId(),
          session.channelId());
      terminator.finish(session, EndReason.UNREACHABLE);
      confirmationManager.discardForSession(session.sessionId());
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("render");
      logger.warn("board rendering failed sessionId={}", session.sessionId(), ex);
    }
  }

  private void editQuietly(String channelId, String messageRef, String text) {
    try {
      renderer.editMessage(channelId, messageRef, text);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("render");
      logger.warn("message edit failed channelId={} messageRef={}", channelId, messageRef, ex);
    }
  }

  private void deleteQuietly(String channelId, String messageRef) {
    try {
      renderer.deleteMessage(channelId, messageRef);
    } catch (RuntimeException ex) {
      metrics.recordDependencyError("render");
      logger.warn("message delete failed channelId={} messageRef={}", channelId, messageRef, ex);
    }
  }

  private String startText(SessionSnapshot snapshot) {
    final String players =
        snapshot.player1().displayName() + " vs " + snapshot.player2().displayName();
    if (snapshot.currentPlayer() == null) {
      return players + ", make your choices";
    }
    return players + ", " + snapshot.currentPlayer().displayName() + " goes first";
  }

  private <T> ActionResult<T> reject(RejectionCode code, String message) {
    return reject(Rejection.of(code, message));
  }

  private <T> ActionResult<T> reject(Rejection rejection) {
    metrics.recordRejection(rejection.code().name());
    return ActionResult.rejected(rejection);
  }

  private record AppliedMove(MoveOutcome outcome, boolean gameOver) {}
}
