package com.chatgames.arena.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.chatgames.arena.MutableClock;
import com.chatgames.arena.TestFixtures;
import com.chatgames.arena.game.tictactoe.TicTacToeGame;
import com.chatgames.arena.model.ActionResult;
import com.chatgames.arena.model.Decision;
import com.chatgames.arena.model.EndReason;
import com.chatgames.arena.model.GameKind;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.RejectionCode;
import com.chatgames.arena.schedule.ManualGameScheduler;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ConfirmationManagerTest {

  private static final Player A = new Player("user-a", "A");
  private static final Player B = new Player("user-b", "B");

  private final SessionTerminator terminator = Mockito.mock(SessionTerminator.class);
  private final ManualGameScheduler scheduler = new ManualGameScheduler();
  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
  private final ConfirmationManager manager =
      new ConfirmationManager(terminator, scheduler, TestFixtures.arenaProperties(), clock);
  private final GameSession session =
      new GameSession("ses-1", "channel-1", new TicTacToeGame(A, B, A), clock.instant());
  private final List<PendingConfirmation> expired = new ArrayList<>();

  @Test
  void onlyOneLiveRequestPerSession() {
    assertThat(manager.create(session, A, B, expired::add).isOk()).isTrue();

    final ActionResult<PendingConfirmation> second = manager.create(session, B, A, expired::add);

    assertThat(second.isRejectedWith(RejectionCode.CONFIRMATION_PENDING)).isTrue();
    assertThat(manager.pendingCount()).isEqualTo(1);
  }

  @Test
  void acceptEndsSessionByAgreement() {
    when(terminator.finish(session, EndReason.AGREEMENT))
        .thenReturn(
            Optional.of(
                new GameResult(
                    "ses-1",
                    GameKind.TIC_TAC_TOE,
                    "channel-1",
                    A,
                    B,
                    null,
                    0,
                    0,
                    EndReason.AGREEMENT,
                    clock.instant())));
    final PendingConfirmation confirmation =
        manager.create(session, A, B, expired::add).payload();

    final ConfirmationOutcome outcome =
        manager.resolve(confirmation.confirmationId(), Decision.ACCEPT).orElseThrow();

    assertThat(outcome.sessionEnded()).isTrue();
    assertThat(manager.find(confirmation.confirmationId())).isEmpty();
    assertThat(scheduler.fireAll()).isZero();
    assertThat(manager.create(session, B, A, expired::add).isOk()).isTrue();
  }

  @Test
  void acceptAfterSessionAlreadyEndedReportsNotEnded() {
    when(terminator.finish(eq(session), any())).thenReturn(Optional.empty());
    final PendingConfirmation confirmation =
        manager.create(session, A, B, expired::add).payload();

    final ConfirmationOutcome outcome =
        manager.resolve(confirmation.confirmationId(), Decision.ACCEPT).orElseThrow();

    assertThat(outcome.sessionEnded()).isFalse();
  }

  @Test
  void declineLeavesSessionAlone() {
    final PendingConfirmation confirmation =
        manager.create(session, A, B, expired::add).payload();

    final ConfirmationOutcome outcome =
        manager.resolve(confirmation.confirmationId(), Decision.DECLINE).orElseThrow();

    assertThat(outcome.sessionEnded()).isFalse();
    verify(terminator, never()).finish(any(), any());
  }

  @Test
  void expiryAndResolveAreMutuallyExclusive() {
    final PendingConfirmation confirmation =
        manager.create(session, A, B, expired::add).payload();

    assertThat(scheduler.fireAll()).isEqualTo(1);

    assertThat(expired).containsExactly(confirmation);
    assertThat(manager.resolve(confirmation.confirmationId(), Decision.ACCEPT)).isEmpty();
    verify(terminator, never()).finish(any(), any());
  }

  @Test
  void discardForSessionCancelsPendingRequest() {
    final PendingConfirmation confirmation =
        manager.create(session, A, B, expired::add).payload();

    assertThat(manager.discardForSession("ses-1")).containsSame(confirmation);
    assertThat(manager.discardForSession("ses-1")).isEmpty();
    assertThat(scheduler.pendingCount()).isZero();
    assertThat(manager.resolve(confirmation.confirmationId(), Decision.ACCEPT)).isEmpty();
  }
}
