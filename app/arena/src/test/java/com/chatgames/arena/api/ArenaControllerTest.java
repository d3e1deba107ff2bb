package com.chatgames.arena.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.chatgames.arena.game.memory.CardPairMove;
import com.chatgames.arena.game.memory.GridSize;
import com.chatgames.arena.game.memory.Position;
import com.chatgames.arena.game.rps.RpsChoiceMove;
import com.chatgames.arena.game.tictactoe.CellMove;
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
import com.chatgames.arena.model.RejectionCode;
import com.chatgames.arena.model.SessionSnapshot;
import com.chatgames.arena.service.GameDispatcher;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ArenaController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ArenaControllerTest {

  private static final Player ALICE = new Player("user-a", "Alice");
  private static final Player BOB = new Player("user-b", "Bob");
  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private GameDispatcher dispatcher;

  @Test
  void challengeReturns200() throws Exception {
    final ChallengeView view =
        new ChallengeView(
            "chl-1",
            "channel-1",
            ALICE,
            BOB,
            ChallengeParams.memory("animals", new GridSize(5, 5)),
            NOW,
            NOW.plusSeconds(60));
    when(dispatcher.challenge(
            "user-a", "user-b", "channel-1", new ChallengeOptions("memory", "animals", "5x5")))
        .thenReturn(ActionResult.ok(view));

    mockMvc
        .perform(
            post("/v1/channels/channel-1/challenges")
                .header("X-User-Id", "user-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_user_id":"user-b","kind":"memory","category":"animals","grid":"5x5"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.challenge_id").value("chl-1"))
        .andExpect(jsonPath("$.proposer.user_id").value("user-a"))
        .andExpect(jsonPath("$.target.display_name").value("Bob"))
        .andExpect(jsonPath("$.grid").value("5x5"))
        .andExpect(jsonPath("$.expires_at").value("2026-03-01T10:01:00Z"));
  }

  @Test
  void challengeReturns400WhenValidationFails() throws Exception {
    mockMvc
        .perform(
            post("/v1/channels/channel-1/challenges")
                .header("X-User-Id", "user-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind":"tictactoe"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ARENA_VALIDATION_ERROR"));

    verifyNoInteractions(dispatcher);
  }

  @Test
  void challengeReturns400WhenUserHeaderIsMissing() throws Exception {
    mockMvc
        .perform(
            post("/v1/channels/channel-1/challenges")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_user_id":"user-b","kind":"tictactoe"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ARENA_VALIDATION_ERROR"));
  }

  @Test
  void challengeConflictReturns409() throws Exception {
    when(dispatcher.challenge(any(), any(), any(), any()))
        .thenReturn(
            ActionResult.rejected(
                RejectionCode.CHALLENGE_CONFLICT, "a challenge is already pending"));

    mockMvc
        .perform(
            post("/v1/channels/channel-1/challenges")
                .header("X-User-Id", "user-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"target_user_id":"user-b","kind":"rps"}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ARENA_CHALLENGE_CONFLICT"))
        .andExpect(jsonPath("$.message").value("a challenge is already pending"));
  }

  @Test
  void acceptChallengeReturnsStartedSession() throws Exception {
    final ChallengeView view =
        new ChallengeView(
            "chl-1",
            "channel-1",
            ALICE,
            BOB,
            ChallengeParams.of(GameKind.TIC_TAC_TOE),
            NOW,
            NOW.plusSeconds(60));
    when(dispatcher.resolveChallenge("user-b", "channel-1", Decision.ACCEPT))
        .thenReturn(
            ActionResult.ok(new ChallengeResolution(view, Decision.ACCEPT, ticTacToeSnapshot())));

    mockMvc
        .perform(post("/v1/channels/channel-1/challenges/accept").header("X-User-Id", "user-b"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.decision").value("accept"))
        .andExpect(jsonPath("$.session.session_id").value("ses-1"))
        .andExpect(jsonPath("$.session.kind").value("tictactoe"))
        .andExpect(jsonPath("$.session.current_player_id").value("user-a"))
        .andExpect(jsonPath("$.session.cells[0][0]").value("."));
  }

  @Test
  void declineChallengeOmitsSession() throws Exception {
    final ChallengeView view =
        new ChallengeView(
            "chl-1",
            "channel-1",
            ALICE,
            BOB,
            ChallengeParams.of(GameKind.RPS),
            NOW,
            NOW.plusSeconds(60));
    when(dispatcher.resolveChallenge("user-b", "channel-1", Decision.DECLINE))
        .thenReturn(ActionResult.ok(new ChallengeResolution(view, Decision.DECLINE, null)));

    mockMvc
        .perform(post("/v1/channels/channel-1/challenges/decline").header("X-User-Id", "user-b"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.decision").value("decline"))
        .andExpect(jsonPath("$.session").isEmpty());
  }

  @Test
  void memoryMoveIsTranslatedToCardPair() throws Exception {
    when(dispatcher.move(
            "user-a",
            "channel-1",
            new CardPairMove(new Position(0, 0), new Position(1, 2))))
        .thenReturn(
            ActionResult.ok(
                new MoveResult(ticTacToeSnapshot(), "MATCH", "match, go again", null, null)));

    mockMvc
        .perform(
            post("/v1/channels/channel-1/moves/memory")
                .header("X-User-Id", "user-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"first_row":0,"first_col":0,"second_row":1,"second_col":2}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event").value("MATCH"))
        .andExpect(jsonPath("$.game_ended").value(false));
  }

  @Test
  void finishingMoveReportsWinner() throws Exception {
    final GameResult result =
        new GameResult(
            "ses-1",
            GameKind.TIC_TAC_TOE,
            "channel-1",
            ALICE,
            BOB,
            ALICE,
            1,
            0,
            EndReason.COMPLETED,
            NOW);
    when(dispatcher.move("user-a", "channel-1", new CellMove(0, 2)))
        .thenReturn(
            ActionResult.ok(
                new MoveResult(ticTacToeSnapshot(), "WIN", "Alice wins", null, result)));

    mockMvc
        .perform(
            post("/v1/channels/channel-1/moves/tictactoe")
                .header("X-User-Id", "user-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"row":0,"col":2}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.game_ended").value(true))
        .andExpect(jsonPath("$.winner_id").value("user-a"))
        .andExpect(jsonPath("$.end_reason").value("completed"));
  }

  @Test
  void moveOutOfTurnReturns409() throws Exception {
    when(dispatcher.move(eq("user-b"), eq("channel-1"), any()))
        .thenReturn(ActionResult.rejected(RejectionCode.NOT_YOUR_TURN, "it is Alice's turn"));

    mockMvc
        .perform(
            post("/v1/channels/channel-1/moves/tictactoe")
                .header("X-User-Id", "user-b")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"row":1,"col":1}
                    """))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ARENA_NOT_YOUR_TURN"));
  }

  @Test
  void unknownRpsChoiceIsPassedAsEmptyChoice() throws Exception {
    when(dispatcher.move("user-a", "channel-1", new RpsChoiceMove(null)))
        .thenReturn(ActionResult.rejected(RejectionCode.INVALID_MOVE, "unknown choice"));

    mockMvc
        .perform(
            post("/v1/channels/channel-1/moves/rps/choice")
                .header("X-User-Id", "user-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"choice":"lizard"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ARENA_INVALID_MOVE"));

    verify(dispatcher).move("user-a", "channel-1", new RpsChoiceMove(null));
  }

  @Test
  void endRequestAndConfirmation() throws Exception {
    final ConfirmationView view =
        new ConfirmationView(
            "cnf-1", "ses-1", "channel-1", ALICE, BOB, NOW, NOW.plusSeconds(60));
    when(dispatcher.requestEnd("user-a", "channel-1")).thenReturn(ActionResult.ok(view));
    when(dispatcher.resolveConfirmation("cnf-1", "user-b", Decision.ACCEPT))
        .thenReturn(ActionResult.ok(new ConfirmationResolution(view, Decision.ACCEPT, true)));

    mockMvc
        .perform(post("/v1/channels/channel-1/end-requests").header("X-User-Id", "user-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.confirmation_id").value("cnf-1"))
        .andExpect(jsonPath("$.opponent.user_id").value("user-b"));

    mockMvc
        .perform(post("/v1/confirmations/cnf-1/accept").header("X-User-Id", "user-b"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.decision").value("accept"))
        .andExpect(jsonPath("$.session_ended").value(true));
  }

  @Test
  void confirmationFromRequesterReturns403() throws Exception {
    when(dispatcher.resolveConfirmation("cnf-1", "user-a", Decision.DECLINE))
        .thenReturn(ActionResult.rejected(RejectionCode.NOT_OPPONENT, "only the opponent"));

    mockMvc
        .perform(post("/v1/confirmations/cnf-1/decline").header("X-User-Id", "user-a"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("ARENA_NOT_OPPONENT"));
  }

  @Test
  void rematchWithoutFinishedGameReturns404() throws Exception {
    when(dispatcher.rematch("user-a", "channel-1"))
        .thenReturn(ActionResult.rejected(RejectionCode.NO_REMATCH, "nothing to rematch"));

    mockMvc
        .perform(post("/v1/channels/channel-1/rematch").header("X-User-Id", "user-a"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ARENA_NO_REMATCH"));
  }

  @Test
  void currentSessionReturnsSnapshot() throws Exception {
    when(dispatcher.currentSession("channel-1")).thenReturn(Optional.of(ticTacToeSnapshot()));

    mockMvc
        .perform(get("/v1/channels/channel-1/session"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.player1.user_id").value("user-a"))
        .andExpect(jsonPath("$.scores['user-b']").value(0))
        .andExpect(jsonPath("$.terminal").value(false));
  }

  @Test
  void currentSessionReturns404WhenIdle() throws Exception {
    when(dispatcher.currentSession("channel-1")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/channels/channel-1/session"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ARENA_NO_ACTIVE_GAME"));
  }

  private static SessionSnapshot ticTacToeSnapshot() {
    return new SessionSnapshot(
        "ses-1",
        "channel-1",
        GameKind.TIC_TAC_TOE,
        ALICE,
        BOB,
        ALICE,
        Map.of("user-a", 0, "user-b", 0),
        List.of(List.of(".", ".", "."), List.of(".", ".", "."), List.of(".", ".", ".")),
        "IN_PROGRESS",
        false,
        null,
        NOW,
        NOW);
  }
}
