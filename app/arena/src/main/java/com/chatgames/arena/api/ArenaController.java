/*
 * どこで: Arena API
 * 何を: 挑戦/着手/終了要求/再戦/状態参照のエンドポイントを公開する
 * なぜ: チャット側アダプタからの操作をディスパッチャへ渡す薄い入口を提供するため
 */
package com.chatgames.arena.api;

import com.chatgames.arena.api.request.ChallengeRequest;
import com.chatgames.arena.api.request.MemoryMoveRequest;
import com.chatgames.arena.api.request.RpsActionRequest;
import com.chatgames.arena.api.request.RpsChoiceRequest;
import com.chatgames.arena.api.request.TicTacToeMoveRequest;
import com.chatgames.arena.api.response.ChallengeDecisionResponse;
import com.chatgames.arena.api.response.ChallengeResponse;
import com.chatgames.arena.api.response.ConfirmationDecisionResponse;
import com.chatgames.arena.api.response.ConfirmationResponse;
import com.chatgames.arena.api.response.MoveResponse;
import com.chatgames.arena.api.response.SessionResponse;
import com.chatgames.arena.game.GameMove;
import com.chatgames.arena.game.memory.CardPairMove;
import com.chatgames.arena.game.memory.Position;
import com.chatgames.arena.game.rps.RpsActionMove;
import com.chatgames.arena.game.rps.RpsChoice;
import com.chatgames.arena.game.rps.RpsChoiceMove;
import com.chatgames.arena.game.tictactoe.CellMove;
import com.chatgames.arena.model.ActionResult;
import com.chatgames.arena.model.ChallengeOptions;
import com.chatgames.arena.model.Decision;
import com.chatgames.arena.model.Rejection;
import com.chatgames.arena.model.RejectionCode;
import com.chatgames.arena.service.GameDispatcher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ArenaController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final GameDispatcher dispatcher;

  @PostMapping("/channels/{channelId}/challenges")
  public ResponseEntity<ChallengeResponse> challenge(
      @PathVariable("channelId") String channelId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody ChallengeRequest request) {
    final ChallengeOptions options =
        new ChallengeOptions(request.kind(), request.category(), request.grid());
    return ResponseEntity.ok(
        ChallengeResponse.from(
            unwrap(dispatcher.challenge(userId, request.targetUserId(), channelId, options))));
  }

  @PostMapping("/channels/{channelId}/challenges/accept")
  public ResponseEntity<ChallengeDecisionResponse> acceptChallenge(
      @PathVariable("channelId") String channelId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        ChallengeDecisionResponse.from(
            unwrap(dispatcher.resolveChallenge(userId, channelId, Decision.ACCEPT))));
  }

  @PostMapping("/channels/{channelId}/challenges/decline")
  public ResponseEntity<ChallengeDecisionResponse> declineChallenge(
      @PathVariable("channelId") String channelId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        ChallengeDecisionResponse.from(
            unwrap(dispatcher.resolveChallenge(userId, channelId, Decision.DECLINE))));
  }

  @PostMapping("/channels/{channelId}/moves/memory")
  public ResponseEntity<MoveResponse> memoryMove(
      @PathVariable("channelId") String channelId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody MemoryMoveRequest request) {
    return move(
        userId,
        channelId,
        new CardPairMove(
            Position.of(request.firstRow(), request.firstCol()),
            Position.of(request.secondRow(), request.secondCol())));
  }

  @PostMapping("/channels/{channelId}/moves/tictactoe")
  public ResponseEntity<MoveResponse> ticTacToeMove(
      @PathVariable("channelId") String channelId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody TicTacToeMoveRequest request) {
    return move(userId, channelId, new CellMove(request.row(), request.col()));
  }

  @PostMapping("/channels/{channelId}/moves/rps/choice")
  public ResponseEntity<MoveResponse> rpsChoice(
      @PathVariable("channelId") String channelId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody RpsChoiceRequest request) {
    // 未知の手は null のまま渡し、エンジン側で INVALID_MOVE にする
    final RpsChoice choice = RpsChoice.fromValue(request.choice()).orElse(null);
    return move(userId, channelId, new RpsChoiceMove(choice));
  }

  @PostMapping("/channels/{channelId}/moves/rps/action")
  public ResponseEntity<MoveResponse> rpsAction(
      @PathVariable("channelId") String channelId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody RpsActionRequest request) {
    return move(userId, channelId, new RpsActionMove(request.action()));
  }

  @PostMapping("/channels/{channelId}/end-requests")
  public ResponseEntity<ConfirmationResponse> requestEnd(
      @PathVariable("channelId") String channelId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        ConfirmationResponse.from(unwrap(dispatcher.requestEnd(userId, channelId))));
  }

  @PostMapping("/confirmations/{confirmationId}/accept")
  public ResponseEntity<ConfirmationDecisionResponse> acceptConfirmation(
      @PathVariable("confirmationId") String confirmationId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        ConfirmationDecisionResponse.from(
            unwrap(dispatcher.resolveConfirmation(confirmationId, userId, Decision.ACCEPT))));
  }

  @PostMapping("/confirmations/{confirmationId}/decline")
  public ResponseEntity<ConfirmationDecisionResponse> declineConfirmation(
      @PathVariable("confirmationId") String confirmationId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(
        ConfirmationDecisionResponse.from(
            unwrap(dispatcher.resolveConfirmation(confirmationId, userId, Decision.DECLINE))));
  }

  @PostMapping("/channels/{channelId}/rematch")
  public ResponseEntity<SessionResponse> rematch(
      @PathVariable("channelId") String channelId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(SessionResponse.from(unwrap(dispatcher.rematch(userId, channelId))));
  }

  @GetMapping("/channels/{channelId}/session")
  public ResponseEntity<SessionResponse> currentSession(
      @PathVariable("channelId") String channelId) {
    return dispatcher
        .currentSession(channelId)
        .map(SessionResponse::from)
        .map(ResponseEntity::ok)
        .orElseThrow(
            () ->
                new ArenaActionRejectedException(
                    Rejection.of(
                        RejectionCode.NO_ACTIVE_GAME, "no game is running in this channel")));
  }

  private ResponseEntity<MoveResponse> move(String userId, String channelId, GameMove move) {
    return ResponseEntity.ok(MoveResponse.from(unwrap(dispatcher.move(userId, channelId, move))));
  }

  private static <T> T unwrap(ActionResult<T> result) {
    if (!result.isOk()) {
      throw new ArenaActionRejectedException(result.rejection());
    }
    return result.payload();
  }
}
