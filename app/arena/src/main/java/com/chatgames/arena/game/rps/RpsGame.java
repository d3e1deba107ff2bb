/*
 * どこで: RPS / RPS-Action エンジン
 * 何を: 同時選択型ジャンケンの状態遷移(アクション確定 -> 手の確定 -> 解決)を管理する
 * なぜ: 両者の手が揃った瞬間に 1 度だけ解決し、再戦時は同じエンジンを初期化して使い回すため
 */
package com.chatgames.arena.game.rps;

import com.chatgames.arena.game.GameEngine;
import com.chatgames.arena.game.GameMove;
import com.chatgames.arena.game.MoveOutcome;
import com.chatgames.arena.model.GameKind;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.model.RejectionCode;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class RpsGame implements GameEngine {

  public static final List<String> ACTION_OPTIONS =
      List.of(
          "slap", "kiss", "nuke", "laugh", "pat", "hug", "poke", "tickle", "bonk", "punch",
          "dance with");

  private final Player player1;
  private final Player player2;
  private final boolean actionVariant;
  private final Map<String, RpsChoice> choices = new HashMap<>();
  private final Map<String, String> actions = new HashMap<>();

  private RpsPhase phase;
  private RpsResolution resolution;

  public RpsGame(Player player1, Player player2, boolean actionVariant) {
    this.player1 = player1;
    this.player2 = player2;
    this.actionVariant = actionVariant;
    reset();
  }

  /** 同じ 2 人・同じエンジンのまま次のラウンドへ戻す。 */
  public void reset() {
    choices.clear();
    actions.clear();
    resolution = null;
    phase = actionVariant ? RpsPhase.WAITING_FOR_ACTIONS : RpsPhase.WAITING_FOR_CHOICES;
  }

  public RpsOutcome submitAction(Player player, String action) {
    if (!actionVariant) {
      return RpsOutcome.rejected(RejectionCode.INVALID_MOVE, "this game has no actions");
    }
    final RpsOutcome precheck = checkPlayer(player);
    if (precheck != null) {
      return precheck;
    }
    if (phase != RpsPhase.WAITING_FOR_ACTIONS) {
      return RpsOutcome.rejected(RejectionCode.ALREADY_SUBMITTED, "actions are already locked in");
    }
    final String normalized = action == null ? "" : action.trim().toLowerCase(Locale.ROOT);
    if (!ACTION_OPTIONS.contains(normalized)) {
      return RpsOutcome.rejected(RejectionCode.INVALID_MOVE, "unknown action: " + action);
    }
    if (actions.putIfAbsent(player.id(), normalized) != null) {
      return RpsOutcome.rejected(RejectionCode.ALREADY_SUBMITTED, "action already chosen");
    }
    if (actions.size() == 2) {
      phase = RpsPhase.WAITING_FOR_CHOICES;
    }
    return RpsOutcome.recorded(RpsOutcomeType.ACTION_RECORDED);
  }

  /**
   * 役割: プレイヤーの手を 1 度だけ記録する。
   * 動作: 2 人分が揃った時点で即座に解決し RESOLVED を返す。2 回目の提出は拒否する。
   */
  public RpsOutcome submitChoice(Player player, RpsChoice choice) {
    final RpsOutcome precheck = checkPlayer(player);
    if (precheck != null) {
      return precheck;
    }
    if (phase == RpsPhase.WAITING_FOR_ACTIONS) {
      return RpsOutcome.rejected(
          RejectionCode.INVALID_MOVE, "both players must pick an action first");
    }
    if (choice == null) {
      return RpsOutcome.rejected(RejectionCode.INVALID_MOVE, "choice is required");
    }
    if (choices.putIfAbsent(player.id(), choice) != null) {
      return RpsOutcome.rejected(RejectionCode.ALREADY_SUBMITTED, "choice already submitted");
    }
    if (choices.size() < 2) {
      return RpsOutcome.recorded(RpsOutcomeType.CHOICE_RECORDED);
    }
    resolution = resolve();
    phase = RpsPhase.RESOLVED;
    return RpsOutcome.resolved(resolution);
  }

  private RpsOutcome checkPlayer(Player player) {
    if (phase == RpsPhase.RESOLVED) {
      return RpsOutcome.rejected(RejectionCode.GAME_OVER, "round is already resolved");
    }
    if (player == null || !hasPlayer(player.id())) {
      return RpsOutcome.rejected(RejectionCode.NOT_A_PLAYER, "not a player of this game");
    }
    return null;
  }

  private RpsResolution resolve() {
    final RpsChoice choice1 = choices.get(player1.id());
    final RpsChoice choice2 = choices.get(player2.id());
    if (choice1 == choice2) {
      return new RpsResolution(choice1, choice2, null, null, null);
    }
    final Player winner = choice1.beats(choice2) ? player1 : player2;
    final Player loser = winner == player1 ? player2 : player1;
    final RpsActionPayload payload =
        actionVariant ? new RpsActionPayload(winner, loser, actions.get(winner.id())) : null;
    return new RpsResolution(choice1, choice2, winner, loser, payload);
  }

  @Override
  public MoveOutcome play(Player player, GameMove move) {
    if (move instanceof RpsActionMove actionMove) {
      final RpsOutcome outcome = submitAction(player, actionMove.action());
      if (outcome.type() == RpsOutcomeType.REJECTED) {
        return MoveOutcome.rejected(outcome.rejection());
      }
      return MoveOutcome.accepted(
          "ACTION_RECORDED",
          phase == RpsPhase.WAITING_FOR_CHOICES
              ? "actions locked in, choose rock, paper or scissors"
              : "waiting for the other action");
    }
    if (move instanceof RpsChoiceMove choiceMove) {
      final RpsOutcome outcome = submitChoice(player, choiceMove.choice());
      if (outcome.type() == RpsOutcomeType.REJECTED) {
        return MoveOutcome.rejected(outcome.rejection());
      }
      if (outcome.type() == RpsOutcomeType.CHOICE_RECORDED) {
        return MoveOutcome.accepted("CHOICE_RECORDED", "waiting for the other choice");
      }
      return MoveOutcome.accepted("RESOLVED", describe(outcome.resolution()))
          .withAction(outcome.resolution().action());
    }
    return MoveOutcome.unsupported(move, actionVariant ? "rps action" : "rps");
  }

  private String describe(RpsResolution result) {
    if (result.isTie()) {
      return "it is a tie, both chose " + result.player1Choice().value();
    }
    final boolean player1Won = result.winner() == player1;
    final RpsChoice winning = player1Won ? result.player1Choice() : result.player2Choice();
    final RpsChoice losing = player1Won ? result.player2Choice() : result.player1Choice();
    final String base =
        result.winner().displayName() + " wins, " + winning.value() + " beats " + losing.value();
    return result.action() == null ? base : base + ", " + result.action().describe();
  }

  @Override
  public GameKind kind() {
    return actionVariant ? GameKind.RPS_ACTION : GameKind.RPS;
  }

  @Override
  public Player player1() {
    return player1;
  }

  @Override
  public Player player2() {
    return player2;
  }

  @Override
  public Optional<Player> currentPlayer() {
    return Optional.empty();
  }

  @Override
  public boolean isOver() {
    return phase == RpsPhase.RESOLVED;
  }

  @Override
  public Optional<Player> winner() {
    return resolution == null ? Optional.empty() : Optional.ofNullable(resolution.winner());
  }

  @Override
  public int scoreOf(Player player) {
    return winner().filter(winning -> winning.is(player.id())).isPresent() ? 1 : 0;
  }

  /** 各プレイヤー 1 行: [表示名, 状態]。解決前は選んだ手を伏せる。 */
  @Override
  public List<List<String>> cells() {
    return List.of(rowOf(player1), rowOf(player2));
  }

  private List<String> rowOf(Player player) {
    final RpsChoice choice = choices.get(player.id());
    final String status;
    if (phase == RpsPhase.RESOLVED) {
      status = choice.value();
    } else if (phase == RpsPhase.WAITING_FOR_ACTIONS) {
      status = actions.containsKey(player.id()) ? "action chosen" : "choosing action";
    } else {
      status = choice == null ? "choosing" : "ready";
    }
    return List.of(player.displayName(), status);
  }

  @Override
  public String phase() {
    return phase.name();
  }

  public Optional<RpsResolution> resolution() {
    return Optional.ofNullable(resolution);
  }
}
