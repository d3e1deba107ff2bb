/*
 * どこで: Arena モデル
 * 何を: 操作拒否の種別を列挙する
 * なぜ: エンジン/レジストリの拒否を例外ではなく値で返し、呼び出し側で文言と HTTP 応答を決めるため
 */
package com.chatgames.arena.model;

public enum RejectionCode {
  NOT_YOUR_TURN,
  INVALID_POSITION,
  ALREADY_RESOLVED,
  ALREADY_ACTIVE,
  CHANNEL_UNREACHABLE,
  UNKNOWN_ENGINE_STATE,
  UNKNOWN_USER,
  NOT_A_PLAYER,
  NOT_OPPONENT,
  SELF_CHALLENGE,
  CHALLENGE_CONFLICT,
  CONFIRMATION_PENDING,
  NO_ACTIVE_GAME,
  NO_REMATCH,
  GAME_OVER,
  INVALID_PARAMS,
  INVALID_MOVE,
  ALREADY_SUBMITTED
}
