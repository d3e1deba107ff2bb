package com.chatgames.arena.schedule;

@FunctionalInterface
public interface CancelHandle {

  CancelHandle NOOP = () -> false;

  /** まだ発火していなければ取り消す。既に発火/取り消し済みなら false。 */
  boolean cancel();
}
