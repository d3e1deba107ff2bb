package com.chatgames.arena.repository;

import com.chatgames.arena.model.GameResult;

/** 終了セッションの結果を戦績へ反映する。1 セッションにつき 1 回だけ呼ばれる。 */
public interface GameResultRecorder {

  void record(GameResult result);
}
