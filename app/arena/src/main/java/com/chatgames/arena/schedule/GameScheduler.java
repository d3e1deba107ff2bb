package com.chatgames.arena.schedule;

import java.time.Duration;

/** 挑戦/終了確認の期限切れと、不一致カードの遅延伏せ直しに使う遅延実行。 */
public interface GameScheduler {

  CancelHandle after(Duration delay, Runnable callback);
}
