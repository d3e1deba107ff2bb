package com.chatgames.arena.client;

import com.chatgames.arena.model.Player;
import java.util.Optional;

/** 生のユーザー参照を Player へ解決する。解決できない参照は空を返す。 */
public interface PlayerDirectory {

  Optional<Player> lookup(String userRef);
}
