package com.chatgames.arena.client;

import com.chatgames.arena.model.Player;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** account service を使わない構成向け。参照文字列をそのまま id/表示名にする。 */
@Component
@ConditionalOnProperty(
    name = "arena.account.enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalPlayerDirectory implements PlayerDirectory {

  @Override
  public Optional<Player> lookup(String userRef) {
    if (userRef == null || userRef.isBlank()) {
      return Optional.empty();
    }
    final String id = userRef.trim();
    return Optional.of(new Player(id, id));
  }
}
