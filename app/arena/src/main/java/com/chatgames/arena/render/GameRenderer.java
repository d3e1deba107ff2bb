package com.chatgames.arena.render;

import com.chatgames.arena.model.ChallengeView;
import com.chatgames.arena.model.ConfirmationView;
import com.chatgames.arena.model.GameResult;
import com.chatgames.arena.model.SessionSnapshot;

/**
 * チャット基盤への描画。渡す値はすべて不変スナップショットで、基盤固有のメッセージ型は扱わない。
 *
 * <p>実装はチャンネルへ到達できない場合に {@link ChannelUnreachableException} を投げる。
 */
public interface GameRenderer {

  /** 挑戦の告知を描画し、後で編集/削除するためのメッセージ参照を返す。 */
  String renderChallenge(ChallengeView challenge);

  String renderConfirmation(ConfirmationView confirmation);

  void renderBoard(SessionSnapshot session, String statusText);

  void renderGameOver(SessionSnapshot session, GameResult result);

  void deleteMessage(String channelId, String messageRef);

  void editMessage(String channelId, String messageRef, String text);
}
