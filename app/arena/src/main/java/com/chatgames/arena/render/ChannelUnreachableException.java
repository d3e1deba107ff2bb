/*
 * どこで: Arena 描画連携
 * 何を: 描画先チャンネルが消失/到達不能であることを表す
 * なぜ: 終了処理や AFK 回収で「描画できないがセッションは片付ける」を区別して扱うため
 */
package com.chatgames.arena.render;

public class ChannelUnreachableException extends RuntimeException {

  private final String channelId;

  public ChannelUnreachableException(String channelId, String message) {
    super(message);
    this.channelId = channelId;
  }

  public ChannelUnreachableException(String channelId, String message, Throwable cause) {
    super(message, cause);
    this.channelId = channelId;
  }

  public String channelId() {
    return channelId;
  }
}
