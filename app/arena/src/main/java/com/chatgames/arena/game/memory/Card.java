package com.chatgames.arena.game.memory;

/** 盤上の 1 枚。symbol/位置/ジョーカー区分は不変、公開状態だけが遷移する。 */
public final class Card {

  private final String symbol;
  private final Position position;
  private final boolean joker;
  private boolean matched;
  private boolean revealed;

  Card(String symbol, Position position, boolean joker) {
    this.symbol = symbol;
    this.position = position;
    this.joker = joker;
  }

  public String symbol() {
    return symbol;
  }

  public Position position() {
    return position;
  }

  public boolean isJoker() {
    return joker;
  }

  public boolean isMatched() {
    return matched;
  }

  public boolean isRevealed() {
    return revealed;
  }

  public String display() {
    return matched || revealed ? symbol : EmojiCategories.HIDDEN_SYMBOL;
  }

  void reveal() {
    revealed = true;
  }

  void hide() {
    revealed = false;
  }

  void markMatched() {
    matched = true;
    revealed = true;
  }
}
