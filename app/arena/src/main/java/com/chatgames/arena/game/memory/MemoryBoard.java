/*
 * どこで: Memory-Match エンジン
 * 何を: カードの配置と盤面参照を提供する
 * なぜ: 配札(ランダム)と判定(MemoryMatchGame)を分け、テストで盤面を固定できるようにするため
 */
package com.chatgames.arena.game.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public final class MemoryBoard {

  public static final String JOKER_SYMBOL = "🃏";

  private final GridSize grid;
  private final Card[][] cards;
  private final boolean hasJoker;

  private MemoryBoard(GridSize grid, List<String> layout) {
    this.grid = grid;
    this.cards = new Card[grid.rows()][grid.columns()];
    boolean joker = false;
    for (int index = 0; index < layout.size(); index++) {
      final int row = index / grid.columns();
      final int col = index % grid.columns();
      final String symbol = layout.get(index);
      final boolean isJoker = JOKER_SYMBOL.equals(symbol);
      joker = joker || isJoker;
      cards[row][col] = new Card(symbol, Position.of(row, col), isJoker);
    }
    this.hasJoker = joker;
  }

  /**
   * 役割: カテゴリの絵柄からペアを作り、シャッフルして配置する。
   * 前提: 絵柄数がペア数以上であること。奇数マスの盤ではジョーカーを 1 枚だけ加える。
   */
  public static MemoryBoard deal(GridSize grid, List<String> symbols, Random random) {
    final int pairs = grid.pairCount();
    if (symbols.size() < pairs) {
      throw new IllegalArgumentException(
          "grid " + grid.label() + " needs " + pairs + " symbols but only " + symbols.size());
    }
    final List<String> chosen = EmojiCategories.shuffledCopy(symbols, random).subList(0, pairs);
    final List<String> deck = new ArrayList<>(grid.cellCount());
    for (String symbol : chosen) {
      deck.add(symbol);
      deck.add(symbol);
    }
    if (grid.needsJoker()) {
      deck.add(JOKER_SYMBOL);
    }
    Collections.shuffle(deck, random);
    return new MemoryBoard(grid, deck);
  }

  /** 行優先の配置をそのまま盤にする。ジョーカーは {@link #JOKER_SYMBOL} で表す。 */
  public static MemoryBoard fromLayout(GridSize grid, List<String> layout) {
    if (layout.size() != grid.cellCount()) {
      throw new IllegalArgumentException(
          "layout size " + layout.size() + " does not fit grid " + grid.label());
    }
    return new MemoryBoard(grid, List.copyOf(layout));
  }

  public GridSize grid() {
    return grid;
  }

  public int pairCount() {
    return grid.pairCount();
  }

  public boolean hasJoker() {
    return hasJoker;
  }

  public boolean contains(Position position) {
    return position != null
        && position.row() >= 0
        && position.row() < grid.rows()
        && position.col() >= 0
        && position.col() < grid.columns();
  }

  public Card cardAt(Position position) {
    if (!contains(position)) {
      throw new IndexOutOfBoundsException("position outside grid: " + position);
    }
    return cards[position.row()][position.col()];
  }

  public List<List<String>> view() {
    return viewRevealing(List.of());
  }

  /** 指定位置だけ表向きにした盤面。伏せ直し前の一時表示に使い、カードの状態は変えない。 */
  public List<List<String>> viewRevealing(List<Position> faceUp) {
    final List<List<String>> rows = new ArrayList<>(grid.rows());
    for (Card[] row : cards) {
      final List<String> line = new ArrayList<>(row.length);
      for (Card card : row) {
        line.add(faceUp.contains(card.position()) ? card.symbol() : card.display());
      }
      rows.add(Collections.unmodifiableList(line));
    }
    return Collections.unmodifiableList(rows);
  }
}
