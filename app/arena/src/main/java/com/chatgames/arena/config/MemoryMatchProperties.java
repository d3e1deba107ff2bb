/*
 * どこで: Arena 設定
 * 何を: Memory-Match の盤サイズ候補、盤サイズ別の勝利閾値、不一致時の表示時間を保持する
 * なぜ: 勝利条件を分岐ではなく設定表として持ち、運用で調整できるようにするため
 */
package com.chatgames.arena.config;

import com.chatgames.arena.game.memory.EmojiCategories;
import com.chatgames.arena.game.memory.GridSize;
import com.chatgames.arena.game.memory.MemoryGridRules;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "arena.memory")
public record MemoryMatchProperties(
    Duration revealDelay,
    String defaultGrid,
    List<String> grids,
    Map<String, Integer> winThresholds) {

  public MemoryMatchProperties {
    revealDelay = revealDelay == null ? Duration.ofSeconds(2) : revealDelay;
    defaultGrid = defaultGrid == null || defaultGrid.isBlank() ? "5x5" : defaultGrid;
    grids = grids == null || grids.isEmpty() ? List.of("5x5", "4x5") : List.copyOf(grids);
    winThresholds = winThresholds == null ? Map.of("5x5", 7, "4x5", 6) : Map.copyOf(winThresholds);
  }

  public MemoryGridRules gridRules() {
    return new MemoryGridRules(winThresholds);
  }

  /** 許可された盤サイズに一致する場合だけ返す。label 未指定時は既定の盤サイズ。 */
  public Optional<GridSize> resolveGrid(String label) {
    final String requested = label == null || label.isBlank() ? defaultGrid : label;
    return GridSize.parse(requested).filter(this::isAllowed);
  }

  public boolean isAllowed(GridSize grid) {
    // カテゴリの絵柄数を超えるペア数の盤は配れない
    return grid.pairCount() <= EmojiCategories.minimumSymbolCount()
        && grids.stream().map(GridSize::parse).flatMap(Optional::stream).anyMatch(grid::equals);
  }
}
