/*
 * どこで: Memory-Match エンジン
 * 何を: 絵柄カテゴリと各カテゴリの絵文字セットを保持する
 * なぜ: 挑戦時のカテゴリ指定を検証し、未指定時はランダムに選ぶため
 */
package com.chatgames.arena.game.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

public final class EmojiCategories {

  public static final String HIDDEN_SYMBOL = "❓";

  private static final Map<String, List<String>> CATEGORIES = buildCategories();

  private EmojiCategories() {}

  public static Optional<List<String>> symbolsOf(String category) {
    if (category == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(CATEGORIES.get(category.trim().toLowerCase(Locale.ROOT)));
  }

  public static boolean exists(String category) {
    return symbolsOf(category).isPresent();
  }

  public static List<String> names() {
    return List.copyOf(CATEGORIES.keySet());
  }

  public static String random(Random random) {
    final List<String> names = names();
    return names.get(random.nextInt(names.size()));
  }

  /** カテゴリ内で最小の絵柄数。グリッドが要求するペア数の上限チェックに使う。 */
  public static int minimumSymbolCount() {
    return CATEGORIES.values().stream().mapToInt(List::size).min().orElse(0);
  }

  private static Map<String, List<String>> buildCategories() {
    final Map<String, List<String>> categories = new LinkedHashMap<>();
    categories.put(
        "food",
        List.of("🍎", "🍕", "🍔", "🌮", "🍦", "🍰", "🍫", "🥑", "🍓", "🍇", "🍪", "🥕", "🥨", "🥩", "🍜"));
    categories.put(
        "animals",
        List.of("🐶", "🐱", "🐭", "🐰", "🦊", "🐻", "🐼", "🐨", "🐯", "🦁", "🐮", "🐷", "🐸", "🐔", "🦄"));
    categories.put(
        "faces",
        List.of("😀", "😂", "🥰", "😎", "🤔", "😴", "🥳", "😇", "🤠", "🤡", "😺", "🤖", "👻", "👽", "🎃"));
    categories.put(
        "nature",
        List.of("🌸", "🌺", "🌻", "🌼", "🌷", "🌹", "🍀", "🌿", "🌴", "🌲", "🍁", "⭐", "🌙", "☀️", "⛅"));
    categories.put(
        "objects",
        List.of("📱", "💻", "⌚", "📷", "🎮", "🎨", "📚", "✏️", "🎵", "🎸", "⚽", "🎲", "🎭", "🎪", "🎁"));
    categories.put(
        "hearts",
        List.of("❤️", "🧡", "💛", "💚", "💙", "💜", "🤎", "🖤", "🤍", "💖", "💗", "💓", "💝", "💕", "💞"));
    categories.put(
        "travel",
        List.of("✈️", "🚗", "🚲", "⛵", "🚁", "🚂", "🎡", "🗽", "🗼", "🏰", "⛩️", "🏖️", "🌋", "🗻", "🌉"));
    categories.put(
        "flags",
        List.of("🏁", "🚩", "🎌", "🏴", "🏳️", "🏳️‍🌈", "🏴‍☠️", "🇺🇳", "🇬🇧", "🇺🇸", "🇯🇵", "🇨🇦", "🇲🇽", "🇮🇳", "🇧🇷"));
    categories.put(
        "sports",
        List.of("⚽", "🏀", "🏈", "⚾", "🥎", "🎾", "🏐", "🏉", "🥏", "🎱", "🏓", "🏸", "🏒", "⛳", "🥊"));
    categories.put(
        "moon",
        List.of("🌑", "🌒", "🌓", "🌔", "🌕", "🌖", "🌗", "🌘", "🌙", "🌚", "🌛", "🌜", "🌝", "🌞", "⭐"));
    categories.put(
        "fruits",
        List.of("🍎", "🍐", "🍊", "🍋", "🍌", "🍉", "🍇", "🍓", "🫐", "🍈", "🍒", "🍑", "🥭", "🍍", "🥝"));
    categories.put(
        "tech",
        List.of("📱", "💻", "⌨️", "🖥️", "🖱️", "💾", "💿", "📼", "📟", "📠", "📺", "📻", "🔋", "🔌", "🧮"));
    categories.put(
        "weather",
        List.of("☀️", "🌤️", "⛅", "🌥️", "☁️", "🌦️", "🌧️", "⛈️", "🌩️", "🌨️", "❄️", "💨", "🌪️", "🌫️", "☔"));
    return Collections.unmodifiableMap(categories);
  }

  static List<String> shuffledCopy(List<String> symbols, Random random) {
    final List<String> copy = new ArrayList<>(symbols);
    Collections.shuffle(copy, random);
    return copy;
  }
}
