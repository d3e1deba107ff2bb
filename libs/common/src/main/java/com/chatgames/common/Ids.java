package com.chatgames.common;

import java.util.UUID;

public final class Ids {
  private Ids() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** prefix 付きの短い識別子を払い出す。チャット上の参照やログ検索で種別を判別しやすくする。 */
  public static String newId(String prefix) {
    final String raw = UUID.randomUUID().toString().replace("-", "");
    return prefix + "_" + raw.substring(0, 16);
  }
}
