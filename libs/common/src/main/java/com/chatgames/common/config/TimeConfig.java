/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: タイマー/AFK 判定/結果記録で同一の時刻源を使い、テストで固定できるようにするため
 */
package com.chatgames.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
