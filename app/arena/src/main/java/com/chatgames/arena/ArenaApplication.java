/*
 * どこで: Arena アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: 対戦 API と AFK 回収ワーカーを単一アプリとして起動するため
 */
package com.chatgames.arena;

import com.chatgames.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ArenaApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArenaApplication.class, args);
  }
}
