/*
 * どこで: Arena テスト基盤
 * 何を: Testcontainers(Postgres) と DataSource/Flyway の共通設定を提供する
 * なぜ: 戦績記録のテストを本番と同じ migration で動かすため
 */
package com.chatgames.arena;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;

public abstract class AbstractPostgresContainerTest {

  // Docker が無い環境では @Testcontainers(disabledWithoutDocker = true) によりクラスごと skip される
  @Container
  protected static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "arena");
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "arena");
    registry.add("spring.flyway.schemas", () -> "arena");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_arena");
  }
}
