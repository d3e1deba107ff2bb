package com.chatgames.arena.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "arena.account.enabled", havingValue = "true")
public class AccountClientConfig {

  @Bean
  RestClient accountRestClient(RestClient.Builder builder, AccountClientProperties properties) {
    // account service のユーザー参照専用 RestClient。
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
