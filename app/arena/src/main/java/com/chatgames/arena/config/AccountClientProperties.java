package com.chatgames.arena.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "arena.account")
public record AccountClientProperties(
    boolean enabled,
    String baseUrl,
    String internalApiToken,
    String internalApiHeaderName,
    String getUserPath) {

  public AccountClientProperties {
    baseUrl = baseUrl == null ? "http://account:80" : baseUrl;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    getUserPath = getUserPath == null || getUserPath.isBlank() ? "/users/{userId}" : getUserPath;
  }
}
