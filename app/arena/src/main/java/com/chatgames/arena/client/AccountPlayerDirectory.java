/*
 * どこで: Arena 外部連携
 * 何を: account service からユーザーの表示名を引き、Player へ変換する
 * なぜ: 挑戦/結果記録に載せる表示名を正本から取り、存在しない参照を unknown-user として弾くため
 */
package com.chatgames.arena.client;

import com.chatgames.arena.client.AccountIntegrationException.Reason;
import com.chatgames.arena.config.AccountClientProperties;
import com.chatgames.arena.model.Player;
import com.chatgames.arena.service.ArenaMetrics;
import java.net.SocketTimeoutException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "arena.account.enabled", havingValue = "true")
@RequiredArgsConstructor
public class AccountPlayerDirectory implements PlayerDirectory {

  private static final Logger logger = LoggerFactory.getLogger(AccountPlayerDirectory.class);

  private final RestClient accountRestClient;
  private final AccountClientProperties properties;
  private final ArenaMetrics metrics;

  @Override
  public Optional<Player> lookup(String userRef) {
    if (userRef == null || userRef.isBlank()) {
      return Optional.empty();
    }
    try {
      final AccountUserResponse response = fetchUser(userRef.trim());
      return Optional.of(new Player(response.userId(), response.displayName()));
    } catch (AccountIntegrationException ex) {
      if (ex.reason() != Reason.NOT_FOUND) {
        metrics.recordDependencyError("identity");
        logger.warn("account lookup failed userRef={} reason={}", userRef, ex.reason(), ex);
      }
      return Optional.empty();
    }
  }

  /** 役割: account service からユーザーを 1 件取得する。失敗はすべて Reason 付きの例外に揃える。 */
  AccountUserResponse fetchUser(String userId) {
    final AccountUserResponse response;
    try {
      response =
          accountRestClient
              .get()
              .uri(properties.getUserPath(), userId)
              .header(properties.internalApiHeaderName(), properties.internalApiToken())
              .retrieve()
              .body(AccountUserResponse.class);
    } catch (RestClientResponseException ex) {
      throw new AccountIntegrationException(
          reasonForStatus(ex.getStatusCode().value()),
          "account responded with status " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      final Reason reason = causedByTimeout(ex) ? Reason.TIMEOUT : Reason.BAD_GATEWAY;
      throw new AccountIntegrationException(reason, "account is not reachable", ex);
    } catch (RuntimeException ex) {
      throw new AccountIntegrationException(
          Reason.INVALID_RESPONSE, "account response could not be read", ex);
    }
    if (response == null || response.userId() == null || response.userId().isBlank()) {
      throw new AccountIntegrationException(
          Reason.INVALID_RESPONSE, "account response has no user id");
    }
    if (response.status() != null && !"ACTIVE".equalsIgnoreCase(response.status())) {
      // 停止中ユーザーは存在しない扱いにする
      throw new AccountIntegrationException(Reason.NOT_FOUND, "account user is not active");
    }
    return response;
  }

  private static Reason reasonForStatus(int status) {
    return switch (status) {
      case 404 -> Reason.NOT_FOUND;
      case 401, 403 -> Reason.UNAUTHORIZED;
      default -> Reason.BAD_GATEWAY;
    };
  }

  private static boolean causedByTimeout(Throwable error) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (cause instanceof SocketTimeoutException) {
        return true;
      }
    }
    return false;
  }
}
