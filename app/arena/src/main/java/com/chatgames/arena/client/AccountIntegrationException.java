package com.chatgames.arena.client;

public class AccountIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    UNAUTHORIZED,
    TIMEOUT,
    BAD_GATEWAY,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public AccountIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AccountIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
