package com.chatgames.arena.model;

public record Rejection(RejectionCode code, String message) {

  public static Rejection of(RejectionCode code, String message) {
    return new Rejection(code, message);
  }
}
