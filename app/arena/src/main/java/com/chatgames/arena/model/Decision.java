package com.chatgames.arena.model;

public enum Decision {
  ACCEPT,
  DECLINE
}
