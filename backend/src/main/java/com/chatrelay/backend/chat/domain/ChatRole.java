package com.chatrelay.backend.chat.domain;

public enum ChatRole {
  USER("user"),
  ASSISTANT("assistant");

  private final String wireName;

  ChatRole(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
