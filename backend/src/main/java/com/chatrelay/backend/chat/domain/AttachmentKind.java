package com.chatrelay.backend.chat.domain;

public enum AttachmentKind {
  IMAGE,
  DOCUMENT
}
