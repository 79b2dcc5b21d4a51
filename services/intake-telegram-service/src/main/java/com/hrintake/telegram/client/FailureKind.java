package com.hrintake.telegram.client;

public enum FailureKind {
  NONE,
  /** The API answered with {@code ok=false}. */
  REMOTE,
  TIMEOUT,
  CONNECTION,
  UNEXPECTED
}
