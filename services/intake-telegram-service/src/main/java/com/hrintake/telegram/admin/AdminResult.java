package com.hrintake.telegram.admin;

/** A query answer, or the fact that the document store is not connected. */
public record AdminResult<T>(boolean storeAvailable, T value) {

  public static <T> AdminResult<T> of(T value) {
    return new AdminResult<>(true, value);
  }

  public static <T> AdminResult<T> unavailable() {
    return new AdminResult<>(false, null);
  }
}
