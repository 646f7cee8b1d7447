package org.hypertrace.core.query.frontend.api;

/**
 * Identity key for state that lives for one top-level request and is shared by every sub-request
 * derived from it. Keys compare by identity.
 */
public final class RequestScopedKey<T> {
  private final String name;

  private RequestScopedKey(String name) {
    this.name = name;
  }

  public static <T> RequestScopedKey<T> named(String name) {
    return new RequestScopedKey<>(name);
  }

  @Override
  public String toString() {
    return this.name;
  }
}
