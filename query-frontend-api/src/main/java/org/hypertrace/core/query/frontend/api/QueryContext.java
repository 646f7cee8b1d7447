package org.hypertrace.core.query.frontend.api;

import io.grpc.Context;
import io.grpc.Context.CancellationListener;
import io.grpc.Contexts;
import io.grpc.Status;
import io.reactivex.rxjava3.core.Completable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Context of one incoming request: the tenant it runs for, the cancellation scope (an {@link
 * Context io.grpc.Context}, carrying caller cancellation and deadline) and request scoped state
 * shared by every sub-request derived from it.
 */
public class QueryContext {
  private final String tenantId;
  private final Context cancellationContext;
  private final Map<RequestScopedKey<?>, Object> requestScopedState;

  private QueryContext(
      String tenantId,
      Context cancellationContext,
      Map<RequestScopedKey<?>, Object> requestScopedState) {
    this.tenantId = tenantId;
    this.cancellationContext = cancellationContext;
    this.requestScopedState = requestScopedState;
  }

  /** Creates a context for a new top-level request, bound to the current gRPC context. */
  public static QueryContext forTenant(String tenantId) {
    return forTenant(tenantId, Context.current());
  }

  public static QueryContext forTenant(String tenantId, Context cancellationContext) {
    return new QueryContext(tenantId, cancellationContext, new ConcurrentHashMap<>());
  }

  public String getTenantId() {
    return tenantId;
  }

  public Context getCancellationContext() {
    return cancellationContext;
  }

  /**
   * Returns a context for a sub-request: same tenant and request scoped state, cancelled whenever
   * {@code derived} is.
   */
  public QueryContext withCancellationContext(Context derived) {
    return new QueryContext(this.tenantId, derived, this.requestScopedState);
  }

  public boolean isCancelled() {
    return this.cancellationContext.isCancelled();
  }

  /** Status describing why this context was cancelled, or null if it was not. */
  public Status cancellationStatus() {
    return Contexts.statusFromCancelled(this.cancellationContext);
  }

  /**
   * Completable that never completes and errors with the cancellation status once this context is
   * cancelled or its deadline passes.
   */
  public Completable whenCancelled() {
    return Completable.create(
        emitter -> {
          CancellationListener listener =
              context ->
                  emitter.tryOnError(
                      Contexts.statusFromCancelled(context).asException());
          this.cancellationContext.addListener(listener, Runnable::run);
          emitter.setCancellable(() -> this.cancellationContext.removeListener(listener));
        });
  }

  @SuppressWarnings("unchecked")
  public <T> T computeIfAbsent(RequestScopedKey<T> key, Supplier<T> initialValue) {
    return (T) this.requestScopedState.computeIfAbsent(key, unused -> initialValue.get());
  }

  @Override
  public String toString() {
    return "QueryContext{tenantId='" + tenantId + "'}";
  }
}
