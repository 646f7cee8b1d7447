package org.hypertrace.core.query.frontend.execution;

import io.grpc.Context.CancellableContext;
import io.grpc.Status;
import io.grpc.Status.Code;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;

/**
 * Runs sub-requests against a downstream handler with at most {@code parallelism} of them in
 * flight, and answers with their responses in submission order.
 *
 * <p>The first failing sub-request wins: nothing pending is dispatched after it, and the caller
 * receives that first error once the sub-requests already in flight have finished. Their outcome
 * is dropped. Cancellation of the caller's context aborts everything and surfaces the cancellation
 * status as is.
 */
@Slf4j
@Singleton
public class BoundedConcurrentExecutor {
  private final Scheduler scheduler;

  @Inject
  public BoundedConcurrentExecutor(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  public Single<List<QueryResponse>> execute(
      QueryContext context,
      List<QueryRequest> subRequests,
      int parallelism,
      QueryHandler downstream) {
    if (parallelism < 1) {
      return Single.error(
          Status.FAILED_PRECONDITION
              .withDescription(
                  String.format(
                      "Query parallelism is disabled for tenant %s (computed parallelism: %d)",
                      context.getTenantId(), parallelism))
              .asException());
    }
    if (subRequests.isEmpty()) {
      return Single.just(List.of());
    }
    return Single.defer(() -> this.run(context, subRequests, parallelism, downstream));
  }

  private Single<List<QueryResponse>> run(
      QueryContext context,
      List<QueryRequest> subRequests,
      int parallelism,
      QueryHandler downstream) {
    CancellableContext subRequestScope = context.getCancellationContext().withCancellation();
    QueryContext subRequestContext = context.withCancellationContext(subRequestScope);
    AtomicReferenceArray<QueryResponse> results = new AtomicReferenceArray<>(subRequests.size());
    AtomicReference<Throwable> firstError = new AtomicReference<>();

    Completable dispatchAll =
        Observable.range(0, subRequests.size())
            .flatMap(
                index ->
                    this.dispatch(
                            index,
                            subRequests,
                            subRequestContext,
                            downstream,
                            results,
                            firstError,
                            subRequestScope)
                        .toObservable(),
                false,
                parallelism)
            .ignoreElements();

    return Completable.ambArray(context.whenCancelled(), dispatchAll)
        .andThen(Single.fromCallable(() -> collect(results, firstError)))
        .doFinally(() -> subRequestScope.cancel(null));
  }

  private Completable dispatch(
      int index,
      List<QueryRequest> subRequests,
      QueryContext subRequestContext,
      QueryHandler downstream,
      AtomicReferenceArray<QueryResponse> results,
      AtomicReference<Throwable> firstError,
      CancellableContext subRequestScope) {
    return Completable.defer(
        () -> {
          if (firstError.get() != null || subRequestScope.isCancelled()) {
            return Completable.complete();
          }
          QueryRequest subRequest = subRequests.get(index);
          return Single.defer(() -> downstream.handle(subRequestContext, subRequest))
              .subscribeOn(this.scheduler)
              .doOnSuccess(response -> results.set(index, response))
              .ignoreElement()
              .onErrorResumeNext(
                  error -> {
                    if (firstError.compareAndSet(
                        null, annotate(error, index, subRequests.size(), subRequest))) {
                      log.debug(
                          "Sub-query {} of {} failed, skipping pending sub-queries",
                          index + 1,
                          subRequests.size(),
                          error);
                    }
                    return Completable.complete();
                  });
        });
  }

  private static List<QueryResponse> collect(
      AtomicReferenceArray<QueryResponse> results, AtomicReference<Throwable> firstError)
      throws Exception {
    Throwable error = firstError.get();
    if (error != null) {
      throw error instanceof Exception
          ? (Exception) error
          : Status.fromThrowable(error).asException();
    }
    List<QueryResponse> ordered = new ArrayList<>(results.length());
    for (int i = 0; i < results.length(); i++) {
      ordered.add(results.get(i));
    }
    return ordered;
  }

  private static Throwable annotate(
      Throwable error, int index, int total, QueryRequest subRequest) {
    Status status = Status.fromThrowable(error);
    if (status.getCode() == Code.CANCELLED || status.getCode() == Code.DEADLINE_EXCEEDED) {
      return error;
    }
    return status
        .augmentDescription(
            String.format(
                "sub-query %d of %d [%s, %s) failed",
                index + 1, total, subRequest.getStart(), subRequest.getEnd()))
        .asException();
  }
}
