package org.hypertrace.core.query.frontend.client;

import io.grpc.Context.CancellationListener;
import io.grpc.Status;
import io.reactivex.rxjava3.core.Single;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hypertrace.core.query.frontend.api.IndexStats;
import org.hypertrace.core.query.frontend.api.IndexStatsHandler;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downstream handler talking to a Loki compatible HTTP API. Range and instant queries are sent to
 * the query endpoints, statistics lookups to the index stats endpoint. Every call is asynchronous
 * and is cancelled when the subscriber disposes or the request context is cancelled.
 */
public class LokiRestClient implements QueryHandler, IndexStatsHandler {
  private static final Logger LOG = LoggerFactory.getLogger(LokiRestClient.class);

  static final String TENANT_HEADER = "X-Scope-OrgID";
  private static final String RANGE_QUERY = "loki/api/v1/query_range";
  private static final String INSTANT_QUERY = "loki/api/v1/query";
  private static final String INDEX_STATS = "loki/api/v1/index/stats";

  private final String host;
  private final int port;
  private final OkHttpClient okHttpClient;

  public LokiRestClient(LokiClientConfig config) {
    this(config.getHost(), config.getPort(), new OkHttpClient());
  }

  LokiRestClient(String host, int port, OkHttpClient okHttpClient) {
    this.host = host;
    this.port = port;
    this.okHttpClient = okHttpClient;
  }

  @Override
  public Single<QueryResponse> handle(QueryContext context, QueryRequest request) {
    Request httpRequest =
        request.isInstant()
            ? buildInstantQueryRequest(context, request)
            : buildRangeQueryRequest(context, request);
    return this.execute(context, httpRequest)
        .map(LokiQueryResponse::fromJson)
        .map(LokiQueryResponse::toQueryResponse);
  }

  @Override
  public Single<IndexStats> stats(QueryContext context, QueryRequest request) {
    HttpUrl.Builder urlBuilder = urlBuilder(INDEX_STATS);
    urlBuilder.addQueryParameter("query", request.getQuery());
    urlBuilder.addQueryParameter("start", toEpochNanos(request.getStart()));
    urlBuilder.addQueryParameter("end", toEpochNanos(request.getEnd()));
    return this.execute(context, newRequest(context, urlBuilder))
        .map(LokiIndexStatsResponse::fromJson)
        .map(LokiIndexStatsResponse::toIndexStats);
  }

  private Request buildRangeQueryRequest(QueryContext context, QueryRequest request) {
    HttpUrl.Builder urlBuilder = urlBuilder(RANGE_QUERY);
    urlBuilder.addQueryParameter("query", request.getQuery());
    urlBuilder.addQueryParameter("start", toEpochNanos(request.getStart()));
    urlBuilder.addQueryParameter("end", toEpochNanos(request.getEnd()));
    if (!request.getStep().isZero()) {
      urlBuilder.addQueryParameter(
          "step",
          BigDecimal.valueOf(request.getStep().toMillis())
              .movePointLeft(3)
              .stripTrailingZeros()
              .toPlainString());
    }
    addLimitAndDirection(urlBuilder, request);
    return newRequest(context, urlBuilder);
  }

  private Request buildInstantQueryRequest(QueryContext context, QueryRequest request) {
    HttpUrl.Builder urlBuilder = urlBuilder(INSTANT_QUERY);
    urlBuilder.addQueryParameter("query", request.getQuery());
    urlBuilder.addQueryParameter("time", toEpochNanos(request.getEnd()));
    addLimitAndDirection(urlBuilder, request);
    return newRequest(context, urlBuilder);
  }

  private void addLimitAndDirection(HttpUrl.Builder urlBuilder, QueryRequest request) {
    if (request.getLimit() > 0) {
      urlBuilder.addQueryParameter("limit", String.valueOf(request.getLimit()));
    }
    urlBuilder.addQueryParameter(
        "direction", request.getDirection().name().toLowerCase(Locale.ROOT));
  }

  private Request newRequest(QueryContext context, HttpUrl.Builder urlBuilder) {
    return new Request.Builder()
        .url(urlBuilder.build())
        .header(TENANT_HEADER, context.getTenantId())
        .build();
  }

  private HttpUrl.Builder urlBuilder(String path) {
    return HttpUrl.parse(String.format("http://%s:%s/%s", this.host, this.port, path))
        .newBuilder();
  }

  private Single<String> execute(QueryContext context, Request request) {
    return Single.create(
        emitter -> {
          Call call = this.okHttpClient.newCall(request);
          CancellationListener cancellationListener = cancelledContext -> call.cancel();
          context.getCancellationContext().addListener(cancellationListener, Runnable::run);
          emitter.setCancellable(
              () -> {
                context.getCancellationContext().removeListener(cancellationListener);
                call.cancel();
              });
          LOG.debug("Sending request to {}", request.url());
          call.enqueue(
              new Callback() {
                @Override
                public void onResponse(Call call, Response response) {
                  try (ResponseBody body = response.body()) {
                    String content = body == null ? "" : body.string();
                    if (response.isSuccessful()) {
                      emitter.onSuccess(content);
                    } else {
                      emitter.tryOnError(
                          HttpStatusConverter.toStatus(response.code())
                              .withDescription(
                                  String.format(
                                      "Request to %s failed with code %s: %s",
                                      request.url().encodedPath(), response.code(), content))
                              .asException());
                    }
                  } catch (IOException ioException) {
                    emitter.tryOnError(
                        Status.UNAVAILABLE
                            .withDescription("Failed reading response body")
                            .withCause(ioException)
                            .asException());
                  }
                }

                @Override
                public void onFailure(Call call, IOException e) {
                  if (context.isCancelled()) {
                    emitter.tryOnError(context.cancellationStatus().asException());
                    return;
                  }
                  emitter.tryOnError(
                      Status.UNAVAILABLE
                          .withDescription("Request to " + request.url().encodedPath() + " failed")
                          .withCause(e)
                          .asException());
                }
              });
        });
  }

  private static String toEpochNanos(Instant instant) {
    return String.valueOf(TimeUnit.MILLISECONDS.toNanos(instant.toEpochMilli()));
  }
}
