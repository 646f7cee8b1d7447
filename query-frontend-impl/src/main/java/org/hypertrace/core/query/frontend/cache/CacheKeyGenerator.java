package org.hypertrace.core.query.frontend.cache;

import com.google.common.base.CharMatcher;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.frontend.QueryFrontendConfig;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.limits.LimitsSource;

/**
 * Builds result cache keys of the form {@code tenant:query:stepMillis:intervalIndex:widthMillis}.
 * Requests whose start falls into the same split interval share a key, so an interval cached by
 * one query is found by the next one covering it.
 */
@Singleton
public class CacheKeyGenerator {
  private final LimitsSource limitsSource;
  private final Duration defaultSplitInterval;

  @Inject
  CacheKeyGenerator(LimitsSource limitsSource, QueryFrontendConfig config) {
    this(limitsSource, config.getDefaultSplitInterval());
  }

  public CacheKeyGenerator(LimitsSource limitsSource, Duration defaultSplitInterval) {
    this.limitsSource = limitsSource;
    this.defaultSplitInterval = defaultSplitInterval;
  }

  public String generate(String tenantId, QueryRequest request) {
    Duration tenantSplit = this.limitsSource.forTenant(tenantId).getSplitQueriesByInterval();
    Duration split = tenantSplit.isZero() ? this.defaultSplitInterval : tenantSplit;
    long width = Math.max(0, split.toMillis());
    long intervalIndex =
        width == 0 ? 0 : Math.floorDiv(request.getStart().toEpochMilli(), width);
    return String.join(
        ":",
        tenantId,
        CharMatcher.whitespace().trimAndCollapseFrom(request.getQuery(), ' '),
        String.valueOf(request.getStep().toMillis()),
        String.valueOf(intervalIndex),
        String.valueOf(width));
  }
}
