package org.hypertrace.core.query.frontend.api;

import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link QueryRequest} */
public class QueryRequestTest {
  @Test
  public void testWithTimeRangeKeepsOtherFields() {
    QueryRequest request =
        QueryRequest.builder()
            .query("rate({app=\"foo\"}[1m])")
            .start(Instant.ofEpochMilli(1000))
            .end(Instant.ofEpochMilli(5000))
            .direction(Direction.BACKWARD)
            .limit(100)
            .path("/query_range")
            .build();

    QueryRequest narrowed =
        request.withTimeRange(Instant.ofEpochMilli(2000), Instant.ofEpochMilli(3000));

    Assertions.assertEquals(Instant.ofEpochMilli(2000), narrowed.getStart());
    Assertions.assertEquals(Instant.ofEpochMilli(3000), narrowed.getEnd());
    Assertions.assertEquals(request.getQuery(), narrowed.getQuery());
    Assertions.assertEquals(Direction.BACKWARD, narrowed.getDirection());
    Assertions.assertEquals(100, narrowed.getLimit());
    Assertions.assertEquals("/query_range", narrowed.getPath());
  }

  @Test
  public void testRequiresQueryAndTimeRange() {
    Assertions.assertThrows(
        NullPointerException.class,
        () -> QueryRequest.builder().start(Instant.EPOCH).end(Instant.EPOCH).build());
  }
}
