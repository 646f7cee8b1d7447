package org.hypertrace.core.query.frontend.api;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** One metric series of a matrix result, identified by its label set. */
@Value
@Builder(toBuilder = true)
public class Series {
  @Singular Map<String, String> labels;
  @Singular List<Sample> samples;
}
