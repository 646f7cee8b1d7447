package org.hypertrace.core.query.frontend.api;

/** Order in which log entries of a query are returned. */
public enum Direction {
  FORWARD,
  BACKWARD
}
