package org.hypertrace.core.query.frontend.client;

import io.grpc.Status;

class HttpStatusConverter {
  private static final int CLIENT_CLOSED_REQUEST = 499;

  static Status toStatus(int httpCode) {
    switch (httpCode) {
      case 400:
        return Status.INVALID_ARGUMENT;
      case 401:
        return Status.UNAUTHENTICATED;
      case 403:
        return Status.PERMISSION_DENIED;
      case 404:
        return Status.NOT_FOUND;
      case 429:
        return Status.RESOURCE_EXHAUSTED;
      case CLIENT_CLOSED_REQUEST:
        return Status.CANCELLED;
      case 501:
        return Status.UNIMPLEMENTED;
      case 502:
      case 503:
        return Status.UNAVAILABLE;
      case 504:
        return Status.DEADLINE_EXCEEDED;
      default:
        return httpCode >= 500 ? Status.INTERNAL : Status.UNKNOWN;
    }
  }
}
