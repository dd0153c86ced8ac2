package com.ospicorp.soilprofile.analysis.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Payload of a source call together with its success flag. Failed calls carry an empty JSON
 * object, never null.
 */
public record FetchResult(JsonNode payload, boolean ok) {

  private static final FetchResult FAILED =
      new FetchResult(JsonNodeFactory.instance.objectNode(), false);

  public FetchResult {
    payload = payload == null || payload.isNull() || payload.isMissingNode()
        ? JsonNodeFactory.instance.objectNode()
        : payload;
  }

  public static FetchResult success(JsonNode payload) {
    return new FetchResult(payload, true);
  }

  public static FetchResult failed() {
    return FAILED;
  }
}
