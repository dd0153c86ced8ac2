package com.ospicorp.soilprofile.analysis.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.client.RestClientException;

/**
 * Performs a single HTTP attempt. Implementations throw on any transport-level failure,
 * including non-2xx responses; retrying is the caller's concern.
 */
@FunctionalInterface
public interface SourceTransport {

  JsonNode exchange(SourceRequest request) throws RestClientException;
}
