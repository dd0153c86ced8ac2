package com.ospicorp.soilprofile.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestLoggingFilterTest {

  private final RequestLoggingFilter filter = new RequestLoggingFilter();

  @Test
  void suppliedIdIsEchoedAndVisibleInMdc() throws Exception {
    var request = new MockHttpServletRequest("GET", "/v1/analysis");
    request.setQueryString("lat=1&lon=2");
    request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "abc-123");
    var response = new MockHttpServletResponse();
    var seen = new AtomicReference<String>();

    filter.doFilter(request, response,
        (req, res) -> seen.set(MDC.get(RequestLoggingFilter.REQUEST_ID_MDC_KEY)));

    assertThat(seen.get()).isEqualTo("abc-123");
    assertThat(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
    assertThat(MDC.get(RequestLoggingFilter.REQUEST_ID_MDC_KEY)).isNull();
  }

  @Test
  void suspiciousIdIsReplaced() {
    var request = new MockHttpServletRequest("GET", "/");
    request.addHeader(RequestLoggingFilter.REQUEST_ID_HEADER, "id with spaces\n");

    String id = RequestLoggingFilter.resolveRequestId(request);

    assertThat(id).isNotEqualTo("id with spaces\n");
    assertThat(id).matches("[0-9a-f-]{36}");
  }

  @Test
  void missingIdIsGenerated() {
    String first = RequestLoggingFilter.resolveRequestId(new MockHttpServletRequest());
    String second = RequestLoggingFilter.resolveRequestId(new MockHttpServletRequest());

    assertThat(first).isNotBlank().isNotEqualTo(second);
  }

  @Test
  void clientIpPrefersForwardedHeader() {
    var request = new MockHttpServletRequest("GET", "/v1/ping");
    request.setRemoteAddr("10.0.0.5");
    request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

    assertThat(RequestDescriptions.clientIp(request)).isEqualTo("203.0.113.7");
    assertThat(RequestDescriptions.clientIp(new MockHttpServletRequest())).isEqualTo("127.0.0.1");
  }
}
