package com.wellbridge.ai.config;

import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.tracing.Tracer;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

public class RequestIdFilterTest {

  private final RequestIdFilter filter = new RequestIdFilter(Tracer.NOOP);

  private String run(MockHttpServletRequest request, MockHttpServletResponse response) throws Exception {
    AtomicReference<String> seen = new AtomicReference<>();
    filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(RequestIdFilter.MDC_KEY)));
    return seen.get();
  }

  @Test
  void reusesSafeClientId() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/chat/stream");
    request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "web-1234.abc");
    MockHttpServletResponse response = new MockHttpServletResponse();

    assertEquals("web-1234.abc", run(request, response));
    assertEquals("web-1234.abc", response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
    assertNull(MDC.get(RequestIdFilter.MDC_KEY));
  }

  @Test
  void replacesUnsafeClientId() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/chat/stream");
    request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc\r\nSet-Cookie: x=1");
    MockHttpServletResponse response = new MockHttpServletResponse();

    String requestId = run(request, response);

    assertNotEquals("abc\r\nSet-Cookie: x=1", requestId);
    assertEquals(36, requestId.length());
    assertEquals(requestId, response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
  }

  @Test
  void generatesIdWhenMissing() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    String requestId = run(new MockHttpServletRequest("POST", "/chat/stream"), response);

    assertNotNull(requestId);
    assertEquals(requestId, response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
  }

  @Test
  void skipsActuatorEndpoints() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
    MockHttpServletResponse response = new MockHttpServletResponse();

    assertNull(run(request, response));
    assertNull(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
  }

  @Test
  void pathsThatOnlyShareThePrefixAreFiltered() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    assertNotNull(run(new MockHttpServletRequest("GET", "/actuatorish"), response));
  }

  @Test
  void overlongClientIdIsReplaced() {
    String overlong = "a".repeat(65);

    assertNotEquals(overlong, RequestIdFilter.resolve(overlong));
    assertEquals("a".repeat(64), RequestIdFilter.resolve("a".repeat(64)));
  }
}
