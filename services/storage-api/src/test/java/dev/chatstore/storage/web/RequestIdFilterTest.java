package dev.chatstore.storage.web;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void keepsAcceptableIncomingId_andExposesItInMdcDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader("X-Request-Id", "  req_from_gateway_42  ");
        request.addHeader("X-User-Id", "user-7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();
        AtomicReference<String> seenUserId = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seenRequestId.set(MDC.get("requestId"));
            seenUserId.set(MDC.get("userId"));
        });

        assertThat(response.getHeader("X-Request-Id")).isEqualTo("req_from_gateway_42");
        assertThat(RequestIdFilter.currentRequestId(request)).isEqualTo("req_from_gateway_42");
        assertThat(seenRequestId.get()).isEqualTo("req_from_gateway_42");
        assertThat(seenUserId.get()).isEqualTo("user-7");
        assertThat(MDC.get("requestId")).isNull();
    }

    @Test
    void replacesTooShortOrTooLongIds() throws Exception {
        for (String incoming : new String[]{"short", "x".repeat(129)}) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
            request.addHeader("X-Request-Id", incoming);
            MockHttpServletResponse response = new MockHttpServletResponse();

            filter.doFilter(request, response, new MockFilterChain());

            assertThat(response.getHeader("X-Request-Id")).matches("req_[0-9a-f]{24}");
        }
    }
}
