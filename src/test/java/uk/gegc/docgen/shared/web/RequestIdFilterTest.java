package uk.gegc.docgen.shared.web;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("RequestIdFilter")
class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("echoes a well-formed caller id and exposes it to logging while the request runs")
    void echoesCallerId() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();
        MockFilterChain chain = new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse res) {
                seenInMdc.set(MDC.get(RequestIdFilter.MDC_KEY));
            }
        });

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(seenInMdc.get()).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("generates an id when the caller sends none")
    void generatesId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/health"), response, new MockFilterChain());

        String id = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertThatCode(() -> UUID.fromString(id)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("replaces ids with unsafe characters or excessive length")
    void rejectsUnsafeIds() {
        assertThat(RequestIdFilter.resolveRequestId("bad id\nInjected: 1")).isNotEqualTo("bad id\nInjected: 1");
        assertThat(RequestIdFilter.resolveRequestId("x".repeat(129))).hasSize(36);
        assertThat(RequestIdFilter.resolveRequestId("  trimmed.id_1  ")).isEqualTo("trimmed.id_1");
    }
}
