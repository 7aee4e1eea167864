package dev.chatstore.storage.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Assigns every request a correlation id, exposes it through MDC and the {@code X-Request-Id}
 * response header, and logs request start and completion.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);
    private static final SecureRandom RNG = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    static String newRequestId() {
        byte[] b = new byte[12];
        RNG.nextBytes(b);
        return "req_" + HEX.formatHex(b);
    }

    static String getOrCreateRequestId(HttpServletRequest req) {
        String id = req.getHeader(HEADER);
        if (id != null) {
            id = id.trim();
            if (id.length() >= 8 && id.length() <= 128) return id;
        }
        return newRequestId();
    }

    public static String currentRequestId(HttpServletRequest req) {
        Object id = req.getAttribute(ATTRIBUTE);
        return id == null ? "unknown" : id.toString();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = getOrCreateRequestId(request);
        request.setAttribute(ATTRIBUTE, requestId);
        response.setHeader(HEADER, requestId);
        MDC.put("requestId", requestId);
        String userId = request.getHeader(USER_HEADER);
        if (userId != null && !userId.isBlank()) {
            MDC.put("userId", userId.trim());
        }

        long start = System.nanoTime();
        log.info("request started method={} path={} clientIp={}",
                request.getMethod(), request.getRequestURI(), ClientAddresses.resolve(request));
        try {
            chain.doFilter(request, response);
            log.info("request completed method={} path={} status={} durationMs={}",
                    request.getMethod(), request.getRequestURI(), response.getStatus(),
                    (System.nanoTime() - start) / 1_000_000);
        } catch (IOException | ServletException | RuntimeException ex) {
            log.error("request failed method={} path={} durationMs={} error={}",
                    request.getMethod(), request.getRequestURI(),
                    (System.nanoTime() - start) / 1_000_000, ex.toString());
            throw ex;
        } finally {
            MDC.remove("requestId");
            MDC.remove("userId");
        }
    }
}
