package com.frontdesk.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP 链路日志过滤器：分配 traceId / requestId 写入 MDC 与响应头，输出 HTTP_IN / HTTP_OUT。
 * <p>
 * HTTP_OUT 会从 JSON 响应体中取出 {@code Response.code}，业务失败（非 0000）按 WARN 输出。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String SUCCESS_CODE = "0000";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper, ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includes = properties.getIncludePathPatterns();
        return includes != null && !includes.isEmpty() && !matchesAny(path, includes);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = headerOrRandom(request.getHeader(HEADER_TRACE_ID));
        String requestId = headerOrRandom(request.getHeader(HEADER_REQUEST_ID));
        String method = request.getMethod();
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        boolean sampled = sampled();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path, sanitizeQuery(request.getQueryString()));
        }
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper cached
                ? cached
                : new ContentCachingResponseWrapper(response);
        long startNs = System.nanoTime();
        Exception error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (ServletException | IOException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            String responseCode = responseCode(responseWrapper);
            boolean slow = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            boolean failed = error != null || (responseCode != null && !SUCCESS_CODE.equals(responseCode));
            if (slow || failed) {
                log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}, errorType={}",
                        method, path, responseWrapper.getStatus(), StringUtils.defaultIfBlank(responseCode, "-"),
                        costMs, slow, error == null ? "-" : error.getClass().getSimpleName());
            } else if (sampled) {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}",
                        method, path, responseWrapper.getStatus(), StringUtils.defaultIfBlank(responseCode, "-"),
                        costMs);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String headerOrRandom(String value) {
        return StringUtils.isNotBlank(value) ? value.trim() : UUID.randomUUID().toString().replace("-", "");
    }

    private boolean sampled() {
        double rate = properties.getSampleRate();
        return rate >= 1D || (rate > 0D && ThreadLocalRandom.current().nextDouble() < rate);
    }

    private String responseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        String contentType = responseWrapper.getContentType();
        if (body.length == 0 || contentType == null
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null || code.isNull() ? null : code.asText();
        } catch (IOException ex) {
            log.debug("HTTP_OUT_BODY_UNPARSEABLE error={}", ex.getMessage());
            return null;
        }
    }

    private String sanitizeQuery(String queryString) {
        if (StringUtils.isBlank(queryString)) {
            return "-";
        }
        List<String> parts = new ArrayList<>();
        for (String part : queryString.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            boolean masked = properties.getMaskQueryKeys() != null
                    && properties.getMaskQueryKeys().stream().anyMatch(key -> key.equalsIgnoreCase(kv[0]));
            String value = kv.length > 1 ? kv[1] : "";
            parts.add(kv[0] + "=" + (masked ? "***" : StringUtils.abbreviate(value, 80)));
        }
        return String.join("&", parts);
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}
