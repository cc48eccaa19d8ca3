package com.edge.registration.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 请求日志
 * <p>
 * 配准请求体里是 Base64 图片，只记录前若干字符
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_REQUEST_BODY_LOG = 256;
    private static final int MAX_RESPONSE_BODY_LOG = 2000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/swagger-ui") || path.startsWith("/v3/api-docs");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();

        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            logger.info("{} {} | Status: {} | Duration: {} ms",
                request.getMethod(), request.getRequestURI(), response.getStatus(), duration);

            if (logger.isDebugEnabled()) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.debug("Request Body ({} bytes): {}", content.length,
                        abbreviate(new String(content, StandardCharsets.UTF_8), MAX_REQUEST_BODY_LOG));
                }

                // 响应里可能有变换后的图片，只打印文本类响应
                byte[] responseContent = responseWrapper.getContentAsByteArray();
                String contentType = response.getContentType();
                if (responseContent.length > 0 && contentType != null
                    && (contentType.contains("json") || contentType.contains("text"))) {
                    logger.debug("Response Body: {}",
                        abbreviate(new String(responseContent, StandardCharsets.UTF_8), MAX_RESPONSE_BODY_LOG));
                }
            }

            // 复制响应到原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();
        }
    }

    static String abbreviate(String body, int max) {
        if (body.length() <= max) {
            return body;
        }
        return body.substring(0, max) + "...";
    }
}
