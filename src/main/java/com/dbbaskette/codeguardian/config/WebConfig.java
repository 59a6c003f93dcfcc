package com.dbbaskette.codeguardian.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.UUID;

/**
 * Tags every API request with a correlation id (taken from the caller or generated) so
 * log lines and error responses for one call can be matched up.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_MDC_KEY = "correlationId";

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new CorrelationIdInterceptor()).addPathPatterns("/api/**");
    }

    static class CorrelationIdInterceptor implements HandlerInterceptor {

        @Override
        public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
            String correlationId = request.getHeader(CORRELATION_HEADER);
            if (correlationId == null || correlationId.isBlank() || correlationId.length() > 64) {
                correlationId = UUID.randomUUID().toString();
            }
            MDC.put(CORRELATION_MDC_KEY, correlationId);
            response.setHeader(CORRELATION_HEADER, correlationId);
            return true;
        }

        @Override
        public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                    Object handler, Exception ex) {
            MDC.remove(CORRELATION_MDC_KEY);
        }
    }
}
