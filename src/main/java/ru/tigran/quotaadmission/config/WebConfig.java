package ru.tigran.quotaadmission.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Конфигурация для web (CORS, логирование запросов)
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${cors.allowed-origins:http://localhost:3000,http://localhost:8080}")
    private String allowedOrigins;

    @Value("${app.web.slow-request-ms:500}")
    private long slowRequestMs;

    /**
     * CORS для participant-facing фронтенда и дашборда
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins.split(","))
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);

        registry.addMapping("/actuator/**")
                .allowedOrigins(allowedOrigins.split(","))
                .allowedMethods("GET")
                .allowedHeaders("*")
                .maxAge(3600);
    }

    @Bean
    public OncePerRequestFilter requestLoggingFilter() {
        return new OncePerRequestFilter() {
            @Override
            protected void doFilterInternal(
                    HttpServletRequest request,
                    HttpServletResponse response,
                    FilterChain filterChain
            ) throws ServletException, IOException {
                long startTime = System.currentTimeMillis();

                try {
                    filterChain.doFilter(request, response);
                } finally {
                    long duration = System.currentTimeMillis() - startTime;
                    int status = response.getStatus();

                    if (status >= 400) {
                        log.warn("Request: {} {} - Status: {} - Duration: {}ms",
                            request.getMethod(), request.getRequestURI(), status, duration);
                    } else if (duration > slowRequestMs) {
                        log.info("Request: {} {} - Status: {} - Duration: {}ms (slow)",
                            request.getMethod(), request.getRequestURI(), status, duration);
                    } else {
                        log.debug("Request: {} {} - Status: {} - Duration: {}ms",
                            request.getMethod(), request.getRequestURI(), status, duration);
                    }
                }
            }
        };
    }
}
