package com.bko.planner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs the raw HTTP exchange with the model provider under {@code com.bko.planner.http.logging}.
 */
@Configuration
public class LlmHttpLoggingConfig {

    static final String HTTP_LOGGER = "com.bko.planner.http.logging";

    @Bean
    public RestClientCustomizer llmRestClientCustomizer(PlannerProperties properties) {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LlmExchangeInterceptor());
            // the response body is read twice: once here, once by the model client
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(
                    modelRequestFactory(properties.getGeneration())));
        };
    }

    /**
     * Socket timeouts for model calls. The read timeout matches the generation timeout so a
     * cancelled call also releases its connection.
     */
    static SimpleClientHttpRequestFactory modelRequestFactory(PlannerProperties.GenerationConfig generation) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(generation.getConnectTimeout());
        factory.setReadTimeout(generation.getTimeout());
        return factory;
    }

    /**
     * Local OpenAI-compatible endpoints reject a placeholder key, so {@code Bearer none} is sent as empty.
     */
    static void normalizeAuthorization(HttpHeaders headers) {
        String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (auth == null) {
            return;
        }
        String trimmed = auth.trim();
        if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
            headers.set(HttpHeaders.AUTHORIZATION, "");
        }
    }

    static class LlmExchangeInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            normalizeAuthorization(request.getHeaders());
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("LLM request {} {} ({} bytes): {}", request.getMethod(), request.getURI(), body.length,
                        new String(body, StandardCharsets.UTF_8));
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
                httpLogger.debug("LLM response {}: {}", response.getStatusCode(), new String(responseBody, StandardCharsets.UTF_8));
            }
            return response;
        }
    }
}
