package com.bko.planner.execution;

import static com.bko.planner.execution.PlannerConstants.INVALID_JSON_RETRY_PROMPT;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link GenerationClient} backed by the Spring AI chat client. Each call runs on the generation
 * executor and is bounded by the request timeout, after which it is cancelled; structured responses
 * get one retry with an explicit "JSON only" reminder before being reported as malformed.
 */
@Service
@Slf4j
public class SpringAiGenerationClient implements GenerationClient {

    private final ChatClient chatClient;
    private final ExecutorService generationExecutor;
    private final JsonProcessingService jsonProcessingService;
    private final PlannerMetricsService metricsService;

    public SpringAiGenerationClient(ChatClient chatClient,
                                    @Qualifier("generationExecutor") ExecutorService generationExecutor,
                                    JsonProcessingService jsonProcessingService,
                                    PlannerMetricsService metricsService) {
        this.chatClient = chatClient;
        this.generationExecutor = generationExecutor;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
    }

    @Override
    public JsonNode generate(GenerationRequest request) {
        String raw = call(request, request.systemPrompt());
        if (request.contract() == ResponseContract.TEXT) {
            return jsonProcessingService.wrapText(raw);
        }
        JsonNode parsed = jsonProcessingService.parseJsonTree(request.purpose(), raw);
        if (parsed == null) {
            String retryPurpose = request.purpose() + "-retry";
            String retryRaw = call(request, request.systemPrompt() + INVALID_JSON_RETRY_PROMPT);
            parsed = jsonProcessingService.parseJsonTree(retryPurpose, retryRaw);
            if (parsed == null) {
                String snippet = retryRaw == null ? "<empty>" : jsonProcessingService.truncate(retryRaw, 240);
                metricsService.recordGenerationFailure(request.purpose(), "malformed output");
                throw new MalformedOutputException(request.purpose(), snippet);
            }
        }
        return parsed;
    }

    private String call(GenerationRequest request, String systemPrompt) {
        metricsService.recordGenerationCall(request.purpose());
        Future<String> future = generationExecutor.submit(() -> chatClient.prompt()
                .options(optionsFor(request))
                .system(systemPrompt)
                .user(request.userPrompt())
                .call()
                .content());
        try {
            return future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            // interrupt the worker so a hung call does not hold a pool thread
            future.cancel(true);
            metricsService.recordGenerationFailure(request.purpose(), "timeout");
            throw new GenerationTimeoutException(request.purpose(), request.timeout());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            metricsService.recordGenerationFailure(request.purpose(), cause.getClass().getSimpleName());
            throw new GenerationTransportException(request.purpose(), cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            metricsService.recordGenerationFailure(request.purpose(), "interrupted");
            throw new GenerationTransportException(request.purpose(), ex);
        }
    }

    private OpenAiChatOptions optionsFor(GenerationRequest request) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .maxTokens(request.maxTokens());
        if (request.contract() == ResponseContract.JSON_SCHEMA) {
            builder.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormat.Type.JSON_SCHEMA)
                    .jsonSchema(request.schema())
                    .build());
        } else if (request.contract() == ResponseContract.JSON) {
            builder.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormat.Type.JSON_OBJECT)
                    .build());
        }
        return builder.build();
    }
}
