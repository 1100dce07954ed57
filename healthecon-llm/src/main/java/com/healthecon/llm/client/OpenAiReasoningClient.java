package com.healthecon.llm.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthecon.common.constants.ErrorKind;
import com.healthecon.llm.config.ReasoningProperties;
import com.healthecon.llm.model.BillContent;
import com.healthecon.llm.model.ReasoningRequest;
import com.healthecon.llm.model.ReasoningResponse;
import com.healthecon.llm.prompt.ResearchPrompts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completions client for an OpenAI compatible reasoning endpoint.
 */
@Component
@Slf4j
public class OpenAiReasoningClient implements ReasoningClient {

    private static final int BILL_SUMMARY_MAX_TOKENS = 500;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ReasoningProperties properties;

    public OpenAiReasoningClient(WebClient.Builder webClientBuilder, ObjectMapper objectMapper, ReasoningProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.webClient = webClientBuilder
            .baseUrl(properties.getBaseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public ReasoningResponse complete(ReasoningRequest request, Duration timeout) throws ReasoningServiceException {
        String userMessage = ResearchPrompts.buildUserMessage(request);

        log.debug("[OPENAI] Sending request | model={} | promptLength={} | contextDocuments={}",
            properties.getModel(), userMessage.length(), request.getContextDocuments().size());

        return post(List.of(
            Map.of("role", "system", "content", ResearchPrompts.SYSTEM_PROMPT),
            Map.of("role", "user", "content", userMessage)
        ), properties.getMaxOutputTokens(), timeout);
    }

    @Override
    public ReasoningResponse describeBill(BillContent bill, Duration timeout) throws ReasoningServiceException {
        Object billPart;
        if (bill.isImage()) {
            String dataUrl = "data:" + bill.getMediaType() + ";base64," + Base64.getEncoder().encodeToString(bill.getData());
            billPart = Map.of("type", "image_url", "image_url", Map.of("url", dataUrl));
        } else {
            billPart = Map.of("type", "text", "text", new String(bill.getData(), StandardCharsets.UTF_8));
        }

        log.debug("[OPENAI] Sending bill for analysis | billId={} | mediaType={} | sizeBytes={}",
            bill.getBillId(), bill.getMediaType(), bill.getData().length);

        return post(List.of(
            Map.of("role", "system", "content", ResearchPrompts.BILL_ANALYSIS_SYSTEM_PROMPT),
            Map.of("role", "user", "content", List.of(
                Map.of("type", "text", "text", ResearchPrompts.BILL_ANALYSIS_INSTRUCTION),
                billPart))
        ), BILL_SUMMARY_MAX_TOKENS, timeout);
    }

    private ReasoningResponse post(List<Map<String, Object>> messages, int maxTokens, Duration timeout) {
        if (!properties.hasApiKey()) {
            throw new ReasoningServiceException(
                "Reasoning API key not configured. Set OPENAI_API_KEY or reasoning.api-key",
                ErrorKind.AUTHENTICATION, 401);
        }

        long startTime = System.currentTimeMillis();
        String model = properties.getModel();
        Map<String, Object> body = Map.of(
            "model", model,
            "messages", messages,
            "max_tokens", maxTokens
        );

        String response;
        try {
            // Timing out cancels the subscription, which releases the underlying connection
            response = webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new ReasoningServiceException(
                    "Attempt exceeded timeout of " + timeout.toMillis() + "ms", ErrorKind.TIMEOUT, 0, e))
                .block();
        } catch (WebClientResponseException e) {
            log.warn("[OPENAI] HTTP error | model={} | statusCode={} | durationMs={}",
                model, e.getStatusCode().value(), System.currentTimeMillis() - startTime);
            throw mapException(e);
        } catch (WebClientRequestException e) {
            throw new ReasoningServiceException(
                "Reasoning service unreachable: " + e.getMessage(), ErrorKind.NETWORK_ERROR, 0, e);
        }

        ReasoningResponse parsed = parseResponse(response, model);
        log.debug("[OPENAI] Response received | model={} | durationMs={} | answerLength={}",
            parsed.getModel(), System.currentTimeMillis() - startTime, parsed.getAnswer().length());
        return parsed;
    }

    ReasoningResponse parseResponse(String response, String requestedModel) throws ReasoningServiceException {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "" : response);
        } catch (Exception e) {
            throw new ReasoningServiceException(
                "Failed to parse reasoning response", ErrorKind.INVALID_RESPONSE, 200, e);
        }

        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new ReasoningServiceException(
                "Reasoning response contained no choices", ErrorKind.INVALID_RESPONSE, 200);
        }
        if ("content_filter".equals(choice.path("finish_reason").asText())) {
            throw new ReasoningServiceException(
                "Answer blocked by the content policy filter", ErrorKind.CONTENT_POLICY, 200);
        }

        String content = choice.path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new ReasoningServiceException(
                "Reasoning response contained an empty answer", ErrorKind.INVALID_RESPONSE, 200);
        }
        if ("length".equals(choice.path("finish_reason").asText())) {
            log.warn("[OPENAI] Answer truncated by max_tokens | answerLength={}", content.length());
        }

        String model = root.path("model").asText(requestedModel);
        return new ReasoningResponse(content, model);
    }

    ReasoningServiceException mapException(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String message = String.format("Reasoning API error: %d %s", status, e.getStatusText());
        String code = null;

        try {
            JsonNode error = objectMapper.readTree(e.getResponseBodyAsString()).path("error");
            if (error.hasNonNull("message")) {
                message = error.get("message").asText();
            }
            if (error.hasNonNull("code")) {
                code = error.get("code").asText();
            }
        } catch (Exception parseFailure) {
            log.debug("[OPENAI] Error body was not JSON | statusCode={}", status);
        }

        return new ReasoningServiceException(message, classifyStatus(status, code), status, e);
    }

    static ErrorKind classifyStatus(int status, String errorCode) {
        if (status == 400 && "content_policy_violation".equals(errorCode)) return ErrorKind.CONTENT_POLICY;
        if (status == 401 || status == 403) return ErrorKind.AUTHENTICATION;
        if (status == 408) return ErrorKind.TIMEOUT;
        if (status == 429) return ErrorKind.RATE_LIMITED;
        if (status >= 500) return ErrorKind.SERVER_ERROR;
        return ErrorKind.MALFORMED_REQUEST;
    }

    @Override
    public String getDefaultModel() {
        return properties.getModel();
    }

    @Override
    public boolean isConfigured() {
        return properties.hasApiKey();
    }
}
