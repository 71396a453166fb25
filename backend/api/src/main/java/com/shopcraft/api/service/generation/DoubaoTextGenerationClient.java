package com.shopcraft.api.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcraft.api.config.ProviderProperties;
import com.shopcraft.api.service.provider.FailureKind;
import com.shopcraft.api.service.provider.ProviderResult;
import com.shopcraft.api.util.ImageRefValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Doubao(火山方舟) chat/completions 클라이언트
 */
@Slf4j
@Component
public class DoubaoTextGenerationClient implements TextGenerationClient {

    private final ProviderProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public DoubaoTextGenerationClient(ProviderProperties properties,
                                      WebClient.Builder webClientBuilder,
                                      ObjectMapper objectMapper) {
        this.properties = properties;
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ProviderResult<String> generate(List<ChatTurn> turns, String modelOverride) {
        if (!properties.isTextGenerationEnabled()) {
            return ProviderResult.failure(FailureKind.CONFIG_MISSING, "api key or text endpoint not configured");
        }

        String model = modelOverride != null && !modelOverride.isBlank() ? modelOverride : properties.textModel();
        Map<String, Object> requestBody = buildRequestBody(turns, model);
        log.info("[TEXT] Calling text model: {}, turns: {}", model, turns.size());

        String response;
        try {
            response = webClient.post()
                    .uri(properties.textEndpoint())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            return ProviderResult.failure(FailureKind.NON_SUCCESS_STATUS,
                    "HTTP " + e.getStatusCode().value() + ": " + ImageRefValidator.truncate(e.getResponseBodyAsString(), 200));
        } catch (WebClientRequestException e) {
            return ProviderResult.failure(FailureKind.TRANSPORT, e.getMessage());
        } catch (RuntimeException e) {
            // 타임아웃 등 reactor 예외
            return ProviderResult.failure(FailureKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (response == null || response.isBlank()) {
            return ProviderResult.failure(FailureKind.MALFORMED_PAYLOAD, "empty response body");
        }
        log.debug("[TEXT] Raw response (first 200 chars): {}", ImageRefValidator.truncate(response, 200));

        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                return ProviderResult.failure(FailureKind.MALFORMED_PAYLOAD, "choices[0].message.content missing");
            }
            return ProviderResult.success(content.asText());
        } catch (Exception e) {
            return ProviderResult.failure(FailureKind.MALFORMED_PAYLOAD, "response is not JSON: " + e.getMessage());
        }
    }

    /**
     * 요청 본문 - 모든 턴은 배열 content, 이미지가 있는 마지막 턴은 [image_url, text]
     */
    Map<String, Object> buildRequestBody(List<ChatTurn> turns, String model) {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (int i = 0; i < turns.size(); i++) {
            ChatTurn turn = turns.get(i);
            boolean last = i == turns.size() - 1;
            List<Map<String, Object>> content = new ArrayList<>();
            if (last && turn.getRole() == TurnRole.USER && turn.hasImage()) {
                content.add(Map.of("type", "image_url", "image_url", Map.of("url", turn.getImageRef())));
            }
            content.add(Map.of("type", "text", "text", turn.getContent()));
            messages.add(Map.of("role", turn.getRole().getValue(), "content", content));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_completion_tokens", properties.maxCompletionTokens());
        return body;
    }
}
