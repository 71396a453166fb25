package com.shopcraft.api.service.image;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Doubao Seedream images/generations 클라이언트
 */
@Slf4j
@Component
public class DoubaoImageCompositionClient implements ImageCompositionClient {

    private final ProviderProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;

    public DoubaoImageCompositionClient(ProviderProperties properties,
                                        WebClient.Builder webClientBuilder,
                                        ObjectMapper objectMapper) {
        this.properties = properties;
        this.webClient = webClientBuilder.build();
        this.objectMapper = objectMapper;
        this.endpoint = properties.resolveImageEndpoint();
        log.info("[HERO] Image endpoint resolved: {}", endpoint);
    }

    @Override
    public ProviderResult<String> compose(CompositionRequest request) {
        if (!properties.hasApiKey()) {
            return ProviderResult.failure(FailureKind.CONFIG_MISSING, "api key not configured");
        }

        log.info("[HERO] Calling image model: {}, size: {}", properties.imageModel(), request.getSizeTag());
        String response;
        try {
            response = webClient.post()
                    .uri(endpoint)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequestBody(request))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
        } catch (WebClientResponseException e) {
            return ProviderResult.failure(FailureKind.NON_SUCCESS_STATUS,
                    "HTTP " + e.getStatusCode().value() + ": " + ImageRefValidator.truncate(e.getResponseBodyAsString(), 200));
        } catch (WebClientRequestException e) {
            return ProviderResult.failure(FailureKind.TRANSPORT, e.getMessage());
        } catch (RuntimeException e) {
            return ProviderResult.failure(FailureKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (response == null || response.isBlank()) {
            return ProviderResult.failure(FailureKind.MALFORMED_PAYLOAD, "empty response body");
        }

        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode url = root.path("data").path(0).path("url");
            if (!isUsable(url)) {
                url = root.path("choices").path(0).path("data").path(0).path("url");
            }
            if (!isUsable(url)) {
                log.debug("[HERO] Response without url (first 200 chars): {}", ImageRefValidator.truncate(response, 200));
                return ProviderResult.failure(FailureKind.MALFORMED_PAYLOAD, "no image url in response");
            }
            return ProviderResult.success(url.asText());
        } catch (Exception e) {
            return ProviderResult.failure(FailureKind.MALFORMED_PAYLOAD, "response is not JSON: " + e.getMessage());
        }
    }

    Map<String, Object> buildRequestBody(CompositionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.imageModel());
        body.put("prompt", request.getInstructionText());
        body.put("image", request.getSourceImageRef());
        body.put("sequential_image_generation", "disabled");
        body.put("response_format", "url");
        body.put("size", request.getSizeTag());
        body.put("stream", false);
        body.put("watermark", true);
        return body;
    }

    String getEndpoint() {
        return endpoint;
    }

    private static boolean isUsable(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank();
    }
}
