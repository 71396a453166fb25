package com.shopcraft.api.service.image;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopcraft.api.config.HttpClientConfig;
import com.shopcraft.api.config.ProviderProperties;
import com.shopcraft.api.service.provider.FailureKind;
import com.shopcraft.api.service.provider.ProviderResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class DoubaoImageCompositionClientTest {

    private final ObjectMapper objectMapper = new HttpClientConfig().objectMapper();

    private final CompositionRequest request =
            new CompositionRequest("https://cdn.example.com/p.png", "生成电商主图", null);

    @Test
    void urlFromDataArray() {
        DoubaoImageCompositionClient client = client(configured(null),
                r -> Mono.just(json(HttpStatus.OK, "{\"data\":[{\"url\":\"https://img.example.com/out.png\"}]}")));

        ProviderResult<String> result = client.compose(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("https://img.example.com/out.png");
    }

    @Test
    void urlFromChoicesShape() {
        DoubaoImageCompositionClient client = client(configured(null),
                r -> Mono.just(json(HttpStatus.OK, "{\"choices\":[{\"data\":[{\"url\":\"https://img.example.com/alt.png\"}]}]}")));

        assertThat(client.compose(request).getValue()).isEqualTo("https://img.example.com/alt.png");
    }

    @Test
    void responseWithoutUsableUrlIsMalformed() {
        DoubaoImageCompositionClient nonString = client(configured(null),
                r -> Mono.just(json(HttpStatus.OK, "{\"data\":[{\"url\":42}]}")));
        DoubaoImageCompositionClient empty = client(configured(null),
                r -> Mono.just(json(HttpStatus.OK, "{\"data\":[]}")));

        assertThat(nonString.compose(request).getFailureKind()).isEqualTo(FailureKind.MALFORMED_PAYLOAD);
        assertThat(empty.compose(request).getFailureKind()).isEqualTo(FailureKind.MALFORMED_PAYLOAD);
    }

    @Test
    void nonSuccessStatusIsReported() {
        DoubaoImageCompositionClient client = client(configured(null),
                r -> Mono.just(json(HttpStatus.BAD_GATEWAY, "{}")));

        assertThat(client.compose(request).getFailureKind()).isEqualTo(FailureKind.NON_SUCCESS_STATUS);
    }

    @Test
    void missingKeyIsConfigMissing() {
        DoubaoImageCompositionClient client = client(ProviderProperties.disabled(),
                r -> Mono.error(new AssertionError("must not be called")));

        assertThat(client.compose(request).getFailureKind()).isEqualTo(FailureKind.CONFIG_MISSING);
    }

    @Test
    void sendsFixedRequestShapeToDerivedEndpoint() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        DoubaoImageCompositionClient client = client(configured(null), r -> {
            captured.set(r);
            return Mono.just(json(HttpStatus.OK, "{\"data\":[{\"url\":\"https://img.example.com/out.png\"}]}"));
        });

        client.compose(request);

        assertThat(captured.get().url().toString())
                .isEqualTo("https://ark.example.com/api/v3/images/generations");
        Map<String, Object> body = client.buildRequestBody(request);
        assertThat(body)
                .containsEntry("model", ProviderProperties.DEFAULT_IMAGE_MODEL)
                .containsEntry("prompt", "生成电商主图")
                .containsEntry("image", "https://cdn.example.com/p.png")
                .containsEntry("sequential_image_generation", "disabled")
                .containsEntry("response_format", "url")
                .containsEntry("size", "2K")
                .containsEntry("stream", false)
                .containsEntry("watermark", true);
    }

    @Test
    void dedicatedEndpointIsUsedWhenConfigured() {
        DoubaoImageCompositionClient client = client(configured("https://images.example.com/gen"), r -> Mono.empty());

        assertThat(client.getEndpoint()).isEqualTo("https://images.example.com/gen");
    }

    private DoubaoImageCompositionClient client(ProviderProperties properties, ExchangeFunction exchange) {
        return new DoubaoImageCompositionClient(properties, WebClient.builder().exchangeFunction(exchange), objectMapper);
    }

    private static ProviderProperties configured(String imageEndpoint) {
        return new ProviderProperties("test-key", "https://ark.example.com/api/v3/chat/completions",
                imageEndpoint, null, null, null, null, null);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
