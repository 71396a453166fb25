package com.shopcraft.api.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

/**
 * HTTP 클라이언트 공통 설정
 * - WebClient: 프로바이더 설정의 connect/read 타임아웃 적용
 * - ObjectMapper: JSON 직렬화/역직렬화 설정
 */
@Configuration
public class HttpClientConfig {

    /**
     * Spring Boot 가 제공하는 WebClient.Builder 에 타임아웃 적용
     * 타임아웃은 Transport 실패로 취급되어 폴백 경로로 넘어감
     */
    @Bean
    public WebClientCustomizer providerTimeoutCustomizer(ProviderProperties providerProperties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) providerProperties.connectTimeout().toMillis())
                .responseTimeout(providerProperties.readTimeout());
        return builder -> builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                // 이미지 URL 응답 / 원본 이미지 다운로드용 버퍼 (16MB)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
    }

    /**
     * ObjectMapper Bean (싱글톤)
     * - 알 수 없는 속성 무시 (모델이 추가 필드를 붙여도 파싱 유지)
     * - Java 8 날짜/시간 지원
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
