package com.ttm.backend.pr.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class ProgramApiConfig {

    @Bean("programRestClient")
    public RestClient programRestClient(
            @Value("${app.program-api.base-url:https://ttm-metrics-api-production.up.railway.app/api}") String baseUrl,
            @Value("${app.program-api.connect-timeout:PT3S}") Duration connectTimeout,
            @Value("${app.program-api.read-timeout:PT10S}") Duration readTimeout,
            @Value("${app.program-api.user-agent:ttm-pr-backend/1.0}") String userAgent
    ) {
        return build(baseUrl, connectTimeout, readTimeout, userAgent);
    }

    static RestClient build(String baseUrl, Duration connectTimeout, Duration readTimeout, String userAgent) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public ProgramExerciseProvider programExerciseProvider(
            @Qualifier("programRestClient") RestClient http,
            ObjectMapper om
    ) {
        return new ProgramApiClient(http, om);
    }
}
