package com.flowhub.orderservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowhub.common.resilience.ResilienceProperties;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(ResilienceProperties resilienceProperties, ObjectMapper objectMapper) {
        // Connection timeout lives here, the per-call timeout is applied by ResilientCallExecutor
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) resilienceProperties.getConnectTimeout().toMillis());
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper, MediaType.APPLICATION_JSON));
                });
    }

    @Bean
    public WebClient inventoryWebClient(WebClient.Builder builder, ReservationProperties properties) {
        return builder.clone().baseUrl(properties.getInventoryUrl()).build();
    }

    @Bean
    public WebClient catalogWebClient(WebClient.Builder builder, ReservationProperties properties) {
        return builder.clone().baseUrl(properties.getCatalogUrl()).build();
    }
}
