package com.scorebook.gamestate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scorebook.gamestate.client.AccessTokenSupplier;
import com.scorebook.gamestate.client.ScorebookApiClient;
import com.scorebook.gamestate.client.ScorebookBackend;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    @Value("${scorebook.api.base-url:http://localhost:3000}")
    private String baseUrl;

    @Value("${scorebook.api.access-token:}")
    private String accessToken;

    @Value("${scorebook.api.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${scorebook.api.read-timeout-seconds:15}")
    private int readTimeoutSeconds;

    @Bean
    public WebClient scorebookWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    /** Static token from configuration. Replace with a bean that talks to the identity provider. */
    @Bean
    public AccessTokenSupplier accessTokenSupplier() {
        return () -> Mono.just(accessToken);
    }

    @Bean
    public ScorebookBackend scorebookBackend(WebClient scorebookWebClient, ObjectMapper objectMapper,
                                             AccessTokenSupplier accessTokenSupplier) {
        return new ScorebookApiClient(scorebookWebClient, objectMapper, accessTokenSupplier);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(WebClientConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
