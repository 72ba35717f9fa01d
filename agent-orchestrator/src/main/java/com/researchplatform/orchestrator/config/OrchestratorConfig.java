package com.researchplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.researchplatform.common.store.FileWatchlistStore;
import com.researchplatform.common.store.WatchlistStore;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class OrchestratorConfig {

    @Value("${services.search.base-url:http://localhost:8001}")
    private String searchUrl;

    @Value("${services.search.timeout-seconds:30}")
    private int searchTimeoutSeconds;

    @Value("${services.portfolio.base-url:http://localhost:8003}")
    private String portfolioUrl;

    @Value("${services.portfolio.timeout-seconds:180}")
    private int portfolioTimeoutSeconds;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicUrl;

    @Value("${anthropic.timeout-seconds:60}")
    private int anthropicTimeoutSeconds;

    @Value("${research.watchlist-path:watchlist.json}")
    private String watchlistPath;

    @Bean
    public WebClient searchWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(searchUrl)
            .clientConnector(connector(searchTimeoutSeconds))
            .build();
    }

    @Bean
    public WebClient portfolioWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(portfolioUrl)
            .clientConnector(connector(portfolioTimeoutSeconds))
            .build();
    }

    @Bean
    public WebClient anthropicWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(anthropicUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(connector(anthropicTimeoutSeconds))
            .build();
    }

    @Bean
    public WatchlistStore watchlistStore(ObjectMapper objectMapper) {
        return new FileWatchlistStore(Path.of(watchlistPath), objectMapper);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static ReactorClientHttpConnector connector(int timeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        return new ReactorClientHttpConnector(httpClient);
    }
}
