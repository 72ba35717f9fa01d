package com.researchplatform.monitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.researchplatform.common.store.AlertLog;
import com.researchplatform.common.store.FileAlertLog;
import com.researchplatform.common.store.FileWatchlistStore;
import com.researchplatform.common.store.WatchlistStore;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MonitorConfig {

    @Value("${services.search.base-url:http://localhost:8001}")
    private String searchUrl;

    @Value("${services.search.timeout-seconds:30}")
    private int searchTimeoutSeconds;

    @Value("${monitor.watchlist-path:watchlist.json}")
    private String watchlistPath;

    @Value("${monitor.alerts-path:alerts.json}")
    private String alertsPath;

    @Value("${monitor.alert-capacity:100}")
    private int alertCapacity;

    @Bean
    public WebClient searchWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(searchTimeoutSeconds))
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(searchTimeoutSeconds, TimeUnit.SECONDS)));
        return builder.clone()
            .baseUrl(searchUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    /** Shared with the scan engine picked up from the market data module. */
    @Bean
    public WatchlistStore watchlistStore(ObjectMapper objectMapper) {
        return new FileWatchlistStore(Path.of(watchlistPath), objectMapper);
    }

    @Bean
    public AlertLog alertLog(ObjectMapper objectMapper) {
        return new FileAlertLog(Path.of(alertsPath), alertCapacity, objectMapper);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
