package com.researchplatform.marketdata.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class MarketDataConfig {

    private static final Logger log = LoggerFactory.getLogger(MarketDataConfig.class);

    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String baseUrl;

    @Value("${alpha-vantage.timeout-seconds:30}")
    private int timeoutSeconds;

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Market data server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("apikey=[^&]+", "apikey=***");
            log.debug("[AlphaVantage] Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
