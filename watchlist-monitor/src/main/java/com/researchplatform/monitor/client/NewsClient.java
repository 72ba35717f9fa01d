package com.researchplatform.monitor.client;

import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.monitor.client.dto.NewsSearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Fetches the latest headline for a symbol from the search service. Completes empty when the
 * search returned nothing; transport and status failures surface as {@link CollaboratorException}.
 */
@Component
public class NewsClient {

    private static final Logger log = LoggerFactory.getLogger(NewsClient.class);
    static final String COLLABORATOR = "search";
    static final String DEPTH = "basic";

    private final WebClient webClient;
    private final Duration timeout;

    public NewsClient(@Qualifier("searchWebClient") WebClient webClient,
                      @Value("${services.search.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public Mono<NewsSearchResponse.Headline> latestHeadline(String symbol) {
        String query = newsQuery(symbol);
        return webClient.post()
            .uri("/research")
            .bodyValue(Map.of("queries", List.of(query), "search_depth", DEPTH))
            .retrieve()
            .bodyToMono(NewsSearchResponse.class)
            .timeout(timeout)
            .flatMap(response -> {
                if ("error".equalsIgnoreCase(response.status())) {
                    return Mono.error(new CollaboratorException(COLLABORATOR, "News search failed: " + response.message()));
                }
                return Mono.justOrEmpty(response.topHeadline());
            })
            .doOnSuccess(headline -> {
                if (headline == null) log.debug("[News] No headline. symbol={}", symbol);
            })
            .onErrorMap(e -> !(e instanceof CollaboratorException),
                e -> new CollaboratorException(COLLABORATOR, e.getMessage(), e));
    }

    static String newsQuery(String symbol) {
        return "breaking news " + symbol + " stock today";
    }
}
