package com.researchplatform.orchestrator.client;

import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.orchestrator.client.dto.SearchResponse;
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
 * HTTP client for the web search service. Errors, including an {@code "error"} status in the
 * body, surface as {@link CollaboratorException}; callers own the fallback.
 */
@Component
public class WebResearchClient {

    private static final Logger log = LoggerFactory.getLogger(WebResearchClient.class);
    static final String COLLABORATOR = "search";

    private final WebClient webClient;
    private final Duration timeout;

    public WebResearchClient(@Qualifier("searchWebClient") WebClient webClient,
                             @Value("${services.search.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public Mono<SearchResponse> research(List<String> queries, String depth) {
        log.info("[WebResearch] Searching. queries={} depth={}", queries.size(), depth);
        return webClient.post()
            .uri("/research")
            .bodyValue(Map.of("queries", queries, "search_depth", depth))
            .retrieve()
            .bodyToMono(SearchResponse.class)
            .timeout(timeout)
            .flatMap(response -> "error".equalsIgnoreCase(response.status())
                ? Mono.error(new CollaboratorException(COLLABORATOR, "Search failed: " + response.message()))
                : Mono.just(response))
            .onErrorMap(e -> !(e instanceof CollaboratorException),
                e -> new CollaboratorException(COLLABORATOR, e.getMessage(), e));
    }
}
