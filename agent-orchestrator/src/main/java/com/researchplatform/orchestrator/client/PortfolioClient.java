package com.researchplatform.orchestrator.client;

import com.researchplatform.common.exception.CollaboratorException;
import com.researchplatform.orchestrator.client.dto.PortfolioResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/** Read-only client for the internal portfolio service. */
@Component
public class PortfolioClient {

    private static final Logger log = LoggerFactory.getLogger(PortfolioClient.class);
    static final String COLLABORATOR = "portfolio";

    private final WebClient webClient;
    private final Duration timeout;

    public PortfolioClient(@Qualifier("portfolioWebClient") WebClient webClient,
                           @Value("${services.portfolio.timeout-seconds:180}") long timeoutSeconds) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public Mono<PortfolioResponse> query(String question) {
        if (!ReadOnlyQueryGuard.isReadOnly(question)) {
            log.warn("[Portfolio] Rejected write-shaped question. question={}", question);
            return Mono.error(new CollaboratorException(COLLABORATOR, "Only read-only questions are allowed"));
        }
        log.info("[Portfolio] Querying. question={}", question);
        return webClient.post()
            .uri("/portfolio_data")
            .bodyValue(Map.of("question", question))
            .retrieve()
            .bodyToMono(PortfolioResponse.class)
            .timeout(timeout)
            .flatMap(response -> response.isSuccess()
                ? Mono.just(response)
                : Mono.error(new CollaboratorException(COLLABORATOR, "Query failed: " + response.message())))
            .onErrorMap(e -> !(e instanceof CollaboratorException),
                e -> new CollaboratorException(COLLABORATOR, e.getMessage(), e));
    }
}
