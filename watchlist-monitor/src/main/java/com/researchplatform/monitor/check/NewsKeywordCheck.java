package com.researchplatform.monitor.check;

import com.researchplatform.common.model.Alert;
import com.researchplatform.common.model.AlertType;
import com.researchplatform.monitor.client.NewsClient;
import com.researchplatform.monitor.client.dto.NewsSearchResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Fires a NEWS alert when the symbol's top headline mentions a market-moving keyword. */
@Component
public class NewsKeywordCheck implements SymbolCheck {

    static final List<String> KEYWORDS = List.of(
        "acquisition", "merger", "earnings", "crash", "surge", "plunge", "fda", "lawsuit",
        "sec", "filing", "8-k", "10-k", "insider", "partnership", "deal", "bankruptcy", "recall",
        "investigation", "upgrade", "downgrade", "target", "buyback", "dividend");

    // Whole words plus common inflections, so "sec" does not fire on "sector" or "second".
    private static final Pattern KEYWORD_MATCH = Pattern.compile(
        KEYWORDS.stream().map(Pattern::quote).collect(Collectors.joining("|", "\\b(?:", ")(?:s|es|d|ed|ing|ings)?\\b")));

    private static final int CONTENT_PREVIEW = 200;

    private final NewsClient newsClient;
    private final Clock clock;

    public NewsKeywordCheck(NewsClient newsClient, Clock clock) {
        this.newsClient = newsClient;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "news_keyword";
    }

    @Override
    public Mono<Alert> check(String symbol) {
        return newsClient.latestHeadline(symbol)
            .flatMap(headline -> Mono.justOrEmpty(evaluate(symbol, headline, clock.instant())));
    }

    static Optional<Alert> evaluate(String symbol, NewsSearchResponse.Headline headline, Instant now) {
        String title = headline.title();
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String lower = title.toLowerCase(Locale.ROOT);
        if (!KEYWORD_MATCH.matcher(lower).find()) {
            return Optional.empty();
        }
        String content = headline.content() == null ? "" : headline.content();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("title", title);
        details.put("url", headline.url() == null ? "" : headline.url());
        details.put("content", content.substring(0, Math.min(CONTENT_PREVIEW, content.length())) + "...");
        return Optional.of(new Alert(now, AlertType.NEWS, symbol, "NEWS ALERT: " + symbol + " - " + title, details));
    }
}
