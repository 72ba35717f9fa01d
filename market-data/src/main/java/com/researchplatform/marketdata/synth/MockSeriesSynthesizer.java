package com.researchplatform.marketdata.synth;

import com.researchplatform.common.model.PriceBar;
import com.researchplatform.common.model.Provenance;
import com.researchplatform.common.model.TimeRange;
import com.researchplatform.common.model.TimeSeries;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic stand-in for the live source.
 *
 * <p>The random generator is seeded from {@code symbol + "_" + date}, so every call for the same
 * symbol, range and calendar day yields the same prices. The path is a symbol-derived base price,
 * a bounded random walk with a per-symbol trend sign, and two sine components. Closes never drop
 * below 1.0.
 */
@Component
public class MockSeriesSynthesizer {

    static final double PRICE_FLOOR = 1.0;

    private static final Map<String, Double> KNOWN_BASES = new LinkedHashMap<>();
    static {
        KNOWN_BASES.put("AAPL", 150.0);
        KNOWN_BASES.put("TSLA", 250.0);
        KNOWN_BASES.put("NVDA", 450.0);
        KNOWN_BASES.put("MSFT", 350.0);
        KNOWN_BASES.put("GOOG", 130.0);
        KNOWN_BASES.put("AMZN", 140.0);
    }

    public TimeSeries generate(String symbol, TimeRange range, LocalDateTime now, String reason) {
        LocalDate day = now.toLocalDate();
        String dayKey = day.toString();
        Random random = new Random((symbol + "_" + dayKey).hashCode());

        int checksum = checksum(symbol);
        double basePrice = basePrice(symbol, checksum) + Math.floorMod(dayKey.hashCode(), 100) / 10.0;
        int trendDirection = checksum % 2 == 0 ? 1 : -1;
        double volatility = basePrice * 0.02;
        double trendStrength = basePrice * 0.001;

        int points = range.syntheticPoints();
        LocalDateTime anchor = anchor(range, now);
        List<PriceBar> bars = new ArrayList<>(points);
        double current = basePrice;

        for (int i = 0; i < points; i++) {
            double change = uniform(random, -volatility, volatility) + trendDirection * trendStrength;
            current = Math.max(PRICE_FLOOR, current + change);
            double cycle = basePrice * 0.02 * Math.sin(i / 8.0) + basePrice * 0.01 * Math.sin(i / 3.0);
            double price = Math.max(PRICE_FLOOR, current + cycle);

            double open = round2(price + uniform(random, -volatility * 0.2, volatility * 0.2));
            double high = round2(price + volatility * 0.3);
            double low = round2(Math.max(0.01, price - volatility * 0.3));
            double close = Math.max(PRICE_FLOOR, round2(price + uniform(random, -0.1, 0.1)));
            long volume = 100_000L + (long) (random.nextDouble() * 4_900_000L);

            LocalDateTime timestamp = anchor.minus(range.spacing().multipliedBy(points - i - 1L));
            bars.add(new PriceBar(timestamp, open, high, low, close, volume));
        }

        String note = "Mock Data (" + range.code() + ") - API Limit/Error"
            + (reason == null || reason.isBlank() ? "" : ": " + reason);
        return new TimeSeries(symbol, range, bars, Provenance.SIMULATED, note);
    }

    static int checksum(String symbol) {
        int sum = 0;
        for (char c : symbol.toCharArray()) {
            sum += c;
        }
        return sum;
    }

    static double basePrice(String symbol, int checksum) {
        double base = checksum % 500 + 50;
        for (Map.Entry<String, Double> known : KNOWN_BASES.entrySet()) {
            if (symbol.contains(known.getKey())) {
                base = known.getValue();
            }
        }
        return base;
    }

    // intraday bars end on the latest 5-minute boundary; daily bars end today at midnight
    private static LocalDateTime anchor(TimeRange range, LocalDateTime now) {
        if (range.isIntraday()) {
            LocalDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
            return minute.minusMinutes(minute.getMinute() % 5);
        }
        return now.toLocalDate().atStartOfDay();
    }

    private static double uniform(Random random, double from, double to) {
        return from + (to - from) * random.nextDouble();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
