package com.kotsin.advisor.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.VenueKind;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Public Binance REST prices for crypto pairs. Forex pairs and failed history fetches are served by the
 * simulated feed.
 */
@Component
@Primary
@Slf4j
@ConditionalOnProperty(prefix = "signals.feed", name = "provider", havingValue = "binance", matchIfMissing = true)
public class BinancePriceFeed implements PriceFeed {

    private final OkHttpClient http;
    private final SimulatedPriceFeed simulated;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String baseUrl;

    public BinancePriceFeed(OkHttpClient advisorHttpClient, SimulatedPriceFeed simulated, SignalProps props) {
        this.http = advisorHttpClient;
        this.simulated = simulated;
        this.baseUrl = props.feed().binanceBaseUrl();
    }

    static String symbol(String pair) {
        return pair.replace("/", "").toUpperCase();
    }

    static boolean isCryptoPair(String pair) {
        String upper = pair.toUpperCase();
        return upper.endsWith("/USDT") || upper.endsWith("/BTC") || upper.endsWith("/BUSD");
    }

    @Override
    public OptionalDouble currentPrice(String pair) {
        if (!isCryptoPair(pair)) {
            return OptionalDouble.empty();
        }
        Request req = new Request.Builder().url(baseUrl + "/api/v3/ticker/price?symbol=" + symbol(pair)).build();
        try (Response r = http.newCall(req).execute()) {
            if (!r.isSuccessful() || r.body() == null) return OptionalDouble.empty();
            JsonNode node = objectMapper.readTree(r.body().string());
            if (node.has("price")) {
                double price = node.get("price").asDouble();
                return price > 0 ? OptionalDouble.of(price) : OptionalDouble.empty();
            }
            return OptionalDouble.empty();
        } catch (Exception e) {
            log.debug("Price fetch failed for {}: {}", pair, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    @Override
    public Optional<PriceSeries> history(String pair, VenueKind venue, MarketKind marketKind, int points) {
        if (venue != VenueKind.CRYPTO || !isCryptoPair(pair)) {
            return simulated.history(pair, venue, marketKind, points);
        }
        Request req = new Request.Builder()
                .url(baseUrl + "/api/v3/klines?symbol=" + symbol(pair) + "&interval=1h&limit=" + points)
                .build();
        try (Response r = http.newCall(req).execute()) {
            if (!r.isSuccessful() || r.body() == null) {
                log.warn("klines_unavailable pair={} http={}", pair, r.code());
                return simulated.history(pair, venue, marketKind, points);
            }
            JsonNode rows = objectMapper.readTree(r.body().string());
            if (!rows.isArray() || rows.size() == 0) {
                return simulated.history(pair, venue, marketKind, points);
            }
            int n = rows.size();
            double[] prices = new double[n];
            double[] volumes = new double[n];
            long[] timestamps = new long[n];
            for (int i = 0; i < n; i++) {
                JsonNode row = rows.get(i);
                timestamps[i] = row.get(0).asLong();
                prices[i] = row.get(4).asDouble();
                volumes[i] = row.get(5).asDouble();
            }
            return Optional.of(new PriceSeries(pair, venue, prices, volumes, timestamps));
        } catch (Exception e) {
            log.warn("klines_fetch_failed pair={} err={}; using simulated history", pair, e.getMessage());
            return simulated.history(pair, venue, marketKind, points);
        }
    }
}
