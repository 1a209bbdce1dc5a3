package com.kotsin.advisor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.advisor.lifecycle.ProfitLossCalculator;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.SignalStatus;
import com.kotsin.advisor.model.VenueKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes stored signal JSON.
 *
 * Each array element is parsed on its own so a single corrupt record is skipped instead of losing the
 * whole partition. Older records are migrated in place: missing hit flags read as false, missing extrema
 * fall back to the entry price, and a missing TP ladder is derived from the primary target.
 */
@Component
@Slf4j
public class SignalRecordNormalizer {

    static final double TP1_SHARE = 0.25;
    static final double TP2_SHARE = 0.65;
    static final double TP3_SHARE = 0.85;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public List<Signal> readArray(String json, SignalCategory partition) {
        List<Signal> out = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return out;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("signal_partition_unreadable category={} err={}", partition, e.getOriginalMessage());
            return out;
        }
        if (!root.isArray()) {
            log.warn("signal_partition_not_array category={}", partition);
            return out;
        }
        for (JsonNode node : root) {
            readNode(node, partition).ifPresent(out::add);
        }
        return dedupe(out);
    }

    public Optional<Signal> readOne(String json, SignalCategory partition) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return readNode(objectMapper.readTree(json), partition);
        } catch (JsonProcessingException e) {
            log.warn("signal_record_unreadable category={} err={}", partition, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public String writeArray(Collection<Signal> signals) {
        try {
            return objectMapper.writeValueAsString(signals);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize signals", e);
        }
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Keeps the first occurrence of every id, preserving order.
     */
    public List<Signal> dedupe(List<Signal> signals) {
        Map<String, Signal> byId = new LinkedHashMap<>();
        for (Signal s : signals) {
            byId.putIfAbsent(s.getId(), s);
        }
        return new ArrayList<>(byId.values());
    }

    public Signal normalize(Signal s, SignalCategory partition) {
        if (s.getStatus() == null) {
            s.setStatus(SignalStatus.ACTIVE);
        }
        if (s.getCategory() == null) {
            s.setCategory(partition);
        }
        if (s.getCurrentPrice() <= 0) {
            s.setCurrentPrice(s.getEntryPrice());
        }
        if (s.getHighestPrice() <= 0) {
            s.setHighestPrice(Math.max(s.getEntryPrice(), s.getCurrentPrice()));
        }
        if (s.getLowestPrice() <= 0) {
            s.setLowestPrice(Math.min(s.getEntryPrice(), s.getCurrentPrice()));
        }
        if (s.getTakeProfit() > 0 && s.getTakeProfit1() == null && s.getTakeProfit2() == null && s.getTakeProfit3() == null) {
            double distance = s.getTakeProfit() - s.getEntryPrice();
            s.setTakeProfit1(s.getEntryPrice() + distance * TP1_SHARE);
            s.setTakeProfit2(s.getEntryPrice() + distance * TP2_SHARE);
            s.setTakeProfit3(s.getEntryPrice() + distance * TP3_SHARE);
        }
        if (s.getRationale() == null) s.setRationale(new ArrayList<>());
        if (s.getMarketAnalysis() == null) s.setMarketAnalysis(new ArrayList<>());
        if (s.getDetectedPatterns() == null) s.setDetectedPatterns(new ArrayList<>());
        if (s.getProfitLossPercentage() == 0 && s.getStatus() == SignalStatus.ACTIVE) {
            s.setProfitLossPercentage(ProfitLossCalculator.livePercent(s));
        }
        return s;
    }

    private Optional<Signal> readNode(JsonNode node, SignalCategory partition) {
        if (node == null || !node.isObject()) {
            log.warn("signal_record_skipped category={} reason=not_an_object", partition);
            return Optional.empty();
        }
        try {
            ObjectNode obj = migrateLegacyFields((ObjectNode) node.deepCopy(), partition);
            Signal s = objectMapper.treeToValue(obj, Signal.class);
            if (s.getId() == null || s.getId().isBlank() || s.getDirection() == null || s.getEntryPrice() <= 0) {
                log.warn("signal_record_skipped category={} id={} reason=missing_required_fields", partition, s.getId());
                return Optional.empty();
            }
            return Optional.of(normalize(s, partition));
        } catch (Exception e) {
            log.warn("signal_record_skipped category={} reason={}", partition, e.getMessage());
            return Optional.empty();
        }
    }

    private static final List<String> INSTANT_FIELDS = List.of(
            "createdAt", "expiresAt", "validUntil", "completedAt", "tp1HitTime", "tp2HitTime", "tp3HitTime");

    private ObjectNode migrateLegacyFields(ObjectNode obj, SignalCategory partition) {
        JsonNode category = obj.get("category");
        if (category != null && category.isTextual()) {
            obj.put("category", legacyCategory(category.asText(), partition).name());
        }
        JsonNode marketType = obj.get("marketType");
        if (!obj.has("venue") && marketType != null && marketType.isTextual()) {
            obj.put("venue", "FOREX".equalsIgnoreCase(marketType.asText()) ? VenueKind.FOREX.name() : VenueKind.CRYPTO.name());
        }
        if (!obj.has("createdAt") && obj.has("timestamp")) {
            obj.set("createdAt", obj.get("timestamp"));
        }
        // older writers stored instants as epoch millis; the mapper would read a bare number as seconds
        for (String field : INSTANT_FIELDS) {
            JsonNode value = obj.get(field);
            if (value != null && value.isNumber()) {
                obj.put(field, Instant.ofEpochMilli(value.asLong()).toString());
            }
        }
        if (obj.has("status") && obj.get("status").isTextual()) {
            String status = obj.get("status").asText().toUpperCase();
            try {
                SignalStatus.valueOf(status);
                obj.put("status", status);
            } catch (IllegalArgumentException e) {
                obj.remove("status");
            }
        }
        return obj;
    }

    private SignalCategory legacyCategory(String value, SignalCategory partition) {
        switch (value.toLowerCase()) {
            case "scalping":
                return SignalCategory.FAST;
            case "onchain":
                return SignalCategory.FLOW;
            default:
                try {
                    return SignalCategory.fromKey(value);
                } catch (IllegalArgumentException e) {
                    return partition;
                }
        }
    }
}
