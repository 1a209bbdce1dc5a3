package com.kotsin.advisor.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.PriceSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads direction predictions from Redis (written by the model-serving service).
 *
 * Redis key pattern: ml:prediction:{pair}
 */
@Service
@Slf4j
public class RedisDirectionPredictor implements DirectionPredictor {

    private static final Duration MAX_PREDICTION_AGE = Duration.ofMinutes(5);

    private final RedisTemplate<String, String> advisorStringRedisTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final boolean enabled;

    public RedisDirectionPredictor(RedisTemplate<String, String> advisorStringRedisTemplate,
                                   @Value("${signals.predictor.enabled:true}") boolean enabled) {
        this.advisorStringRedisTemplate = advisorStringRedisTemplate;
        this.enabled = enabled;
    }

    @Override
    public Optional<DirectionPrediction> predict(PriceSeries series) {
        if (!enabled) {
            return Optional.empty();
        }
        String pair = series.pair();
        try {
            String json = advisorStringRedisTemplate.opsForValue().get("ml:prediction:" + pair);
            if (json == null || json.isBlank()) {
                log.debug("ml_prediction_miss pair={}", pair);
                return Optional.empty();
            }

            JsonNode node = objectMapper.readTree(json);

            String timestamp = node.path("timestamp").asText("");
            if (!timestamp.isEmpty() && isStale(timestamp)) {
                log.debug("ml_prediction_stale pair={} age>{}m", pair, MAX_PREDICTION_AGE.toMinutes());
                return Optional.empty();
            }

            DirectionPrediction prediction = DirectionPrediction.builder()
                    .direction(parseBias(node.path("prediction").asText("HOLD")))
                    .confidence(node.path("confidence").asDouble(50.0))
                    .accuracy(node.path("accuracy").asDouble(0.0))
                    .model(node.path("model").asText("unknown"))
                    .build();

            log.debug("ml_prediction_hit pair={} pred={} conf={}", pair, prediction.getDirection(), prediction.getConfidence());
            return Optional.of(prediction);
        } catch (Exception e) {
            log.warn("ml_prediction_error pair={} err={}", pair, e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isStale(String timestamp) {
        try {
            Instant predTime = Instant.parse(timestamp);
            return Duration.between(predTime, Instant.now()).compareTo(MAX_PREDICTION_AGE) > 0;
        } catch (Exception e) {
            log.debug("ml_prediction_timestamp_unparsed value={}", timestamp);
            return false;
        }
    }

    static DirectionPrediction.Bias parseBias(String raw) {
        switch (raw.toUpperCase()) {
            case "BUY":
            case "UP":
            case "BULLISH":
                return DirectionPrediction.Bias.BULLISH;
            case "SELL":
            case "DOWN":
            case "BEARISH":
                return DirectionPrediction.Bias.BEARISH;
            default:
                return DirectionPrediction.Bias.NEUTRAL;
        }
    }
}
