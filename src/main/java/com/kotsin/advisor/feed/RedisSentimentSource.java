package com.kotsin.advisor.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.advisor.indicator.TechnicalIndicators;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Reads news sentiment published to Redis by the news analysis service.
 *
 * Redis key pattern: sentiment:{pair}  e.g. {"score": 42.0, "timestamp": "..."}
 *
 * Missing or unreadable entries count as neutral.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RedisSentimentSource implements SentimentSource {

    private final RedisTemplate<String, String> advisorStringRedisTemplate;
    private final Cache<String, Double> sentimentCache;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public double score(String pair) {
        Double cached = sentimentCache.getIfPresent(pair);
        if (cached != null) {
            return cached;
        }
        double score = 0.0;
        try {
            String json = advisorStringRedisTemplate.opsForValue().get("sentiment:" + pair);
            if (json != null && !json.isBlank()) {
                JsonNode node = objectMapper.readTree(json);
                score = TechnicalIndicators.clamp(node.path("score").asDouble(0.0), -100.0, 100.0);
            } else {
                log.debug("sentiment_miss pair={}", pair);
            }
        } catch (Exception e) {
            log.warn("sentiment_error pair={} err={}", pair, e.getMessage());
            return 0.0;
        }
        sentimentCache.put(pair, score);
        return score;
    }
}
