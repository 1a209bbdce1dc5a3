package com.kotsin.advisor.feed;

import com.kotsin.advisor.model.DirectionPrediction;
import com.kotsin.advisor.model.PriceSeries;
import com.kotsin.advisor.model.VenueKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisDirectionPredictorTest {

    private static final PriceSeries SERIES = new PriceSeries("BTC/USDT", VenueKind.CRYPTO, new double[]{1}, null, null);

    @Mock
    private RedisTemplate<String, String> redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;

    @ParameterizedTest
    @CsvSource({"BUY, BULLISH", "up, BULLISH", "SELL, BEARISH", "bearish, BEARISH", "HOLD, NEUTRAL", "xyz, NEUTRAL"})
    void parseBias(String raw, DirectionPrediction.Bias expected) {
        assertEquals(expected, RedisDirectionPredictor.parseBias(raw));
    }

    @Test
    @DisplayName("Fresh predictions are read from Redis")
    void freshPrediction() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("ml:prediction:BTC/USDT")).thenReturn(
                "{\"prediction\":\"BUY\",\"confidence\":72,\"accuracy\":0.61,\"model\":\"lstm\",\"timestamp\":\""
                        + Instant.now().minusSeconds(30) + "\"}");

        Optional<DirectionPrediction> prediction = new RedisDirectionPredictor(redisTemplate, true).predict(SERIES);

        assertTrue(prediction.isPresent());
        assertEquals(DirectionPrediction.Bias.BULLISH, prediction.get().getDirection());
        assertEquals(72.0, prediction.get().getConfidence());
        assertEquals("lstm", prediction.get().getModel());
    }

    @Test
    @DisplayName("Predictions older than five minutes are ignored")
    void stalePrediction() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("ml:prediction:BTC/USDT")).thenReturn(
                "{\"prediction\":\"SELL\",\"timestamp\":\"" + Instant.now().minus(Duration.ofMinutes(10)) + "\"}");

        assertTrue(new RedisDirectionPredictor(redisTemplate, true).predict(SERIES).isEmpty());
    }

    @Test
    void disabledPredictorNeverReads() {
        assertTrue(new RedisDirectionPredictor(redisTemplate, false).predict(SERIES).isEmpty());
        verifyNoInteractions(redisTemplate);
    }
}
