package com.kotsin.advisor.notification;

import com.kotsin.advisor.model.SignalEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@ConditionalOnProperty(prefix = "signals.notify.kafka", name = "enabled", havingValue = "true")
public class KafkaSignalEventSink implements SignalEventSink {

    private final KafkaTemplate<String, Object> signalEventKafkaTemplate;
    private final String topic;

    public KafkaSignalEventSink(KafkaTemplate<String, Object> signalEventKafkaTemplate,
                                @Value("${signals.notify.kafka.topic:signal-events}") String topic) {
        this.signalEventKafkaTemplate = signalEventKafkaTemplate;
        this.topic = topic;
    }

    @Override
    public void publish(SignalEvent event) {
        try {
            String key = event.getSignalId() != null ? event.getSignalId() : event.getCategory().key();
            signalEventKafkaTemplate.send(topic, key, event);
            log.info("signal_event_published topic={} key={} type={} pair={} pnl={}",
                    topic, key, event.getType(), event.getPair(), event.getProfitLossPercentage());
        } catch (Exception e) {
            log.error("Failed to publish SignalEvent: {}", e.toString(), e);
        }
    }
}
