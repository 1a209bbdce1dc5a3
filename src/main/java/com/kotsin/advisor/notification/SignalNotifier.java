package com.kotsin.advisor.notification;

import com.kotsin.advisor.model.SignalEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget fan-out of lifecycle events to every configured sink.
 * Callers never wait on delivery and never see a sink failure.
 */
@Service
@Slf4j
public class SignalNotifier {

    private final List<SignalEventSink> sinks;
    private final ExecutorService executor;

    public SignalNotifier(List<SignalEventSink> sinks, @Qualifier("notificationExecutor") ExecutorService executor) {
        this.sinks = sinks;
        this.executor = executor;
    }

    public void notify(SignalEvent event) {
        if (sinks.isEmpty()) {
            log.debug("signal_event_dropped type={} reason=no_sinks", event.getType());
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("signal_event_dropped type={} reason=executor_rejected", event.getType());
        }
    }

    private void deliver(SignalEvent event) {
        for (SignalEventSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (Exception e) {
                log.warn("signal_event_sink_failed sink={} type={} err={}",
                        sink.getClass().getSimpleName(), event.getType(), e.toString());
            }
        }
    }
}
