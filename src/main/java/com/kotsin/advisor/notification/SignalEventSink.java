package com.kotsin.advisor.notification;

import com.kotsin.advisor.model.SignalEvent;

public interface SignalEventSink {

    void publish(SignalEvent event);
}
