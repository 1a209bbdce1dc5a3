package com.kotsin.advisor.notification;

import com.kotsin.advisor.model.SignalEvent;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TelegramSignalEventSink implements SignalEventSink {

    private final OkHttpClient http;
    private final String botToken;
    private final String chatId;

    public TelegramSignalEventSink(OkHttpClient advisorHttpClient,
                                   @Value("${signals.notify.telegram.token:}") String botToken,
                                   @Value("${signals.notify.telegram.chat-id:}") String chatId) {
        this.http = advisorHttpClient;
        this.botToken = botToken;
        this.chatId = chatId;
    }

    boolean isConfigured() {
        return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }

    @Override
    public void publish(SignalEvent event) {
        if (!isConfigured()) {
            log.debug("Telegram not configured; skipping message.");
            return;
        }
        FormBody body = new FormBody.Builder()
                .add("chat_id", chatId)
                .add("text", format(event))
                .build();
        Request req = new Request.Builder()
                .url("https://api.telegram.org/bot" + botToken + "/sendMessage")
                .post(body)
                .build();
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                log.warn("Telegram send failed: HTTP {}", resp.code());
            }
        } catch (Exception e) {
            log.warn("Telegram send error: {}", e.toString());
        }
    }

    static String format(SignalEvent event) {
        switch (event.getType()) {
            case BATCH_GENERATED:
                return String.format("NEW SIGNALS\n%d %s signals generated", event.getCount(), event.getCategory().key());
            case SIGNAL_STOPPED:
                return String.format("STOPPED\n%s %s\nP/L: %.2f%%", event.getPair(), event.getDirection(),
                        event.getProfitLossPercentage() == null ? 0.0 : event.getProfitLossPercentage());
            default:
                return String.format("TARGET HIT\n%s %s\nP/L: %.2f%%", event.getPair(), event.getDirection(),
                        event.getProfitLossPercentage() == null ? 0.0 : event.getProfitLossPercentage());
        }
    }
}
