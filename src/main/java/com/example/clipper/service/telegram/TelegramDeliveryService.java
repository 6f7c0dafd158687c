package com.example.clipper.service.telegram;

import com.example.clipper.config.TelegramProperties;
import com.example.clipper.service.Interfaces.ArtifactDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.HtmlUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Delivers rendered clips and failure notices to a Telegram chat through the Bot API. Nothing here
 * throws: a delivery that fails is logged and dropped.
 */
@Service
public class TelegramDeliveryService implements ArtifactDelivery {
    private static final Logger LOGGER = LoggerFactory.getLogger(TelegramDeliveryService.class);

    private final WebClient client;
    private final TelegramProperties props;
    private final Duration timeout;

    public TelegramDeliveryService(@Qualifier("telegramWebClient") WebClient client, TelegramProperties props) {
        this.client = client;
        this.props = props;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    @Override
    public void sendArtifact(String reference, String correlationLabel) {
        String caption = "🎬 Your viral short is ready! #shorts\n<code>" + escape(correlationLabel) + "</code>";
        if (reference == null || reference.isBlank()) {
            sendMessage(caption, correlationLabel);
            return;
        }
        if (isVideo(reference)) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("chat_id", props.getChatId());
            body.put("video", reference);
            body.put("caption", caption);
            body.put("parse_mode", "HTML");
            send("sendVideo", body, correlationLabel);
            return;
        }
        // archives and run pages cannot be streamed as video, send the link instead
        sendMessage(caption + "\n" + escape(reference), correlationLabel);
    }

    @Override
    public void sendFailureNotice(String correlationLabel, String reason) {
        sendMessage("❌ Job <code>" + escape(correlationLabel) + "</code> failed: "
                + escape(reason == null ? "unknown error" : reason), correlationLabel);
    }

    public void sendMessage(String html, String correlationLabel) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", props.getChatId());
        body.put("text", html);
        body.put("parse_mode", "HTML");
        send("sendMessage", body, correlationLabel);
    }

    private void send(String method, Map<String, Object> body, String correlationLabel) {
        if (!props.isConfigured()) {
            LOGGER.info("Telegram not configured, skipping {} token={}", method, correlationLabel);
            return;
        }
        try {
            client.post()
                    .uri("/bot{token}/{method}", props.getToken(), method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(errorBody -> new IllegalStateException("Telegram error %s: %s".formatted(resp.statusCode(), errorBody))))
                    .toBodilessEntity()
                    .block(timeout);
            LOGGER.info("Telegram {} sent token={}", method, correlationLabel);
        } catch (RuntimeException ex) {
            LOGGER.warn("Telegram {} failed token={} error={}", method, correlationLabel, ex.getMessage());
        }
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }

    private boolean isVideo(String reference) {
        String lower = reference.toLowerCase(Locale.ROOT);
        return lower.endsWith(".mp4") || lower.endsWith(".mov") || lower.endsWith(".webm");
    }
}
