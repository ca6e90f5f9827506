package com.vitalwatch.notification.sender;

import com.vitalwatch.common.model.CycleOutcome;
import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.notification.render.CycleMessageRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Alert sink for detection cycles. Every result is logged; results worth a human's attention
 * (a fired alert, an anomalous signal, an unreachable store) are also posted to a Slack-compatible
 * webhook when one is configured.
 */
@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private final WebClient webClient;

    @Value("${notification.slack.webhook-url:}")
    private String slackWebhookUrl;

    @Value("${notification.slack.enabled:false}")
    private boolean slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    public void send(CycleResult result) {
        logResult(result);

        if (!shouldPost(result)) {
            return;
        }
        if (!slackEnabled || slackWebhookUrl == null || slackWebhookUrl.isBlank()) {
            log.debug("Slack disabled or no webhook URL configured. traceId={}", result.traceId());
            return;
        }

        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", CycleMessageRenderer.render(result)))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r -> log.info("Slack notification sent. traceId={} deviceId={} status={}",
                              result.traceId(), result.deviceId(), r.getStatusCode()),
                e -> log.error("Slack notification failed. traceId={} deviceId={}",
                               result.traceId(), result.deviceId(), e)
            );
    }

    static boolean shouldPost(CycleResult result) {
        return result.alertFired()
            || result.outcome() == CycleOutcome.STORE_UNAVAILABLE
            || !CycleMessageRenderer.anomalyLines(result).isEmpty();
    }

    private void logResult(CycleResult result) {
        switch (result.outcome()) {
            case DEVICE_OFFLINE -> log.warn("Device offline, judgment skipped. deviceId={} traceId={}",
                                            result.deviceId(), result.traceId());
            case STORE_UNAVAILABLE -> log.error("Detection skipped, store unavailable. deviceId={} traceId={} reason={}",
                                                result.deviceId(), result.traceId(), result.failureReason());
            case EVALUATED -> {
                if (result.alertFired()) {
                    log.warn("ALERT: {} traceId={}", CycleMessageRenderer.alertHeadline(result), result.traceId());
                }
                List<String> anomalies = CycleMessageRenderer.anomalyLines(result);
                if (anomalies.isEmpty()) {
                    log.info("No anomalies. deviceId={} traceId={}", result.deviceId(), result.traceId());
                } else {
                    anomalies.forEach(a -> log.warn("ALERT: {} deviceId={} traceId={}",
                                                    a, result.deviceId(), result.traceId()));
                }
            }
        }
    }
}
