package com.vitalwatch.notification.sender;

import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.common.model.DeviationVerdict;
import com.vitalwatch.common.model.DeviceHysteresisState;
import com.vitalwatch.common.model.VitalSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SlackWebhookSenderTest {

    private static final Instant AT = Instant.parse("2024-05-01T00:00:00Z");
    private static final DeviceHysteresisState ZERO = DeviceHysteresisState.initial(3);

    private final List<ClientRequest> posted = new CopyOnWriteArrayList<>();

    private SlackWebhookSender sender(boolean enabled) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            posted.add(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).build());
        });
        SlackWebhookSender sender = new SlackWebhookSender(builder);
        ReflectionTestUtils.setField(sender, "slackEnabled", enabled);
        ReflectionTestUtils.setField(sender, "slackWebhookUrl", "http://hooks.test/T000/B000");
        return sender;
    }

    private static CycleResult evaluated(boolean anomalous, boolean fired) {
        return CycleResult.evaluated("dev", "t", AT,
            DeviationVerdict.compared(VitalSignal.HEART_RATE, anomalous, 98, 70, 28, 0.4),
            DeviationVerdict.noRecentData(VitalSignal.RESPIRATION),
            ZERO, fired);
    }

    @Test
    @DisplayName("only alerts, anomalies and store failures are worth posting")
    void shouldPost() {
        assertTrue(SlackWebhookSender.shouldPost(evaluated(true, false)));
        assertTrue(SlackWebhookSender.shouldPost(evaluated(false, true)));
        assertTrue(SlackWebhookSender.shouldPost(CycleResult.storeUnavailable("dev", "t", AT, ZERO, "down")));
        assertFalse(SlackWebhookSender.shouldPost(evaluated(false, false)));
        assertFalse(SlackWebhookSender.shouldPost(CycleResult.offline("dev", "t", AT, ZERO)));
    }

    @Test
    @DisplayName("an anomaly is posted to the webhook when Slack is enabled")
    void postsWhenEnabled() {
        sender(true).send(evaluated(true, false));

        assertEquals(1, posted.size());
        assertEquals("http://hooks.test/T000/B000", posted.get(0).url().toString());
    }

    @Test
    @DisplayName("nothing is posted when Slack is disabled or the cycle was uneventful")
    void silentOtherwise() {
        sender(false).send(evaluated(true, true));
        sender(true).send(evaluated(false, false));

        assertTrue(posted.isEmpty());
    }
}
