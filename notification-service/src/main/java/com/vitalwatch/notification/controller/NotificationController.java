package com.vitalwatch.notification.controller;

import com.vitalwatch.common.model.CycleResult;
import com.vitalwatch.notification.sender.SlackWebhookSender;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private final SlackWebhookSender slackSender;

    public NotificationController(SlackWebhookSender slackSender) {
        this.slackSender = slackSender;
    }

    @PostMapping("/cycle")
    public ResponseEntity<Void> notifyCycle(@RequestBody CycleResult result) {
        slackSender.send(result);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
