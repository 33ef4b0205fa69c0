package com.revenueplatform.notification.controller;

import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.notification.sender.ChatWebhookSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/notify")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final ChatWebhookSender chatSender;

    public NotificationController(ChatWebhookSender chatSender) {
        this.chatSender = chatSender;
    }

    @PostMapping("/revenue-report")
    public ResponseEntity<Void> revenueReport(@RequestBody RevenueReportEvent event) {
        if (event.result() == null) {
            log.warn("Revenue report without engine result ignored. traceId={} propertyId={}",
                     event.traceId(), event.propertyId());
            return ResponseEntity.badRequest().build();
        }
        chatSender.send(event);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
