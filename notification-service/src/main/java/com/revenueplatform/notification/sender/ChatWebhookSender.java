package com.revenueplatform.notification.sender;

import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.model.ReviewType;
import com.revenueplatform.notification.report.RevenueReportAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Delivers assembled revenue reports to a Google Chat incoming webhook as {@code {"text": ...}}.
 * When chat is disabled or no webhook is configured the report is logged instead.
 */
@Component
public class ChatWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(ChatWebhookSender.class);

    private final WebClient webClient;
    private final RevenueReportAssembler assembler;
    private final String webhookUrl;
    private final boolean enabled;

    public ChatWebhookSender(WebClient.Builder builder,
                             RevenueReportAssembler assembler,
                             @Value("${notification.chat.webhook-url:}") String webhookUrl,
                             @Value("${notification.chat.enabled:false}") boolean enabled) {
        this.webClient  = builder.build();
        this.assembler  = assembler;
        this.webhookUrl = webhookUrl;
        this.enabled    = enabled;
    }

    public void send(RevenueReportEvent event) {
        String message = message(event);

        if (!enabled || webhookUrl == null || webhookUrl.isBlank()) {
            log.info("Chat disabled or no webhook URL configured. Logging report instead. traceId={} propertyId={}",
                     event.traceId(), event.propertyId());
            log.info("\n{}", message);
            return;
        }

        webClient.post()
            .uri(webhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Chat report sent. traceId={} propertyId={} status={}",
                                event.traceId(), event.propertyId(), r.getStatusCode()),
                err -> log.error("Chat report failed. traceId={} propertyId={}",
                                 event.traceId(), event.propertyId(), err)
            );
    }

    String message(RevenueReportEvent event) {
        ReviewType type = event.reviewType() != null ? event.reviewType() : ReviewType.ON_DEMAND;
        return String.format("%s *%s*%n%n%s", emoji(type), type.title(), assembler.assemble(event));
    }

    private static String emoji(ReviewType type) {
        return switch (type) {
            case WEEKLY    -> "🚀";
            case MONTHLY   -> "⚖️";
            case ON_DEMAND -> "📊";
        };
    }
}
