package com.revenueplatform.marketdata.config;

import com.revenueplatform.marketdata.client.HospitableWebClient;
import com.revenueplatform.marketdata.client.KeyDataWebClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    // ── Key Data (comparable market KPIs) ─────────────────────────────────────
    @Value("${key-data.base-url:https://api.keydatadashboard.com}")
    private String keyDataBaseUrl;

    @Value("${key-data.api-key:}")
    private String keyDataApiKey;

    // ── Hospitable (property calendar, reservations) ──────────────────────────
    @Value("${hospitable.base-url:https://public.api.hospitable.com/v2}")
    private String hospitableBaseUrl;

    @Value("${hospitable.api-key:}")
    private String hospitableApiKey;

    @Bean
    public WebClient keyDataWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(keyDataBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .filter(serverErrorFilter("Key Data"))
            .filter(loggingFilter("KeyData"))
            .build();
    }

    @Bean
    public WebClient hospitableWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(hospitableBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .filter(serverErrorFilter("Hospitable"))
            .filter(loggingFilter("Hospitable"))
            .build();
    }

    @Bean
    public KeyDataWebClient keyDataClient(WebClient keyDataWebClient, Clock clock) {
        return new KeyDataWebClient(keyDataWebClient, keyDataApiKey, clock);
    }

    @Bean
    public HospitableWebClient hospitableClient(WebClient hospitableWebClient, Clock clock) {
        return new HospitableWebClient(hospitableWebClient, hospitableApiKey, clock);
    }

    private static HttpClient httpClient() {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS))
            );
    }

    private static ExchangeFilterFunction serverErrorFilter(String upstream) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(
                    upstream + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    /** Headers are not logged; query-string keys are masked. */
    private static ExchangeFilterFunction loggingFilter(String upstream) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("(?i)(api_?key=)[^&]+", "$1***");
            log.debug("Outbound request. upstream={} {} {}", upstream, clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
