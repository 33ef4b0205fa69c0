package com.revenueplatform.orchestrator.support;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Path → JSON WebClient stub. Unknown paths answer 404, {@code null} bodies 500. */
public final class CannedExchange {

    public final List<ClientRequest> requests = new ArrayList<>();
    private final Map<String, String> bodies;

    public CannedExchange(Map<String, String> bodies) {
        this.bodies = bodies;
    }

    public WebClient webClient() {
        return WebClient.builder()
            .exchangeFunction(request -> {
                synchronized (requests) {
                    requests.add(request);
                }
                String path = request.url().getPath();
                if (!bodies.containsKey(path)) {
                    return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
                }
                String body = bodies.get(path);
                if (body == null) {
                    return Mono.just(ClientResponse.create(HttpStatus.INTERNAL_SERVER_ERROR).build());
                }
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
    }
}
