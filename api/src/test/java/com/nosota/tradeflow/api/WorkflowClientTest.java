package com.nosota.tradeflow.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.api.request.TransitionRequest;
import com.nosota.tradeflow.api.response.SideEffectResponse;
import com.nosota.tradeflow.api.response.TransitionResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final AtomicReference<ClientRequest> captured = new AtomicReference<>();

    private ClientResponse nextResponse;
    private WorkflowClient client;

    @BeforeEach
    void setUp() {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                })
                .build();
        WebClient webClient = WebClient.builder()
                .baseUrl("http://tradeflow.local")
                .exchangeStrategies(strategies)
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(nextResponse);
                })
                .build();
        client = new WorkflowClient(webClient);
    }

    @Test
    void applyTransition_sendsActorHeadersAndDecodesResult() throws Exception {
        UUID orderId = UUID.randomUUID();
        TransitionResponse body = new TransitionResponse(EntityType.ORDER, orderId, "PROCESSING", "SHIPPED", 4L,
                false, null, List.of(new SideEffectResponse(SideEffectType.SYSTEM_MESSAGE_POSTED, UUID.randomUUID(),
                "Order shipped")));
        nextResponse = ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(objectMapper.writeValueAsString(body))
                .build();

        ResponseEntity<TransitionResponse> response = client.applyTransition(EntityType.ORDER, orderId, 7L,
                ActorRole.ADMIN, new TransitionRequest(WorkflowAction.SHIP, TransitionPayload.empty()));

        ClientRequest request = captured.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/api/v1/workflow/ORDER/" + orderId + "/transitions");
        assertThat(request.headers().getFirst(ActorHeaders.ACTOR_ID)).isEqualTo("7");
        assertThat(request.headers().getFirst(ActorHeaders.ACTOR_ROLE)).isEqualTo("ADMIN");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().status()).isEqualTo("SHIPPED");
        assertThat(response.getBody().sideEffects()).hasSize(1);
    }

    @Test
    void applyTransition_rejectedMoveSurfacesAsConflict() {
        nextResponse = ClientResponse.create(HttpStatus.CONFLICT)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"status\":409,\"error\":\"Invalid Transition\"}")
                .build();

        assertThatThrownBy(() -> client.applyTransition(EntityType.ORDER, UUID.randomUUID(), 3L, ActorRole.SELLER,
                new TransitionRequest(WorkflowAction.SHIP, null)))
                .isInstanceOf(WebClientResponseException.Conflict.class);
    }
}
