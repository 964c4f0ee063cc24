package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.request.TransitionRequest;
import com.nosota.tradeflow.api.response.TransitionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

/**
 * WebClient-based implementation of WorkflowApi.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Bean
 * public WorkflowClient workflowClient(WebClient.Builder builder,
 *                                      @Value("${services.tradeflow.url}") String baseUrl) {
 *     return new WorkflowClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 *
 * <p>Error statuses surface as {@code WebClientResponseException}; the response body is the
 * service's ErrorResponse with the structured details of the rejected transition.
 */
@RequiredArgsConstructor
@Slf4j
public class WorkflowClient implements WorkflowApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<TransitionResponse> applyTransition(EntityType entityType, UUID entityId,
                                                              Long actorId, ActorRole actorRole,
                                                              TransitionRequest request) {
        log.debug("Calling applyTransition: entityType={}, entityId={}, action={}, actorId={}, actorRole={}",
                entityType, entityId, request.action(), actorId, actorRole);

        return webClient.post()
                .uri("/api/v1/workflow/{entityType}/{entityId}/transitions", entityType, entityId)
                .header(ActorHeaders.ACTOR_ID, String.valueOf(actorId))
                .header(ActorHeaders.ACTOR_ROLE, actorRole.name())
                .bodyValue(request)
                .retrieve()
                .toEntity(TransitionResponse.class)
                .block();
    }
}
