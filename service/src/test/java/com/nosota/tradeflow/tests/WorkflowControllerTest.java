package com.nosota.tradeflow.tests;

import com.nosota.tradeflow.TestBase;
import com.nosota.tradeflow.api.ActorHeaders;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.api.request.TransitionRequest;
import com.nosota.tradeflow.model.Order;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface of the workflow endpoint: status codes and error bodies.
 */
public class WorkflowControllerTest extends TestBase {

    private Long buyerId;
    private Long sellerId;
    private Order order;

    @BeforeEach
    public void placeAnOrder() {
        buyerId = newUserId();
        sellerId = newUserId();
        order = placeOrder(buyerId, sellerId);
    }

    @Test
    public void adminMarksPaid() throws Exception {
        mockMvc.perform(post(transitionsOf(order.getId()))
                        .header(ActorHeaders.ACTOR_ID, ADMIN_ID)
                        .header(ActorHeaders.ACTOR_ROLE, "ADMIN")
                        .header(ActorHeaders.CORRELATION_ID, "corr-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(WorkflowAction.MARK_PAID, TransitionPayload.withPaymentReference("BANK-77"))))
                .andExpect(status().isOk())
                .andExpect(header().string(ActorHeaders.CORRELATION_ID, "corr-42"))
                .andExpect(jsonPath("$.previousStatus").value("PENDING_PAYMENT"))
                .andExpect(jsonPath("$.status").value("PAID"))
                .andExpect(jsonPath("$.noOp").value(false))
                .andExpect(jsonPath("$.entity.paymentReference").value("BANK-77"))
                .andExpect(jsonPath("$.sideEffects[*].type").value(hasItem("SYSTEM_MESSAGE_POSTED")));
    }

    @Test
    public void illegalMove_isConflictWithDetails() throws Exception {
        mockMvc.perform(post(transitionsOf(order.getId()))
                        .header(ActorHeaders.ACTOR_ID, sellerId)
                        .header(ActorHeaders.ACTOR_ROLE, "SELLER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(WorkflowAction.SHIP, null)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid Transition"))
                .andExpect(jsonPath("$.details.currentState").value("PENDING_PAYMENT"))
                .andExpect(jsonPath("$.details.action").value("SHIP"))
                .andExpect(jsonPath("$.details.actorRole").value("SELLER"));
    }

    @Test
    public void strangerIsForbidden() throws Exception {
        mockMvc.perform(post(transitionsOf(order.getId()))
                        .header(ActorHeaders.ACTOR_ID, newUserId())
                        .header(ActorHeaders.ACTOR_ROLE, "BUYER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(WorkflowAction.CANCEL, null)))
                .andExpect(status().isForbidden());
    }

    @Test
    public void systemRoleCannotBeClaimed() throws Exception {
        mockMvc.perform(post(transitionsOf(order.getId()))
                        .header(ActorHeaders.ACTOR_ID, ADMIN_ID)
                        .header(ActorHeaders.ACTOR_ROLE, "SYSTEM")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(WorkflowAction.MARK_PAID, null)))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void unknownEntityIsNotFound() throws Exception {
        mockMvc.perform(post(transitionsOf(UUID.randomUUID()))
                        .header(ActorHeaders.ACTOR_ID, ADMIN_ID)
                        .header(ActorHeaders.ACTOR_ROLE, "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(WorkflowAction.MARK_PAID, null)))
                .andExpect(status().isNotFound());
    }

    @Test
    public void missingActionFailsValidation() throws Exception {
        mockMvc.perform(post(transitionsOf(order.getId()))
                        .header(ActorHeaders.ACTOR_ID, buyerId)
                        .header(ActorHeaders.ACTOR_ROLE, "BUYER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    public void missingActorHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post(transitionsOf(order.getId()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(WorkflowAction.CANCEL, null)))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void orderIsReadableByItsBuyer() throws Exception {
        mockMvc.perform(get("/api/v1/fulfillment/orders/" + order.getId())
                        .header(ActorHeaders.ACTOR_ID, buyerId)
                        .header(ActorHeaders.ACTOR_ROLE, "BUYER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_PAYMENT"))
                .andExpect(jsonPath("$.conversationId").value(order.getConversationId().toString()));
    }

    private static String transitionsOf(UUID orderId) {
        return "/api/v1/workflow/ORDER/" + orderId + "/transitions";
    }

    private String body(WorkflowAction action, TransitionPayload payload) throws Exception {
        return objectMapper.writeValueAsString(new TransitionRequest(action, payload));
    }
}
