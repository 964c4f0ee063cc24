package com.nosota.tradeflow.statemachine;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.model.ReturnRequestStatus;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.error.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionTablesTest {

    @Test
    void everyStatusOfEveryEntityIsReachable() {
        assertThat(TransitionTables.ORDER.imageSet()).isEqualTo(EnumSet.allOf(OrderStatus.class));
        assertThat(TransitionTables.BOOKING.imageSet()).isEqualTo(EnumSet.allOf(BookingStatus.class));
        assertThat(TransitionTables.QUOTE.imageSet()).isEqualTo(EnumSet.allOf(QuoteStatus.class));
        assertThat(TransitionTables.DESIGN_APPROVAL.imageSet()).isEqualTo(EnumSet.allOf(DesignApprovalStatus.class));
        assertThat(TransitionTables.RETURN_REQUEST.imageSet()).isEqualTo(EnumSet.allOf(ReturnRequestStatus.class));
        assertThat(TransitionTables.BOOST_PURCHASE.imageSet()).isEqualTo(EnumSet.allOf(BoostPurchaseStatus.class));
        assertThat(TransitionTables.CONVERSATION.imageSet()).isEqualTo(EnumSet.allOf(ConversationStatus.class));
    }

    @Test
    void terminalStatesHaveNoOutgoingMoves() {
        assertThat(TransitionTables.ORDER.isTerminal(OrderStatus.DELIVERED)).isTrue();
        assertThat(TransitionTables.ORDER.isTerminal(OrderStatus.CANCELLED)).isTrue();
        assertThat(TransitionTables.BOOKING.isTerminal(BookingStatus.COMPLETED)).isTrue();
        assertThat(TransitionTables.QUOTE.isTerminal(QuoteStatus.ACCEPTED)).isTrue();
        assertThat(TransitionTables.QUOTE.isTerminal(QuoteStatus.SUPERSEDED)).isTrue();
        assertThat(TransitionTables.RETURN_REQUEST.isTerminal(ReturnRequestStatus.REFUNDED)).isTrue();
        assertThat(TransitionTables.RETURN_REQUEST.isTerminal(ReturnRequestStatus.ADMIN_REJECTED)).isTrue();
        assertThat(TransitionTables.CONVERSATION.isTerminal(ConversationStatus.ARCHIVED)).isTrue();

        assertThat(TransitionTables.RETURN_REQUEST.isTerminal(ReturnRequestStatus.SELLER_REJECTED)).isFalse();
    }

    @Test
    void onlyAnAdminShipsAnOrder() {
        assertThat(TransitionTables.ORDER.isAllowed(OrderStatus.PROCESSING, WorkflowAction.SHIP, ActorRole.ADMIN))
                .isTrue();
        assertThat(TransitionTables.ORDER.isAllowed(OrderStatus.PROCESSING, WorkflowAction.SHIP, ActorRole.SELLER))
                .isFalse();
        assertThat(TransitionTables.ORDER.allowedActions(OrderStatus.PROCESSING, ActorRole.SELLER))
                .containsExactlyInAnyOrder(WorkflowAction.MARK_READY_TO_SHIP, WorkflowAction.CANCEL);
    }

    @Test
    void buyerCannotCancelAfterPayment() {
        assertThat(TransitionTables.ORDER.isAllowed(OrderStatus.PENDING_PAYMENT, WorkflowAction.CANCEL, ActorRole.BUYER))
                .isTrue();
        assertThat(TransitionTables.ORDER.isAllowed(OrderStatus.PAID, WorkflowAction.CANCEL, ActorRole.BUYER))
                .isFalse();
    }

    @Test
    void confirmedBookingOnlyLeavesThroughSystemOrCancel() {
        assertThat(TransitionTables.BOOKING.allowedActions(BookingStatus.CONFIRMED, ActorRole.SYSTEM))
                .containsExactly(WorkflowAction.REQUEST_PAYMENT);
        assertThat(TransitionTables.BOOKING.allowedActions(BookingStatus.CONFIRMED, ActorRole.SELLER))
                .containsExactly(WorkflowAction.CANCEL);
    }

    @Test
    void unsettledBookingCanBeCancelledBySystemRefund() {
        assertThat(TransitionTables.BOOKING.allowedActions(BookingStatus.PAID, ActorRole.SYSTEM))
                .containsExactly(WorkflowAction.CANCEL);
        assertThat(TransitionTables.BOOKING.allowedActions(BookingStatus.ONGOING, ActorRole.SYSTEM))
                .containsExactly(WorkflowAction.CANCEL);
        assertThat(TransitionTables.BOOKING.isAllowed(BookingStatus.PAID, WorkflowAction.CANCEL, ActorRole.BUYER))
                .isFalse();
    }

    @Test
    void expiryAndSupersedeAreSystemOnly() {
        for (ActorRole role : List.of(ActorRole.BUYER, ActorRole.SELLER, ActorRole.ADMIN)) {
            assertThat(TransitionTables.QUOTE.isAllowed(QuoteStatus.SENT, WorkflowAction.EXPIRE, role)).isFalse();
            assertThat(TransitionTables.QUOTE.isAllowed(QuoteStatus.SENT, WorkflowAction.SUPERSEDE, role)).isFalse();
        }
        assertThat(TransitionTables.QUOTE.isAllowed(QuoteStatus.SENT, WorkflowAction.EXPIRE, ActorRole.SYSTEM)).isTrue();
        assertThat(TransitionTables.QUOTE.isAllowed(QuoteStatus.REQUESTED, WorkflowAction.EXPIRE, ActorRole.SYSTEM))
                .isFalse();
    }

    @Test
    void resolveRejectsIllegalMoveWithStructuredDetails() {
        UUID id = UUID.randomUUID();

        assertThatThrownBy(() -> TransitionTables.ORDER.resolve(id, OrderStatus.DELIVERED,
                WorkflowAction.CANCEL, ActorRole.ADMIN))
                .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                    assertThat(e.getEntityType()).isEqualTo(EntityType.ORDER);
                    assertThat(e.getEntityId()).isEqualTo(id);
                    assertThat(e.getCurrentState()).isEqualTo("DELIVERED");
                    assertThat(e.getRequestedState()).isEqualTo("CANCELLED");
                    assertThat(e.getDetails()).containsEntry("action", "CANCEL");
                });
    }

    @Test
    void duplicateEdgeIsRejectedAtBuildTime() {
        TransitionTable.Builder<OrderStatus> builder = TransitionTable.builder(EntityType.ORDER, OrderStatus.class)
                .initial(OrderStatus.PENDING_PAYMENT)
                .allow(OrderStatus.PENDING_PAYMENT, WorkflowAction.MARK_PAID, OrderStatus.PAID, ActorRole.ADMIN);

        assertThatThrownBy(() -> builder.allow(OrderStatus.PENDING_PAYMENT, WorkflowAction.MARK_PAID,
                OrderStatus.CANCELLED, ActorRole.SYSTEM))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tableWithoutInitialStateDoesNotBuild() {
        assertThatThrownBy(() -> TransitionTable.builder(EntityType.QUOTE, QuoteStatus.class).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
