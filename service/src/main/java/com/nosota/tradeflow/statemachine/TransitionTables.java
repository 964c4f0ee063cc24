package com.nosota.tradeflow.statemachine;

import com.nosota.tradeflow.api.model.BookingStatus;
import com.nosota.tradeflow.api.model.BoostPurchaseStatus;
import com.nosota.tradeflow.api.model.ConversationStatus;
import com.nosota.tradeflow.api.model.DesignApprovalStatus;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.OrderStatus;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.model.ReturnRequestStatus;

import java.util.EnumSet;

import static com.nosota.tradeflow.api.model.ActorRole.ADMIN;
import static com.nosota.tradeflow.api.model.ActorRole.BUYER;
import static com.nosota.tradeflow.api.model.ActorRole.SELLER;
import static com.nosota.tradeflow.api.model.ActorRole.SYSTEM;
import static com.nosota.tradeflow.api.model.WorkflowAction.*;

/**
 * The transition tables of every workflow entity.
 *
 * <p>Order:
 * <pre>
 * pending_payment --mark_paid--> paid --start_processing--> processing --ship--> shipped --deliver--> delivered
 *        |                        |                            |                   |
 *        +------------------------+-------- cancel ------------+-------------------+--> cancelled
 * </pre>
 * {@code submit_payment} (buyer bank slip) and {@code mark_ready_to_ship} (seller) are self-loops
 * recorded on the entity. Shipping is an admin consolidation step, never a seller move.
 */
public final class TransitionTables {

    public static final TransitionTable<OrderStatus> ORDER = TransitionTable
            .builder(EntityType.ORDER, OrderStatus.class)
            .initial(OrderStatus.PENDING_PAYMENT)
            .allow(OrderStatus.PENDING_PAYMENT, SUBMIT_PAYMENT, OrderStatus.PENDING_PAYMENT, BUYER)
            .allow(OrderStatus.PENDING_PAYMENT, MARK_PAID, OrderStatus.PAID, ADMIN, SYSTEM)
            .allow(OrderStatus.PENDING_PAYMENT, CANCEL, OrderStatus.CANCELLED, BUYER, SELLER, ADMIN)
            .allow(OrderStatus.PAID, START_PROCESSING, OrderStatus.PROCESSING, SELLER, ADMIN)
            .allow(OrderStatus.PAID, CANCEL, OrderStatus.CANCELLED, SELLER, ADMIN)
            .allow(OrderStatus.PROCESSING, MARK_READY_TO_SHIP, OrderStatus.PROCESSING, SELLER)
            .allow(OrderStatus.PROCESSING, SHIP, OrderStatus.SHIPPED, ADMIN)
            .allow(OrderStatus.PROCESSING, CANCEL, OrderStatus.CANCELLED, SELLER, ADMIN)
            .allow(OrderStatus.SHIPPED, DELIVER, OrderStatus.DELIVERED, SELLER, ADMIN)
            .allow(OrderStatus.SHIPPED, CANCEL, OrderStatus.CANCELLED, ADMIN)
            .build();

    /**
     * Confirmed is transient: the engine follows a confirmation with the system move to
     * pending_payment in the same unit of work.
     */
    public static final TransitionTable<BookingStatus> BOOKING = TransitionTable
            .builder(EntityType.BOOKING, BookingStatus.class)
            .initial(BookingStatus.PENDING_CONFIRMATION)
            .allow(BookingStatus.PENDING_CONFIRMATION, CONFIRM, BookingStatus.CONFIRMED, SELLER)
            .allow(BookingStatus.PENDING_CONFIRMATION, CANCEL, BookingStatus.CANCELLED, BUYER, SELLER, ADMIN)
            .allow(BookingStatus.CONFIRMED, REQUEST_PAYMENT, BookingStatus.PENDING_PAYMENT, SYSTEM)
            .allow(BookingStatus.CONFIRMED, CANCEL, BookingStatus.CANCELLED, BUYER, SELLER, ADMIN)
            .allow(BookingStatus.PENDING_PAYMENT, SUBMIT_PAYMENT, BookingStatus.PENDING_PAYMENT, BUYER)
            .allow(BookingStatus.PENDING_PAYMENT, MARK_PAID, BookingStatus.PAID, ADMIN, SYSTEM)
            .allow(BookingStatus.PENDING_PAYMENT, CANCEL, BookingStatus.CANCELLED, BUYER, SELLER, ADMIN)
            .allow(BookingStatus.PAID, START, BookingStatus.ONGOING, SELLER)
            .allow(BookingStatus.PAID, CANCEL, BookingStatus.CANCELLED, SELLER, ADMIN, SYSTEM)
            .allow(BookingStatus.ONGOING, COMPLETE, BookingStatus.COMPLETED, SELLER, ADMIN)
            .allow(BookingStatus.ONGOING, CANCEL, BookingStatus.CANCELLED, ADMIN, SYSTEM)
            .build();

    private static final EnumSet<QuoteStatus> OPEN_QUOTE = EnumSet.of(QuoteStatus.PENDING, QuoteStatus.SENT);

    public static final TransitionTable<QuoteStatus> QUOTE = TransitionTable
            .builder(EntityType.QUOTE, QuoteStatus.class)
            .initial(QuoteStatus.REQUESTED, QuoteStatus.PENDING, QuoteStatus.SENT)
            .allow(QuoteStatus.REQUESTED, SEND, QuoteStatus.SENT, SELLER)
            .allow(QuoteStatus.REQUESTED, REJECT, QuoteStatus.REJECTED, SELLER)
            .allow(QuoteStatus.PENDING, SEND, QuoteStatus.SENT, SELLER)
            .allowFrom(OPEN_QUOTE, ACCEPT, QuoteStatus.ACCEPTED, BUYER)
            .allowFrom(OPEN_QUOTE, REJECT, QuoteStatus.REJECTED, BUYER)
            .allowFrom(OPEN_QUOTE, EXPIRE, QuoteStatus.EXPIRED, SYSTEM)
            .allowFrom(OPEN_QUOTE, SUPERSEDE, QuoteStatus.SUPERSEDED, SYSTEM)
            .build();

    private static final EnumSet<DesignApprovalStatus> AWAITING_SELLER =
            EnumSet.of(DesignApprovalStatus.PENDING, DesignApprovalStatus.RESUBMITTED);

    public static final TransitionTable<DesignApprovalStatus> DESIGN_APPROVAL = TransitionTable
            .builder(EntityType.DESIGN_APPROVAL, DesignApprovalStatus.class)
            .initial(DesignApprovalStatus.PENDING)
            .allowFrom(AWAITING_SELLER, APPROVE, DesignApprovalStatus.APPROVED, SELLER)
            .allowFrom(AWAITING_SELLER, REJECT, DesignApprovalStatus.REJECTED, SELLER)
            .allowFrom(AWAITING_SELLER, REQUEST_CHANGES, DesignApprovalStatus.CHANGES_REQUESTED, SELLER)
            .allow(DesignApprovalStatus.CHANGES_REQUESTED, RESUBMIT, DesignApprovalStatus.RESUBMITTED, BUYER)
            .allow(DesignApprovalStatus.CHANGES_REQUESTED, SUPERSEDE, DesignApprovalStatus.SUPERSEDED, SYSTEM)
            .build();

    private static final EnumSet<ReturnRequestStatus> AWAITING_SELLER_RESPONSE =
            EnumSet.of(ReturnRequestStatus.REQUESTED, ReturnRequestStatus.UNDER_REVIEW);

    private static final EnumSet<ReturnRequestStatus> AWAITING_ADMIN = EnumSet.of(
            ReturnRequestStatus.UNDER_REVIEW,
            ReturnRequestStatus.SELLER_APPROVED,
            ReturnRequestStatus.SELLER_REJECTED);

    public static final TransitionTable<ReturnRequestStatus> RETURN_REQUEST = TransitionTable
            .builder(EntityType.RETURN_REQUEST, ReturnRequestStatus.class)
            .initial(ReturnRequestStatus.REQUESTED)
            .allow(ReturnRequestStatus.REQUESTED, START_REVIEW, ReturnRequestStatus.UNDER_REVIEW, ADMIN)
            .allowFrom(AWAITING_SELLER_RESPONSE, SELLER_APPROVE, ReturnRequestStatus.SELLER_APPROVED, SELLER)
            .allowFrom(AWAITING_SELLER_RESPONSE, SELLER_REJECT, ReturnRequestStatus.SELLER_REJECTED, SELLER)
            .allowFrom(AWAITING_SELLER_RESPONSE, CANCEL, ReturnRequestStatus.CANCELLED, BUYER)
            .allowFrom(AWAITING_ADMIN, ADMIN_APPROVE, ReturnRequestStatus.ADMIN_APPROVED, ADMIN)
            .allowFrom(AWAITING_ADMIN, ADMIN_REJECT, ReturnRequestStatus.ADMIN_REJECTED, ADMIN)
            .allow(ReturnRequestStatus.ADMIN_APPROVED, REFUND, ReturnRequestStatus.REFUNDED, ADMIN, SYSTEM)
            .allow(ReturnRequestStatus.ADMIN_APPROVED, CLOSE, ReturnRequestStatus.COMPLETED, ADMIN)
            .build();

    private static final EnumSet<BoostPurchaseStatus> UNSETTLED_BOOST =
            EnumSet.of(BoostPurchaseStatus.PENDING, BoostPurchaseStatus.PROCESSING);

    public static final TransitionTable<BoostPurchaseStatus> BOOST_PURCHASE = TransitionTable
            .builder(EntityType.BOOST_PURCHASE, BoostPurchaseStatus.class)
            .initial(BoostPurchaseStatus.PENDING)
            .allow(BoostPurchaseStatus.PENDING, SUBMIT_PAYMENT, BoostPurchaseStatus.PROCESSING, SELLER)
            .allowFrom(UNSETTLED_BOOST, MARK_PAID, BoostPurchaseStatus.PAID, ADMIN, SYSTEM)
            .allowFrom(UNSETTLED_BOOST, FAIL, BoostPurchaseStatus.FAILED, ADMIN, SYSTEM)
            .allowFrom(UNSETTLED_BOOST, CANCEL, BoostPurchaseStatus.CANCELLED, SELLER, ADMIN)
            .build();

    /**
     * Buyers and sellers never move a conversation directly; they can only ask for resolution.
     */
    public static final TransitionTable<ConversationStatus> CONVERSATION = TransitionTable
            .builder(EntityType.CONVERSATION, ConversationStatus.class)
            .initial(ConversationStatus.ACTIVE)
            .allow(ConversationStatus.ACTIVE, RESOLVE, ConversationStatus.RESOLVED, ADMIN, SYSTEM)
            .allow(ConversationStatus.ACTIVE, ARCHIVE, ConversationStatus.ARCHIVED, ADMIN, SYSTEM)
            .allow(ConversationStatus.RESOLVED, ARCHIVE, ConversationStatus.ARCHIVED, ADMIN, SYSTEM)
            .build();

    private TransitionTables() {
    }
}
