package com.nosota.tradeflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.PaymentMethod;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.api.request.CreateOrderRequest;
import com.nosota.tradeflow.api.request.TransitionPayload;
import com.nosota.tradeflow.model.Notification;
import com.nosota.tradeflow.model.Order;
import com.nosota.tradeflow.repository.NotificationRepository;
import com.nosota.tradeflow.service.BookingService;
import com.nosota.tradeflow.service.BoostService;
import com.nosota.tradeflow.service.CommissionLedgerService;
import com.nosota.tradeflow.service.ConversationService;
import com.nosota.tradeflow.service.DesignApprovalService;
import com.nosota.tradeflow.service.NotificationService;
import com.nosota.tradeflow.service.OrderService;
import com.nosota.tradeflow.service.PaymentCallbackService;
import com.nosota.tradeflow.service.QuoteService;
import com.nosota.tradeflow.service.ReturnService;
import com.nosota.tradeflow.tests.TestAsyncConfig;
import com.nosota.tradeflow.workflow.WorkflowEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

@SpringBootTest(
        classes = TradeflowApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "spring.main.allow-bean-definition-overriding=true"
)
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@Import(TestAsyncConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final Long ADMIN_ID = 1L;

    @Autowired
    protected WorkflowEngine workflowEngine;

    @Autowired
    protected ConversationService conversationService;

    @Autowired
    protected QuoteService quoteService;

    @Autowired
    protected DesignApprovalService designApprovalService;

    @Autowired
    protected OrderService orderService;

    @Autowired
    protected BookingService bookingService;

    @Autowired
    protected ReturnService returnService;

    @Autowired
    protected BoostService boostService;

    @Autowired
    protected PaymentCallbackService paymentCallbackService;

    @Autowired
    protected CommissionLedgerService commissionLedgerService;

    @Autowired
    protected NotificationService notificationService;

    @Autowired
    protected NotificationRepository notificationRepository;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    // Tests share one database, so every test works with fresh user IDs
    private static final AtomicLong userIdCounter = new AtomicLong(1000);

    protected static Long newUserId() {
        return userIdCounter.getAndIncrement();
    }

    /**
     * Places a bank transfer order of 2 units at 50.00 plus 10.00 shipping.
     */
    protected Order placeOrder(Long buyerId, Long sellerId) {
        return placeOrder(buyerId, sellerId, PaymentMethod.BANK_TRANSFER);
    }

    protected Order placeOrder(Long buyerId, Long sellerId, PaymentMethod paymentMethod) {
        CreateOrderRequest request = new CreateOrderRequest(UUID.randomUUID(), null, sellerId, 2,
                new BigDecimal("50.00"), new BigDecimal("10.00"), "1 Main Street", paymentMethod,
                null, null, null);
        return orderService.createOrder(buyerId, ActorRole.BUYER, request);
    }

    /**
     * Drives an order through payment, processing and shipping to delivered.
     */
    protected void deliver(Order order) {
        UUID id = order.getId();
        Long seller = order.getSellerId();
        workflowEngine.applyTransition(EntityType.ORDER, id, WorkflowAction.MARK_PAID, ADMIN_ID, ActorRole.ADMIN,
                TransitionPayload.withPaymentReference("BANK-" + id.toString().substring(0, 6)));
        workflowEngine.applyTransition(EntityType.ORDER, id, WorkflowAction.START_PROCESSING, seller,
                ActorRole.SELLER, null);
        workflowEngine.applyTransition(EntityType.ORDER, id, WorkflowAction.MARK_READY_TO_SHIP, seller,
                ActorRole.SELLER, null);
        workflowEngine.applyTransition(EntityType.ORDER, id, WorkflowAction.SHIP, ADMIN_ID, ActorRole.ADMIN,
                new TransitionPayload(null, null, null, null, "TRK-1", "DHL", null, null, null));
        workflowEngine.applyTransition(EntityType.ORDER, id, WorkflowAction.DELIVER, seller, ActorRole.SELLER, null);
    }

    protected List<NotificationType> notificationTypesOf(Long userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, 100))
                .stream()
                .map(Notification::getType)
                .toList();
    }
}
