package com.nosota.tradeflow.workflow;

import com.nosota.tradeflow.api.model.EntityType;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.model.LedgerEntry;
import com.nosota.tradeflow.model.Message;
import com.nosota.tradeflow.service.CommissionLedgerService;
import com.nosota.tradeflow.service.ConversationService;
import com.nosota.tradeflow.service.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Builds the deferred side effects handlers queue on a {@link TransitionContext}.
 */
@Component
@RequiredArgsConstructor
public class SideEffectFactory {

    private final ConversationService conversationService;
    private final NotificationDispatcher notificationDispatcher;
    private final CommissionLedgerService commissionLedgerService;

    public SideEffectTask systemMessage(UUID conversationId, String content) {
        return () -> {
            if (conversationId == null) {
                return null;
            }
            Message message = conversationService.postSystemMessage(conversationId, content);
            return new SideEffect(SideEffectType.SYSTEM_MESSAGE_POSTED, message.getId(), content);
        };
    }

    public SideEffectTask notification(Long userId, NotificationType type, String title, String message,
                                       String link, UUID entityId) {
        return () -> {
            if (userId == null) {
                return null;
            }
            notificationDispatcher.dispatch(userId, type, title, message, link);
            return new SideEffect(SideEffectType.NOTIFICATION_QUEUED, entityId, type.name() + " -> user " + userId);
        };
    }

    public SideEffectTask payout(EntityType entityType, UUID entityId, Long sellerId, BigDecimal amount) {
        return () -> {
            LedgerEntry entry = commissionLedgerService.recordPayout(entityType, entityId, sellerId, amount);
            return new SideEffect(SideEffectType.COMMISSION_RECORDED, entry.getId(),
                    "seller payout " + entry.getSellerPayout() + " after commission " + entry.getCommissionAmount());
        };
    }
}
