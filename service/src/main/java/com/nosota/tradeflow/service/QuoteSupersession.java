package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.ActorRole;
import com.nosota.tradeflow.api.model.NotificationType;
import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.api.model.SideEffectType;
import com.nosota.tradeflow.api.model.WorkflowAction;
import com.nosota.tradeflow.model.Quote;
import com.nosota.tradeflow.repository.QuoteRepository;
import com.nosota.tradeflow.statemachine.TransitionTable;
import com.nosota.tradeflow.statemachine.TransitionTables;
import com.nosota.tradeflow.workflow.SideEffect;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Keeps at most one open (pending or sent) quote per conversation.
 *
 * <p>Callers must hold the conversation row lock, so two quotes opened concurrently in the
 * same conversation serialize on it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuoteSupersession {

    private static final EnumSet<QuoteStatus> OPEN = EnumSet.of(QuoteStatus.PENDING, QuoteStatus.SENT);

    private final QuoteRepository quoteRepository;
    private final NotificationDispatcher notificationDispatcher;

    /**
     * Moves every open quote of the conversation other than {@code keepQuoteId} to SUPERSEDED.
     *
     * @return one effect per superseded quote
     */
    public List<SideEffect> supersedeOthers(UUID conversationId, UUID keepQuoteId) {
        TransitionTable<QuoteStatus> table = TransitionTables.QUOTE;
        List<SideEffect> effects = new ArrayList<>();

        for (Quote other : quoteRepository.findByConversationIdAndStatusIn(conversationId, OPEN)) {
            if (other.getId().equals(keepQuoteId)) {
                continue;
            }
            TransitionTable.Transition<QuoteStatus> move =
                    table.resolve(other.getId(), other.getStatus(), WorkflowAction.SUPERSEDE, ActorRole.SYSTEM);
            other.setStatus(move.to());
            quoteRepository.saveAndFlush(other);
            log.info("Quote {} superseded by {} in conversation {}", other.getId(), keepQuoteId, conversationId);

            notificationDispatcher.dispatch(other.getBuyerId(), NotificationType.QUOTE_SUPERSEDED,
                    "Quote replaced", "A newer quote replaced the previous offer", "/quotes/" + keepQuoteId);
            effects.add(new SideEffect(SideEffectType.QUOTE_SUPERSEDED, other.getId(), "superseded by " + keepQuoteId));
        }
        return effects;
    }
}
