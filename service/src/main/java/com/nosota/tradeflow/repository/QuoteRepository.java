package com.nosota.tradeflow.repository;

import com.nosota.tradeflow.api.model.QuoteStatus;
import com.nosota.tradeflow.model.Quote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface QuoteRepository extends JpaRepository<Quote, UUID> {

    List<Quote> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);

    List<Quote> findByConversationIdAndStatusIn(UUID conversationId, Collection<QuoteStatus> statuses);
}
