package com.nosota.tradeflow.service;

import com.nosota.tradeflow.api.model.EntityType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Gateway whose session handle is a hosted page URL derived from the reference.
 */
@Component
@Slf4j
public class HostedPaymentGateway implements PaymentGateway {

    private final String sessionBaseUrl;

    public HostedPaymentGateway(@Value("${payment.gateway.session-base-url}") String sessionBaseUrl) {
        this.sessionBaseUrl = sessionBaseUrl;
    }

    @Override
    public String createSession(UUID referenceId, EntityType entityType, UUID entityId, BigDecimal amount) {
        String url = UriComponentsBuilder.fromHttpUrl(sessionBaseUrl)
                .pathSegment(referenceId.toString())
                .queryParam("amount", amount.toPlainString())
                .queryParam("type", entityType.name().toLowerCase())
                .build()
                .toUriString();
        log.debug("Payment session {} for {} {}: {}", referenceId, entityType, entityId, url);
        return url;
    }
}
