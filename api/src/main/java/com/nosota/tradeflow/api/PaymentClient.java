package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.request.PaymentResultRequest;
import com.nosota.tradeflow.api.response.PaymentResultResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of PaymentApi, used by the gateway integration to report
 * payment results.
 */
@RequiredArgsConstructor
@Slf4j
public class PaymentClient implements PaymentApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<PaymentResultResponse> onPaymentResult(PaymentResultRequest request) {
        log.debug("Calling onPaymentResult: referenceId={}, outcome={}, transactionRef={}",
                request.referenceId(), request.outcome(), request.transactionRef());

        return webClient.post()
                .uri("/api/v1/payments/callback")
                .bodyValue(request)
                .retrieve()
                .toEntity(PaymentResultResponse.class)
                .block();
    }
}
