package com.nosota.tradeflow.controller;

import com.nosota.tradeflow.api.PaymentApi;
import com.nosota.tradeflow.api.request.PaymentResultRequest;
import com.nosota.tradeflow.api.response.PaymentResultResponse;
import com.nosota.tradeflow.service.PaymentCallbackService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class PaymentController implements PaymentApi {

    private final PaymentCallbackService paymentCallbackService;

    @Override
    public ResponseEntity<PaymentResultResponse> onPaymentResult(PaymentResultRequest request) {
        log.info("Payment callback for reference {}: {}", request.referenceId(), request.outcome());
        return ResponseEntity.ok(paymentCallbackService.onPaymentResult(request));
    }
}
