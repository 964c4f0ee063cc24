package com.nosota.tradeflow.api;

import com.nosota.tradeflow.api.request.PaymentResultRequest;
import com.nosota.tradeflow.api.response.PaymentResultResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Inbound contract for the payment gateway integration.
 *
 * <p>Implemented by PaymentController (service) and PaymentClient (api).
 */
@RequestMapping("/api/v1/payments")
public interface PaymentApi {

    /**
     * Reports the result of a payment session. Safe to repeat: a reference that has already
     * been settled is acknowledged as a no-op.
     *
     * @param request Reference, outcome and gateway transaction reference
     * @return Status of the paid entity after the callback
     */
    @PostMapping("/callback")
    ResponseEntity<PaymentResultResponse> onPaymentResult(
            @RequestBody @Valid PaymentResultRequest request);
}
