package com.nosota.tradeflow.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Optional data accompanying a workflow action.
 *
 * <p>Which fields are read depends on the action:
 * <ul>
 *   <li>SUBMIT_PAYMENT - paymentReference, paymentSlipUrl</li>
 *   <li>MARK_PAID - paymentReference</li>
 *   <li>SHIP - trackingNumber, carrier</li>
 *   <li>SEND (quote) - quotedPrice, expiresAt</li>
 *   <li>RESUBMIT (design) - designFiles</li>
 *   <li>SELLER_APPROVE / ADMIN_APPROVE (return) - amount</li>
 *   <li>REJECT, REQUEST_CHANGES, SELLER_REJECT, ADMIN_* - notes</li>
 * </ul>
 *
 * @param notes            Free-text notes or reason
 * @param amount           Refund amount proposed or approved
 * @param quotedPrice      Unit price when sending a requested quote
 * @param expiresAt        Quote expiry when sending a requested quote
 * @param trackingNumber   Carrier tracking number
 * @param carrier          Carrier name
 * @param paymentReference External payment or transfer reference
 * @param paymentSlipUrl   Storage URL of an uploaded bank slip
 * @param designFiles      Replacement design files
 */
public record TransitionPayload(
        @Size(max = 2000, message = "Notes must be at most 2000 characters")
        String notes,

        @Positive(message = "Amount must be positive")
        BigDecimal amount,

        @Positive(message = "Quoted price must be positive")
        BigDecimal quotedPrice,

        LocalDateTime expiresAt,

        @Size(max = 100, message = "Tracking number must be at most 100 characters")
        String trackingNumber,

        @Size(max = 100, message = "Carrier must be at most 100 characters")
        String carrier,

        @Size(max = 255, message = "Payment reference must be at most 255 characters")
        String paymentReference,

        @Size(max = 2048, message = "Payment slip URL must be at most 2048 characters")
        String paymentSlipUrl,

        @Valid
        List<DesignFilePayload> designFiles
) {

    public static TransitionPayload empty() {
        return new TransitionPayload(null, null, null, null, null, null, null, null, null);
    }

    public static TransitionPayload withNotes(String notes) {
        return new TransitionPayload(notes, null, null, null, null, null, null, null, null);
    }

    public static TransitionPayload withAmount(BigDecimal amount, String notes) {
        return new TransitionPayload(notes, amount, null, null, null, null, null, null, null);
    }

    public static TransitionPayload withPaymentReference(String paymentReference) {
        return new TransitionPayload(null, null, null, null, null, null, paymentReference, null, null);
    }
}
