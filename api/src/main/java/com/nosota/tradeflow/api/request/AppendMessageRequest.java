package com.nosota.tradeflow.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * New message. Content may be omitted when at least one attachment is sent.
 */
public record AppendMessageRequest(
        @Size(max = 5000, message = "Message must be at most 5000 characters")
        String content,

        @Valid
        @Size(max = 10, message = "At most 10 attachments per message")
        List<AttachmentPayload> attachments
) {
}
