package com.nosota.tradeflow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Message attachment, referenced by URL.
 */
public record AttachmentPayload(
        @NotBlank(message = "Attachment URL is required")
        @Size(max = 2048, message = "Attachment URL must be at most 2048 characters")
        String url,

        @NotBlank(message = "Attachment file name is required")
        @Size(max = 255, message = "Attachment file name must be at most 255 characters")
        String fileName,

        @NotBlank(message = "Attachment MIME type is required")
        String mimeType,

        @PositiveOrZero(message = "Attachment size must not be negative")
        Long size
) {
}
