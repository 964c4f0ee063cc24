package com.nosota.tradeflow.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Reference to a design file already uploaded to object storage.
 *
 * @param url      Storage URL of the file
 * @param filename Original file name
 * @param size     File size in bytes
 * @param mimeType MIME type reported by the uploader
 */
public record DesignFilePayload(
        @NotBlank(message = "File URL is required")
        @Size(max = 2048, message = "File URL must be at most 2048 characters")
        String url,

        @NotBlank(message = "File name is required")
        @Size(max = 255, message = "File name must be at most 255 characters")
        String filename,

        @PositiveOrZero(message = "File size must not be negative")
        Long size,

        @NotBlank(message = "MIME type is required")
        String mimeType
) {
}
