package com.nosota.tradeflow.api.response;

public record AttachmentResponse(
        String url,
        String fileName,
        String mimeType,
        Long size
) {
}
