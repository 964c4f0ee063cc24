package com.nosota.tradeflow.api.response;

public record DesignFileResponse(
        String url,
        String filename,
        Long size,
        String mimeType
) {
}
