package com.healthecon.llm.model;

import lombok.Builder;
import lombok.Value;

/**
 * A bill prepared for the reasoning service: either an image (a scan, or the rendered first page of a PDF)
 * or plain text.
 */
@Value
@Builder
public class BillContent {
    String billId;
    String mediaType;
    byte[] data;

    public boolean isImage() {
        return mediaType != null && mediaType.startsWith("image/");
    }
}
