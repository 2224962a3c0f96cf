package com.campaign.canon.narrative;

import java.util.Objects;

/**
 * A rendered summary document.
 */
public final class RenderedDocument {

    private final String contentType;
    private final byte[] content;

    public RenderedDocument(String contentType, byte[] content) {
        this.contentType = Objects.requireNonNull(contentType, "contentType is required");
        this.content = Objects.requireNonNull(content, "content is required").clone();
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }
}
