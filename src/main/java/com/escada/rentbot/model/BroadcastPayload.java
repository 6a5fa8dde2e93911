package com.escada.rentbot.model;

import java.util.Optional;

/**
 * What a broadcast sends: plain text, or a photo (Telegram file id) with an optional caption.
 * Decided once for the whole run.
 */
public final class BroadcastPayload {
    public final String text;
    public final String photoFileId;

    private BroadcastPayload(String text, String photoFileId) {
        this.text = text;
        this.photoFileId = photoFileId;
    }

    public static Optional<BroadcastPayload> from(String text, String photoFileId) {
        boolean hasText = text != null && !text.isBlank();
        boolean hasPhoto = photoFileId != null && !photoFileId.isBlank();
        if (!hasText && !hasPhoto) return Optional.empty();
        return Optional.of(new BroadcastPayload(hasText ? text : null, hasPhoto ? photoFileId : null));
    }

    public static BroadcastPayload text(String text) {
        return from(text, null).orElseThrow(() -> new IllegalArgumentException("empty broadcast text"));
    }

    public static BroadcastPayload photo(String photoFileId, String caption) {
        return from(caption, photoFileId).orElseThrow(() -> new IllegalArgumentException("empty broadcast photo"));
    }

    public boolean isPhoto() {
        return photoFileId != null;
    }

    public String title() {
        if (text == null) return "photo";
        String t = text.strip();
        return t.length() <= 50 ? t : t.substring(0, 50);
    }
}
