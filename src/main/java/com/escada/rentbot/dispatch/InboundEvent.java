package com.escada.rentbot.dispatch;

/**
 * One classified update. {@code messageId} is the message the callback button belongs to, or the
 * incoming message itself.
 */
public final class InboundEvent {
    public final EventType type;
    public final long userId;
    public final long chatId;
    public final int messageId;
    public final String username;
    public final String firstName;
    public final String languageCode;

    /** Message text or caption, callback data for callbacks. */
    public final String text;

    /** Command argument (the /start tag) or the city code of a city callback. */
    public final String argument;

    public final String photoFileId;
    public final String callbackId;

    private InboundEvent(Builder b) {
        this.type = b.type;
        this.userId = b.userId;
        this.chatId = b.chatId;
        this.messageId = b.messageId;
        this.username = b.username;
        this.firstName = b.firstName;
        this.languageCode = b.languageCode;
        this.text = b.text;
        this.argument = b.argument;
        this.photoFileId = b.photoFileId;
        this.callbackId = b.callbackId;
    }

    public static Builder builder(EventType type, long userId, long chatId) {
        return new Builder(type, userId, chatId);
    }

    @Override
    public String toString() {
        return "InboundEvent{" + type + ", user=" + userId + ", chat=" + chatId + "}";
    }

    public static final class Builder {
        private final EventType type;
        private final long userId;
        private final long chatId;
        private int messageId;
        private String username;
        private String firstName;
        private String languageCode;
        private String text;
        private String argument;
        private String photoFileId;
        private String callbackId;

        private Builder(EventType type, long userId, long chatId) {
            this.type = type;
            this.userId = userId;
            this.chatId = chatId;
        }

        public Builder messageId(int messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder languageCode(String languageCode) {
            this.languageCode = languageCode;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder argument(String argument) {
            this.argument = argument;
            return this;
        }

        public Builder photoFileId(String photoFileId) {
            this.photoFileId = photoFileId;
            return this;
        }

        public Builder callbackId(String callbackId) {
            this.callbackId = callbackId;
            return this;
        }

        public InboundEvent build() {
            return new InboundEvent(this);
        }
    }
}
