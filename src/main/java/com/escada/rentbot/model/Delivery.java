package com.escada.rentbot.model;

/**
 * One queued recipient of a broadcast, joined with the user's Telegram id.
 */
public final class Delivery {
    public final long id;
    public final long broadcastId;
    public final long userId;
    public final long tgId;

    public Delivery(long id, long broadcastId, long userId, long tgId) {
        this.id = id;
        this.broadcastId = broadcastId;
        this.userId = userId;
        this.tgId = tgId;
    }
}
