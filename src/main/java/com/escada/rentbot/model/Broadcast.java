package com.escada.rentbot.model;

public final class Broadcast {
    public final long id;
    public final BroadcastPayload payload;
    public final long createdByTgId;

    public Broadcast(long id, BroadcastPayload payload, long createdByTgId) {
        this.id = id;
        this.payload = payload;
        this.createdByTgId = createdByTgId;
    }
}
