package com.escada.rentbot.broadcast;

import com.escada.rentbot.model.BroadcastPayload;

public final class BroadcastJob {
    public final long broadcastId;
    public final BroadcastPayload payload;
    public final long adminTgId;

    /** where the progress message lives; 0 means no progress message */
    public final long statusChatId;
    public final int statusMessageId;

    public final int recipients;

    public BroadcastJob(long broadcastId,
                        BroadcastPayload payload,
                        long adminTgId,
                        long statusChatId,
                        int statusMessageId,
                        int recipients) {
        this.broadcastId = broadcastId;
        this.payload = payload;
        this.adminTgId = adminTgId;
        this.statusChatId = statusChatId;
        this.statusMessageId = statusMessageId;
        this.recipients = recipients;
    }
}
