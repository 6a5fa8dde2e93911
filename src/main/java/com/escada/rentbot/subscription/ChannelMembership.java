package com.escada.rentbot.subscription;

import com.escada.rentbot.transport.ChatTransport;

import java.util.Locale;
import java.util.Set;

/**
 * Asks Telegram whether the user is a member of the main channel. The bot has to be an admin of
 * the channel for this to work.
 */
public final class ChannelMembership implements MembershipCheck {
    private static final Set<String> MEMBER_STATUSES = Set.of("member", "administrator", "creator");

    private final ChatTransport transport;
    private final String channel;

    public ChannelMembership(ChatTransport transport, String channel) {
        this.transport = transport;
        this.channel = channel;
    }

    @Override
    public boolean isMember(long userId) throws Exception {
        String status = transport.getChatMemberStatus(channel, userId);
        if (status == null) return false;
        return MEMBER_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }
}
