package com.escada.rentbot.handler;

import com.escada.rentbot.dispatch.InboundEvent;
import com.escada.rentbot.transport.ChatTransport;
import com.escada.rentbot.transport.MessageCache;
import com.escada.rentbot.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;

/**
 * Outbound helpers shared by the handlers.
 */
public final class Replier {
    private static final Logger log = LoggerFactory.getLogger(Replier.class);

    private final ChatTransport transport;
    private final MessageCache messageCache;

    public Replier(ChatTransport transport, MessageCache messageCache) {
        this.transport = transport;
        this.messageCache = messageCache;
    }

    public int reply(InboundEvent event, String html, ReplyKeyboard keyboard) throws TransportException {
        return transport.sendMessage(event.chatId, html, keyboard);
    }

    public int reply(InboundEvent event, String html) throws TransportException {
        return reply(event, html, null);
    }

    /**
     * Edits the message the callback came from. Identical repeated edits are skipped, "message is
     * not modified" is ignored, any other edit failure falls back to a new message.
     */
    public void safeEdit(InboundEvent event, String html, InlineKeyboardMarkup keyboard) throws TransportException {
        if (messageCache.isSameAsLastEdit(event.chatId, event.messageId, html)) {
            log.debug("Skip duplicate edit of {}:{}", event.chatId, event.messageId);
            return;
        }
        try {
            transport.editMessage(event.chatId, event.messageId, html, keyboard);
            messageCache.rememberEdit(event.chatId, event.messageId, html);
        } catch (TransportException e) {
            if (e.messageNotModified()) {
                messageCache.rememberEdit(event.chatId, event.messageId, html);
                return;
            }
            log.warn("Edit of {}:{} failed, sending new message: {}", event.chatId, event.messageId, e.getMessage());
            transport.sendMessage(event.chatId, html, keyboard);
        }
    }

    /** Answers a callback query. Failures are logged only: the query may already have expired. */
    public void answer(InboundEvent event, String text, boolean alert) {
        if (event.callbackId == null) return;
        try {
            transport.answerCallback(event.callbackId, text, alert);
        } catch (TransportException e) {
            log.warn("Callback answer failed for {}: {}", event.userId, e.getMessage());
        }
    }

    public void answer(InboundEvent event) {
        answer(event, null, false);
    }
}
