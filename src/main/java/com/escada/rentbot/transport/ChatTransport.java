package com.escada.rentbot.transport;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;

/**
 * Outbound side of the bot. Texts are HTML.
 */
public interface ChatTransport {

    /** @return id of the sent message */
    int sendMessage(long chatId, String html, ReplyKeyboard keyboard) throws TransportException;

    void sendPhoto(long chatId, String photoFileId, String htmlCaption) throws TransportException;

    void editMessage(long chatId, int messageId, String html, InlineKeyboardMarkup keyboard) throws TransportException;

    void answerCallback(String callbackId, String text, boolean showAlert) throws TransportException;

    /** Raw chat member status, e.g. {@code member}, {@code left}, {@code kicked}. */
    String getChatMemberStatus(String chat, long userId) throws TransportException;
}
