package com.escada.rentbot.transport;

import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.chatmember.ChatMember;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.Locale;

public final class TelegramTransport implements ChatTransport {
    private static final String HTML = "HTML";

    private final AbsSender sender;

    public TelegramTransport(AbsSender sender) {
        this.sender = sender;
    }

    @Override
    public int sendMessage(long chatId, String html, ReplyKeyboard keyboard) throws TransportException {
        SendMessage msg = new SendMessage();
        msg.setChatId(String.valueOf(chatId));
        msg.setText(html);
        msg.setParseMode(HTML);
        msg.setDisableWebPagePreview(true);
        if (keyboard != null) msg.setReplyMarkup(keyboard);
        try {
            Message sent = sender.execute(msg);
            return sent == null || sent.getMessageId() == null ? 0 : sent.getMessageId();
        } catch (TelegramApiException e) {
            throw translate(e);
        }
    }

    @Override
    public void sendPhoto(long chatId, String photoFileId, String htmlCaption) throws TransportException {
        SendPhoto sp = new SendPhoto();
        sp.setChatId(String.valueOf(chatId));
        sp.setPhoto(new InputFile(photoFileId));
        if (htmlCaption != null) {
            sp.setCaption(htmlCaption);
            sp.setParseMode(HTML);
        }
        try {
            sender.execute(sp);
        } catch (TelegramApiException e) {
            throw translate(e);
        }
    }

    @Override
    public void editMessage(long chatId, int messageId, String html, InlineKeyboardMarkup keyboard) throws TransportException {
        EditMessageText edit = new EditMessageText();
        edit.setChatId(String.valueOf(chatId));
        edit.setMessageId(messageId);
        edit.setText(html);
        edit.setParseMode(HTML);
        edit.setDisableWebPagePreview(true);
        if (keyboard != null) edit.setReplyMarkup(keyboard);
        try {
            sender.execute(edit);
        } catch (TelegramApiException e) {
            throw translate(e);
        }
    }

    @Override
    public void answerCallback(String callbackId, String text, boolean showAlert) throws TransportException {
        AnswerCallbackQuery ans = new AnswerCallbackQuery();
        ans.setCallbackQueryId(callbackId);
        if (text != null) ans.setText(text);
        ans.setShowAlert(showAlert);
        try {
            sender.execute(ans);
        } catch (TelegramApiException e) {
            throw translate(e);
        }
    }

    @Override
    public String getChatMemberStatus(String chat, long userId) throws TransportException {
        GetChatMember gcm = new GetChatMember();
        gcm.setChatId(chat);
        gcm.setUserId(userId);
        try {
            ChatMember m = sender.execute(gcm);
            return m == null ? null : m.getStatus();
        } catch (TelegramApiException e) {
            throw translate(e);
        }
    }

    static TransportException translate(TelegramApiException e) {
        String code = e.getClass().getSimpleName();
        String message = e.getMessage();
        if (e instanceof TelegramApiRequestException) {
            TelegramApiRequestException re = (TelegramApiRequestException) e;
            if (re.getErrorCode() != null) code = String.valueOf(re.getErrorCode());
            if (re.getApiResponse() != null) message = re.getApiResponse();
        }
        String lower = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if ("403".equals(code) || lower.contains("bot was blocked") || lower.contains("forbidden")) {
            return new RecipientBlockedException(message, e);
        }
        return new TransportException(code, message, e);
    }
}
