package com.escada.rentbot.dispatch;

import com.escada.rentbot.ui.Keyboards;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.util.List;
import java.util.Locale;

/**
 * Turns a Telegram {@link Update} into an {@link InboundEvent}. Updates that are neither a user
 * message nor a callback query classify to {@code null}.
 */
public final class EventClassifier {
    private EventClassifier() {}

    public static InboundEvent classify(Update update) {
        if (update.hasCallbackQuery()) {
            return classifyCallback(update.getCallbackQuery());
        }
        if (update.hasMessage()) {
            return classifyMessage(update.getMessage());
        }
        return null;
    }

    private static InboundEvent classifyMessage(Message m) {
        User from = m.getFrom();
        if (from == null) return null;

        InboundEvent.Builder b;
        if (m.hasText()) {
            String text = m.getText().trim();
            if (text.startsWith("/")) {
                b = command(text, from.getId(), m.getChatId());
            } else {
                b = InboundEvent.builder(menuOrText(text), from.getId(), m.getChatId()).text(text);
            }
        } else if (m.hasPhoto()) {
            List<PhotoSize> sizes = m.getPhoto();
            // Telegram lists sizes from smallest to largest
            String fileId = sizes.get(sizes.size() - 1).getFileId();
            b = InboundEvent.builder(EventType.PHOTO, from.getId(), m.getChatId())
                    .photoFileId(fileId)
                    .text(m.getCaption());
        } else {
            b = InboundEvent.builder(EventType.OTHER, from.getId(), m.getChatId());
        }

        return withSender(b, from).messageId(m.getMessageId()).build();
    }

    private static InboundEvent classifyCallback(CallbackQuery cq) {
        User from = cq.getFrom();
        if (cq.getMessage() == null || from == null) return null;

        String data = cq.getData() == null ? "" : cq.getData();
        EventType type = callbackType(data);
        InboundEvent.Builder b = InboundEvent.builder(type, from.getId(), cq.getMessage().getChatId())
                .text(data)
                .callbackId(cq.getId())
                .messageId(cq.getMessage().getMessageId());
        if (type == EventType.CALLBACK_CITY) {
            b.argument(data.substring(Keyboards.CB_CITY_PREFIX.length()));
        }
        return withSender(b, from).build();
    }

    private static InboundEvent.Builder command(String text, long userId, long chatId) {
        String[] parts = text.split("\\s+", 2);
        String cmd = parts[0].substring(1);
        int at = cmd.indexOf('@');
        if (at >= 0) cmd = cmd.substring(0, at);
        String arg = parts.length > 1 ? parts[1].trim() : null;

        EventType type = switch (cmd.toLowerCase(Locale.ROOT)) {
            case "start" -> EventType.START;
            case "cancel" -> EventType.CANCEL;
            case "admin" -> EventType.ADMIN;
            case "stats" -> EventType.STATS;
            case "help" -> EventType.MENU_HELP;
            default -> EventType.UNKNOWN_COMMAND;
        };
        return InboundEvent.builder(type, userId, chatId)
                .text(text)
                .argument(arg == null || arg.isEmpty() ? null : arg);
    }

    static EventType menuOrText(String text) {
        return switch (text) {
            case Keyboards.BTN_SELECT_CITY -> EventType.MENU_SELECT_CITY;
            case Keyboards.BTN_RENT -> EventType.MENU_RENT;
            case Keyboards.BTN_SUBSCRIBE -> EventType.MENU_SUBSCRIBE;
            case Keyboards.BTN_CHECK_SUB -> EventType.MENU_CHECK_SUBSCRIPTION;
            case Keyboards.BTN_HELP -> EventType.MENU_HELP;
            default -> EventType.TEXT;
        };
    }

    static EventType callbackType(String data) {
        if (data.startsWith(Keyboards.CB_CITY_PREFIX) && data.length() > Keyboards.CB_CITY_PREFIX.length()) {
            return EventType.CALLBACK_CITY;
        }
        return switch (data) {
            case Keyboards.CB_CHECK_SUB -> EventType.CALLBACK_CHECK_SUBSCRIPTION;
            case Keyboards.CB_BACK_TO_MENU -> EventType.CALLBACK_BACK_TO_MENU;
            case Keyboards.CB_ADMIN_STATS -> EventType.CALLBACK_ADMIN_STATS;
            case Keyboards.CB_ADMIN_BROADCAST -> EventType.CALLBACK_ADMIN_BROADCAST;
            case Keyboards.CB_ADMIN_USERS -> EventType.CALLBACK_ADMIN_USERS;
            case Keyboards.CB_ADMIN_CLEAR_CACHE -> EventType.CALLBACK_ADMIN_CLEAR_CACHE;
            default -> EventType.CALLBACK_UNKNOWN;
        };
    }

    private static InboundEvent.Builder withSender(InboundEvent.Builder b, User from) {
        return b.username(from.getUserName())
                .firstName(from.getFirstName())
                .languageCode(from.getLanguageCode());
    }
}
