package com.escada.rentbot.ui;

import com.escada.rentbot.model.City;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;

import java.util.ArrayList;
import java.util.List;

public final class Keyboards {
    private Keyboards() {}

    // Main menu (reply keyboard) labels
    public static final String BTN_SELECT_CITY = "🏙 Обрати місто";
    public static final String BTN_RENT = "📝 Здати квартиру";
    public static final String BTN_SUBSCRIBE = "📢 Підписатися на канал";
    public static final String BTN_CHECK_SUB = "✅ Перевірити підписку";
    public static final String BTN_HELP = "ℹ️ Допомога";

    // Callback data
    public static final String CB_CITY_PREFIX = "city_";
    public static final String CB_CHECK_SUB = "check_subscription";
    public static final String CB_BACK_TO_MENU = "back_to_menu";
    public static final String CB_ADMIN_STATS = "admin_stats";
    public static final String CB_ADMIN_BROADCAST = "admin_broadcast";
    public static final String CB_ADMIN_USERS = "admin_users";
    public static final String CB_ADMIN_CLEAR_CACHE = "admin_clear_cache";

    public static ReplyKeyboardMarkup mainMenu() {
        KeyboardRow r1 = new KeyboardRow();
        r1.add(new KeyboardButton(BTN_SELECT_CITY));
        KeyboardRow r2 = new KeyboardRow();
        r2.add(new KeyboardButton(BTN_RENT));
        r2.add(new KeyboardButton(BTN_SUBSCRIBE));
        KeyboardRow r3 = new KeyboardRow();
        r3.add(new KeyboardButton(BTN_CHECK_SUB));
        r3.add(new KeyboardButton(BTN_HELP));

        ReplyKeyboardMarkup m = new ReplyKeyboardMarkup();
        m.setKeyboard(List.of(r1, r2, r3));
        m.setResizeKeyboard(true);
        m.setOneTimeKeyboard(false);
        return m;
    }

    /** Two cities per row, "back to menu" at the bottom. */
    public static InlineKeyboardMarkup cities(List<City> cities) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (int i = 0; i < cities.size(); i += 2) {
            List<InlineKeyboardButton> row = new ArrayList<>();
            row.add(cityButton(cities.get(i)));
            if (i + 1 < cities.size()) {
                row.add(cityButton(cities.get(i + 1)));
            }
            rows.add(row);
        }
        rows.add(List.of(backToMenuButton()));
        return markup(rows);
    }

    public static InlineKeyboardMarkup subscription(String channelLink) {
        return vertical(
                urlButton("📢 Підписатися", channelLink),
                callbackButton("✅ Перевірити підписку", CB_CHECK_SUB),
                backToMenuButton());
    }

    public static InlineKeyboardMarkup subscribeOnly(String channelLink) {
        return vertical(
                urlButton("📢 Підписатися", channelLink),
                backToMenuButton());
    }

    public static InlineKeyboardMarkup contactAdmin(String adminContact) {
        return vertical(
                urlButton("👤 Написати адміну", "https://t.me/" + adminContact),
                backToMenuButton());
    }

    /** Link to the city channel after a successful selection. */
    public static InlineKeyboardMarkup cityChannel(City city, String adminContact) {
        return vertical(
                urlButton("🔗 Канал " + city.nameUk, city.channelUrl),
                callbackButton("🏙 Обрати інше місто", CB_BACK_TO_MENU),
                urlButton("📝 Здати квартиру", "https://t.me/" + adminContact));
    }

    public static InlineKeyboardMarkup cityChannelShort(City city) {
        return vertical(
                urlButton("🔗 Канал " + city.nameUk, city.channelUrl),
                backToMenuButton());
    }

    public static InlineKeyboardMarkup admin() {
        return markup(List.of(
                List.of(callbackButton("📊 Статистика", CB_ADMIN_STATS),
                        callbackButton("📩 Розсилка", CB_ADMIN_BROADCAST)),
                List.of(callbackButton("👥 Користувачі", CB_ADMIN_USERS),
                        callbackButton("🔄 Очистити кеш", CB_ADMIN_CLEAR_CACHE))
        ));
    }

    private static InlineKeyboardButton callbackButton(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setCallbackData(data);
        return b;
    }

    private static InlineKeyboardButton urlButton(String text, String url) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setUrl(url);
        return b;
    }

    private static InlineKeyboardButton cityButton(City city) {
        return callbackButton("🏙 " + city.nameUk, CB_CITY_PREFIX + city.code);
    }

    private static InlineKeyboardButton backToMenuButton() {
        return callbackButton("🔙 Назад до меню", CB_BACK_TO_MENU);
    }

    private static InlineKeyboardMarkup vertical(InlineKeyboardButton... buttons) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (InlineKeyboardButton b : buttons) {
            rows.add(List.of(b));
        }
        return markup(rows);
    }

    private static InlineKeyboardMarkup markup(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(rows);
        return m;
    }
}
