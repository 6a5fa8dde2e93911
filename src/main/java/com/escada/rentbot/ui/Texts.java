package com.escada.rentbot.ui;

import com.escada.rentbot.broadcast.DeliveryReport;
import com.escada.rentbot.model.AdminStats;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * User-facing texts. All of them are Telegram HTML, so anything coming from users goes through
 * {@link #escape(String)}.
 */
public final class Texts {
    private Texts() {}

    private static final DateTimeFormatter FULL_TIME = DateTimeFormatter.ofPattern("HH:mm:ss dd.MM.yyyy");
    private static final DateTimeFormatter SHORT_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public static final String CITY_PROMPT = """
            🏙 <b>Оберіть ваше місто:</b>

            Натисніть на кнопку з назвою міста нижче:""";

    public static final String MAIN_MENU = """
            🏠 <b>Головне меню</b>

            Оберіть потрібну дію з меню нижче:""";

    public static final String CITY_UNAVAILABLE = """
            ⏳ <b>Місто не знайдено або канал недоступний</b>

            Оберіть інше місто:""";

    public static final String CANCELLED = """
            ❌ <b>Дію скасовано</b>

            🔄 Повертаємося до головного меню:""";

    public static final String NOTHING_TO_CANCEL = "✅ Немає активних дій для скасування";
    public static final String UNKNOWN_COMMAND = "❌ Вибачте, команда не розпізнана";

    public static final String NO_USERS_FOR_BROADCAST = "❌ Немає користувачів для розсилки";
    public static final String EMPTY_BROADCAST = "❌ Повідомлення не містить тексту або фото";

    // Callback answers
    public static final String ALERT_NO_ACCESS = "❌ Немає доступу";
    public static final String ALERT_CITY_NOT_SELECTED = "❌ Помилка: місто не обрано";
    public static final String ALERT_CITY_NOT_FOUND = "❌ Помилка: місто не знайдено";
    public static final String ALERT_NOT_SUBSCRIBED = "❌ Підписку не знайдено. Спочатку підпишіться на канал!";
    public static final String TOAST_SUBSCRIPTION_CONFIRMED = "✅ Підписка підтверджена!";
    public static final String ALERT_CACHES_CLEARED = "✅ Всі кеші очищено!";

    public static String escape(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String nameOrDefault(String firstName) {
        return firstName == null || firstName.isBlank() ? "друже" : escape(firstName);
    }

    public static String welcome(String firstName) {
        return """
                👋 <b>Вітаємо, %s!</b>

                🏠 Бот для пошуку каналів з орендою житла без Ріелтора

                📍 Оберіть потрібну дію з меню:""".formatted(nameOrDefault(firstName));
    }

    public static String greeting(String firstName) {
        return """
                👋 <b>Привіт, %s!</b>

                🏠 Цей бот допомагає знаходити канали з орендою житла.

                🚀 Використовуйте меню нижче для навігації:""".formatted(nameOrDefault(firstName));
    }

    public static String rent(String adminContact) {
        return """
                🏠 <b>Здача квартири</b>

                📝 Для розміщення оголошення про здачу квартири зверніться до нашого адміністратора:

                👤 @%s

                Адміністратор допоможе вам:
                • Оформити оголошення
                • Розмістити в потрібному каналі
                • Відповісти на всі питання""".formatted(adminContact);
    }

    public static String subscribe(String channel) {
        return """
                📢 <b>Головний канал Escada</b>

                Підпишіться на наш головний канал, щоб отримувати:
                • Нові оголошення про оренду
                • Корисні поради
                • Новини ринку нерухомості

                📱 %s""".formatted(channel);
    }

    public static String subscribed(String channel) {
        return """
                ✅ <b>Відмінно!</b>

                Ви підписані на %s

                Тепер можете обирати місто та отримувати доступ до каналів з орендою житла!""".formatted(channel);
    }

    public static String notSubscribed(String channel) {
        return """
                ❌ <b>Підписку не знайдено</b>

                Для використання бота необхідно підписатися на наш головний канал:

                📢 %s""".formatted(channel);
    }

    public static String help(String channel, String adminContact) {
        return """
                ℹ️ <b>Довідка по боту</b>

                🏠 <b>Що робить бот:</b>
                • Допомагає знайти канали з орендою житла
                • Підбирає канал для вашого міста
                • Допомагає розмістити оголошення

                📋 <b>Як користуватися:</b>
                1️⃣ Підпишіться на %s
                2️⃣ Оберіть ваше місто
                3️⃣ Отримайте посилання на канал

                🆘 <b>Підтримка:</b> @%s
                📢 <b>Головний канал:</b> %s""".formatted(channel, adminContact, channel);
    }

    // City flow

    public static String cityChosenSubscribeFirst(String cityName, String channel) {
        return """
                🏠 <b>Ви обрали: %s</b>

                ✨ Для доступу до каналу спочатку підпишіться на наш головний канал:

                📢 <b>%s</b>""".formatted(cityName, channel);
    }

    public static String cityFoundSubscribeFirst(String cityName, String channel) {
        return """
                🏠 <b>Знайдено: %s</b>

                ✨ Для доступу до каналу спочатку підпишіться:

                📢 <b>%s</b>""".formatted(cityName, channel);
    }

    public static String cityFound(String cityName) {
        return """
                ✅ <b>Знайдено: %s</b>

                📢 Ось посилання на канал:""".formatted(cityName);
    }

    public static String cityChannel(String cityName) {
        return """
                ✅ <b>Дякуємо за підписку!</b>

                🏠 <b>Ваше місто: %s</b>

                📢 Ось посилання на канал з орендою житла:""".formatted(cityName);
    }

    public static String cityWithoutChannel(String cityName) {
        return """
                ⏳ <b>Місто: %s</b>

                ❗️ Канал для цього міста поки недоступний.

                Оберіть інше місто:""".formatted(cityName);
    }

    public static String cityNotFound(String input) {
        return """
                ❌ <b>Місто '%s' не знайдено</b>

                💡 <b>Поради:</b>
                • Перевірте правильність написання
                • Спробуйте повну назву міста
                • Оберіть зі списку нижче:""".formatted(escape(input));
    }

    // Admin

    public static String adminPanel(int activeUsers, int availableCities, LocalDateTime now) {
        return """
                👑 <b>Адмін панель</b>

                👥 Користувачів: <b>%d</b>
                🏙 Доступних міст: <b>%d</b>
                ⏰ %s""".formatted(activeUsers, availableCities, FULL_TIME.format(now));
    }

    public static String stats(int users, int availableCities, int spamBlocked, int subscriptionCache, int messageCache) {
        return """
                📊 <b>Детальна статистика:</b>

                👥 Всього користувачів: <b>%d</b>
                🏙 Доступних міст: <b>%d</b>
                🚫 Заблокованих за спам: <b>%d</b>
                💾 Кеш підписок: <b>%d</b>
                💬 Кеш повідомлень: <b>%d</b>""".formatted(users, availableCities, spamBlocked, subscriptionCache, messageCache);
    }

    public static String extendedStats(AdminStats s, int availableCities, int subscriptionCache, LocalDateTime now) {
        StringBuilder sb = new StringBuilder("""
                📊 <b>Розширена статистика</b>

                👥 Всього користувачів: <b>%d</b>
                ✅ Активних: <b>%d</b>
                🚫 Заблокованих: <b>%d</b>
                📤 Відписалось: <b>%d</b>

                📈 <b>За 7 днів:</b>
                🆕 Нових: <b>%d</b>
                👋 Пішло: <b>%d</b>

                🏙 Доступних міст: <b>%d</b>
                💾 Кеш підписок: <b>%d</b>
                ⏰ Оновлено: %s""".formatted(
                s.totalUsers, s.activeUsers, s.blockedUsers, s.totalUnsubscriptions,
                s.newUsers7d, s.unsubscribed7d, availableCities, subscriptionCache, SHORT_TIME.format(now)));

        if (!s.topCities.isEmpty()) {
            sb.append("\n\n🔥 <b>Топ міст (30 днів):</b>\n");
            int i = 1;
            for (AdminStats.CityCount c : s.topCities) {
                sb.append(i++).append(". ").append(c.cityName).append(": <b>").append(c.count).append("</b>\n");
            }
        }
        return sb.toString();
    }

    public static String users(AdminStats s) {
        return """
                👥 <b>Інформація про користувачів</b>

                Всього користувачів: <b>%d</b>
                Активних: <b>%d</b>
                Заблокованих: <b>%d</b>
                Відписалось: <b>%d</b>

                📈 <b>За останній тиждень:</b>
                Нових користувачів: <b>%d</b>
                Відписалось: <b>%d</b>""".formatted(
                s.totalUsers, s.activeUsers, s.blockedUsers, s.totalUnsubscriptions, s.newUsers7d, s.unsubscribed7d);
    }

    public static String broadcastPrompt(int activeUsers) {
        return """
                📢 <b>Розсилка повідомлень</b>

                👥 Активних користувачів: <b>%d</b>

                📝 Надішліть повідомлення для розсилки:

                ✅ <b>Підтримується:</b>
                • Текстові повідомлення
                • Фото з підписом
                • Форматування HTML

                ❌ Для скасування: /cancel""".formatted(activeUsers);
    }

    public static String broadcastStarting(int recipients, boolean photo) {
        return """
                📤 <b>Розпочинаю розсилку...</b>

                👥 Користувачів: %d
                📄 Тип: %s""".formatted(recipients, photo ? "фото з текстом" : "текстове повідомлення");
    }

    public static String broadcastProgress(DeliveryReport r, int total) {
        return """
                📤 <b>Розсилка в процесі...</b>

                ✅ Відправлено: %d
                ❌ Помилок: %d
                🚫 Заблокували: %d
                📊 Прогрес: %d/%d""".formatted(r.sent, r.failed, r.blocked, r.processed(), total);
    }

    public static String broadcastDone(DeliveryReport r, boolean photo) {
        return """
                ✅ <b>Розсилка завершена!</b>

                📤 Відправлено: <b>%d</b>
                ❌ Помилок: <b>%d</b>
                🚫 Заблокували бота: <b>%d</b>
                📄 Тип: <b>%s</b>

                📊 Успішність: <b>%s%%</b>""".formatted(
                r.sent, r.failed, r.blocked,
                photo ? "фото" : "текстове повідомлення",
                String.format(Locale.ROOT, "%.1f", r.successRatio() * 100));
    }

    public static String startupNotice(String botUsername, String adminContact, LocalDateTime now) {
        return """
                🚀 <b>Бот запущено!</b>

                🤖 @%s
                ⏰ %s
                👤 Контакт: @%s
                🛡 Антиспам: активний""".formatted(botUsername, FULL_TIME.format(now), adminContact);
    }
}
