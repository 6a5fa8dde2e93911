package com.escada.rentbot.dispatch;

public enum EventType {
    // Commands
    START,
    CANCEL,
    ADMIN,
    STATS,
    UNKNOWN_COMMAND,

    // Main menu buttons
    MENU_SELECT_CITY,
    MENU_RENT,
    MENU_SUBSCRIBE,
    MENU_CHECK_SUBSCRIPTION,
    MENU_HELP,

    // Plain content, routed by session state
    TEXT,
    PHOTO,
    OTHER,

    // Inline keyboard callbacks
    CALLBACK_CITY,
    CALLBACK_CHECK_SUBSCRIPTION,
    CALLBACK_BACK_TO_MENU,
    CALLBACK_ADMIN_STATS,
    CALLBACK_ADMIN_BROADCAST,
    CALLBACK_ADMIN_USERS,
    CALLBACK_ADMIN_CLEAR_CACHE,
    CALLBACK_UNKNOWN;

    public boolean isContent() {
        return this == TEXT || this == PHOTO || this == OTHER;
    }

    public boolean isCallback() {
        return name().startsWith("CALLBACK_");
    }
}
