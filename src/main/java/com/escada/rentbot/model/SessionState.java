package com.escada.rentbot.model;

public enum SessionState {
    IDLE,
    AWAITING_CITY,
    AWAITING_BROADCAST_BODY,
    ADMIN_MENU
}
