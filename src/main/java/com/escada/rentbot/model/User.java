package com.escada.rentbot.model;

public final class User {
    public final long id;
    public final long tgId;
    public final String username;
    public final String firstName;
    public final String lang;
    public final String lastCity;
    public final boolean active;
    public final boolean blocked;
    public final long createdAt;
    public final long updatedAt;
    public final Long lastSeenAt;

    /** Deep-link payload of the very first /start (acquisition tag). */
    public final String utmSource;

    public User(long id,
                long tgId,
                String username,
                String firstName,
                String lang,
                String lastCity,
                boolean active,
                boolean blocked,
                long createdAt,
                long updatedAt,
                Long lastSeenAt,
                String utmSource) {
        this.id = id;
        this.tgId = tgId;
        this.username = username;
        this.firstName = firstName;
        this.lang = lang;
        this.lastCity = lastCity;
        this.active = active;
        this.blocked = blocked;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.lastSeenAt = lastSeenAt;
        this.utmSource = utmSource;
    }

    public boolean deliverable() {
        return active && !blocked;
    }
}
