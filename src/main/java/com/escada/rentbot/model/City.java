package com.escada.rentbot.model;

public final class City {
    public final String code;
    public final String nameUk;

    /** null while the city has no channel yet */
    public final String channelUrl;
    public final boolean active;

    public City(String code, String nameUk, String channelUrl, boolean active) {
        this.code = code;
        this.nameUk = nameUk;
        this.channelUrl = channelUrl;
        this.active = active;
    }

    public boolean hasChannel() {
        return channelUrl != null && !channelUrl.isBlank();
    }

    @Override
    public String toString() {
        return "City{" + code + ", " + nameUk + "}";
    }
}
