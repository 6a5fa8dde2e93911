package com.escada.rentbot.subscription;

@FunctionalInterface
public interface MembershipCheck {
    boolean isMember(long userId) throws Exception;
}
