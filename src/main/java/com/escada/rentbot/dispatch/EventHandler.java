package com.escada.rentbot.dispatch;

import com.escada.rentbot.model.Session;
import com.escada.rentbot.transport.TransportException;

@FunctionalInterface
public interface EventHandler {
    void handle(InboundEvent event, Session session) throws TransportException;
}
