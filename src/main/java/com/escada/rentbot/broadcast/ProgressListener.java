package com.escada.rentbot.broadcast;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (progress, total) -> { };

    void onProgress(DeliveryReport progress, int total) throws Exception;
}
