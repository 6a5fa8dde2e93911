package com.escada.rentbot.broadcast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single background thread that runs broadcasts one after another, so a long broadcast never
 * holds up update handling.
 */
public final class BroadcastWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(BroadcastWorker.class);

    public interface Handler {
        void handle(BroadcastJob job) throws Exception;
    }

    private final Handler handler;
    private final BlockingQueue<BroadcastJob> queue = new LinkedBlockingQueue<>();

    private final Thread thread;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BroadcastWorker(Handler handler) {
        this.handler = handler;
        this.thread = new Thread(this, "broadcast-worker");
        this.thread.setDaemon(true);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            thread.start();
            log.info("BroadcastWorker started");
        }
    }

    public void stop() {
        running.set(false);
        thread.interrupt();
    }

    public void submit(BroadcastJob job) {
        queue.add(job);
        log.info("Broadcast {} queued ({} waiting)", job.broadcastId, queue.size());
    }

    public int pending() {
        return queue.size();
    }

    @Override
    public void run() {
        while (running.get()) {
            try {
                BroadcastJob job = queue.poll(1, TimeUnit.SECONDS);
                if (job == null) continue;

                try {
                    handler.handle(job);
                } catch (Exception e) {
                    log.error("Broadcast {} failed: {}", job.broadcastId, e.getMessage(), e);
                }
            } catch (InterruptedException ie) {
                // shutdown
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("BroadcastWorker stopped.");
    }
}
