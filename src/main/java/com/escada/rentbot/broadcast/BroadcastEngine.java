package com.escada.rentbot.broadcast;

import com.escada.rentbot.db.Repository;
import com.escada.rentbot.model.Broadcast;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.Delivery;
import com.escada.rentbot.model.DeliveryStatus;
import com.escada.rentbot.transport.ChatTransport;
import com.escada.rentbot.transport.RecipientBlockedException;
import com.escada.rentbot.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sends one broadcast to its recipients, one at a time.
 * <p>
 * A single failed recipient never aborts the run. Recipients that blocked the bot are marked
 * blocked in the repository so later broadcasts skip them.
 */
public final class BroadcastEngine {
    private static final Logger log = LoggerFactory.getLogger(BroadcastEngine.class);

    static final String BLOCKED_REASON = "blocked";

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final ChatTransport transport;
    private final Repository repository;
    private final long delayMillis;
    private final int progressEvery;
    private final Sleeper sleeper;

    public BroadcastEngine(ChatTransport transport, Repository repository, long delayMillis, int progressEvery) {
        this(transport, repository, delayMillis, progressEvery, Thread::sleep);
    }

    public BroadcastEngine(ChatTransport transport,
                           Repository repository,
                           long delayMillis,
                           int progressEvery,
                           Sleeper sleeper) {
        this.transport = transport;
        this.repository = repository;
        this.delayMillis = delayMillis;
        this.progressEvery = Math.max(1, progressEvery);
        this.sleeper = sleeper;
    }

    public DeliveryReport run(Broadcast broadcast, List<Delivery> recipients, ProgressListener progress) {
        int sent = 0;
        int blocked = 0;
        int failed = 0;
        int total = recipients.size();

        log.info("Broadcast {} started: {} recipients, {}", broadcast.id, total,
                broadcast.payload.isPhoto() ? "photo" : "text");

        for (Delivery d : recipients) {
            try {
                deliver(broadcast.payload, d.tgId);
                sent++;
                record(d, DeliveryStatus.SENT, null);
            } catch (RecipientBlockedException e) {
                blocked++;
                record(d, DeliveryStatus.BLOCKED, e.errorCode());
                markBlocked(d.tgId);
            } catch (TransportException e) {
                failed++;
                log.warn("Broadcast {}: delivery to {} failed: {}", broadcast.id, d.tgId, e.getMessage());
                record(d, DeliveryStatus.FAILED, e.errorCode());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Broadcast {}: delivery to {} failed: {}", broadcast.id, d.tgId, e.toString());
                record(d, DeliveryStatus.FAILED, e.getClass().getSimpleName());
            }

            int processed = sent + blocked + failed;
            if (processed % progressEvery == 0) {
                try {
                    progress.onProgress(new DeliveryReport(sent, blocked, failed), total);
                } catch (Exception e) {
                    log.debug("Progress update failed: {}", e.getMessage());
                }
            }

            try {
                sleeper.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Broadcast {} interrupted after {}/{} recipients", broadcast.id, processed, total);
                break;
            }
        }

        DeliveryReport report = new DeliveryReport(sent, blocked, failed, sent + blocked + failed == total);
        log.info("Broadcast {} finished: {}", broadcast.id, report);
        return report;
    }

    private void deliver(BroadcastPayload payload, long tgId) throws TransportException {
        if (payload.isPhoto()) {
            transport.sendPhoto(tgId, payload.photoFileId, payload.text);
        } else {
            transport.sendMessage(tgId, payload.text, null);
        }
    }

    private void record(Delivery d, DeliveryStatus status, String errorCode) {
        try {
            repository.updateDeliveryStatus(d.id, status, errorCode);
        } catch (RuntimeException e) {
            log.error("Could not record delivery {} as {}: {}", d.id, status, e.getMessage(), e);
        }
    }

    private void markBlocked(long tgId) {
        try {
            repository.setUserBlocked(tgId, true, BLOCKED_REASON);
            log.info("User {} blocked the bot, marked as blocked", tgId);
        } catch (RuntimeException e) {
            log.error("Could not mark user {} as blocked: {}", tgId, e.getMessage(), e);
        }
    }
}
