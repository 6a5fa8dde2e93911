package com.escada.rentbot.broadcast;

import com.escada.rentbot.db.Json;
import com.escada.rentbot.db.Repository;
import com.escada.rentbot.model.Broadcast;
import com.escada.rentbot.model.BroadcastPayload;
import com.escada.rentbot.model.Delivery;
import com.escada.rentbot.transport.ChatTransport;
import com.escada.rentbot.transport.TransportException;
import com.escada.rentbot.ui.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Broadcast lifecycle: draft and recipient snapshot on launch, then running and completed on the
 * worker thread.
 * <p>
 * A run cut short by shutdown is left running with its remaining deliveries queued. A restarted
 * process does not resume them.
 */
public final class BroadcastService {
    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final Repository repository;
    private final BroadcastEngine engine;
    private final ChatTransport transport;
    private final Clock clock;
    private final BroadcastWorker worker;

    public BroadcastService(Repository repository, BroadcastEngine engine, ChatTransport transport, Clock clock) {
        this.repository = repository;
        this.engine = engine;
        this.transport = transport;
        this.clock = clock;
        this.worker = new BroadcastWorker(this::execute);
    }

    public void start() {
        worker.start();
    }

    public void stop() {
        worker.stop();
    }

    /**
     * Creates the broadcast, snapshots its recipients and queues it for the worker.
     *
     * @return broadcast id
     */
    public long launch(long adminTgId, long statusChatId, int statusMessageId, BroadcastPayload payload) {
        long id = repository.createBroadcast(payload, adminTgId);
        int recipients = repository.createDeliveriesForBroadcast(id);
        log.info("Broadcast {} created by {}: {} recipients", id, adminTgId, recipients);
        worker.submit(new BroadcastJob(id, payload, adminTgId, statusChatId, statusMessageId, recipients));
        return id;
    }

    void execute(BroadcastJob job) {
        repository.markBroadcastRunning(job.broadcastId);
        List<Delivery> recipients = repository.getQueuedDeliveries(job.broadcastId, Integer.MAX_VALUE);

        Broadcast broadcast = new Broadcast(job.broadcastId, job.payload, job.adminTgId);
        DeliveryReport report = engine.run(broadcast, recipients, (progress, total) -> {
            if (job.statusMessageId > 0) {
                transport.editMessage(job.statusChatId, job.statusMessageId,
                        Texts.broadcastProgress(progress, total), null);
            }
        });

        if (!report.finished) {
            // queued rows are not resumed, the broadcast stays running
            log.warn("Broadcast {} stopped after {}/{} recipients, left as running",
                    job.broadcastId, report.processed(), recipients.size());
            return;
        }

        repository.completeBroadcast(job.broadcastId, Json.write(report.toMap()));
        try {
            repository.addDailyMetrics(LocalDate.now(clock), report.sent, report.failed, report.blocked);
        } catch (RuntimeException e) {
            log.warn("Daily metrics not updated for broadcast {}: {}", job.broadcastId, e.getMessage());
        }

        if (job.statusMessageId > 0) {
            try {
                transport.editMessage(job.statusChatId, job.statusMessageId,
                        Texts.broadcastDone(report, job.payload.isPhoto()), null);
            } catch (TransportException e) {
                log.warn("Final broadcast report not delivered to admin: {}", e.getMessage());
            }
        }
    }

    public int pending() {
        return worker.pending();
    }
}
