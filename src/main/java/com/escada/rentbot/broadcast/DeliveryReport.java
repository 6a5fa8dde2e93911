package com.escada.rentbot.broadcast;

import java.util.LinkedHashMap;
import java.util.Map;

public final class DeliveryReport {
    public final int sent;
    public final int blocked;
    public final int failed;
    /** False when the run stopped before every recipient was attempted. */
    public final boolean finished;

    public DeliveryReport(int sent, int blocked, int failed) {
        this(sent, blocked, failed, true);
    }

    public DeliveryReport(int sent, int blocked, int failed, boolean finished) {
        this.sent = sent;
        this.blocked = blocked;
        this.failed = failed;
        this.finished = finished;
    }

    public static DeliveryReport empty() {
        return new DeliveryReport(0, 0, 0);
    }

    public int processed() {
        return sent + blocked + failed;
    }

    /** sent / processed, 0 when nobody was processed. */
    public double successRatio() {
        int total = processed();
        if (total == 0) return 0.0;
        return (double) sent / total;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sent", sent);
        m.put("blocked", blocked);
        m.put("failed", failed);
        m.put("success_ratio", successRatio());
        return m;
    }

    @Override
    public String toString() {
        return "DeliveryReport{sent=" + sent + ", blocked=" + blocked + ", failed=" + failed
                + (finished ? "" : ", unfinished") + "}";
    }
}
