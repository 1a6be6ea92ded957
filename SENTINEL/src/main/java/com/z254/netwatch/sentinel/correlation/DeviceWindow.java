package com.z254.netwatch.sentinel.correlation;

import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.Modality;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Open correlation window of one device.
 * <p>
 * Membership is derived from event timestamps: the window spans from its earliest to its
 * latest event and that span never exceeds the window length. Mutated only under the
 * owning {@link EventCorrelator}'s lock.
 */
class DeviceWindow {

    enum Admission {
        JOINED,
        BEYOND_WINDOW,
        LATE
    }

    private final String device;
    private final double length;
    private final int maxEvents;
    private final List<AnomalyEvent> events = new ArrayList<>();

    private double windowStart;
    private double latestTimestamp;
    private int revision;
    private Set<Modality> emittedModalities = EnumSet.noneOf(Modality.class);

    DeviceWindow(String device, AnomalyEvent first, double length, int maxEvents) {
        this.device = device;
        this.length = length;
        this.maxEvents = maxEvents;
        this.windowStart = first.getTimestamp();
        this.latestTimestamp = first.getTimestamp();
        this.events.add(first);
    }

    Admission admit(AnomalyEvent event) {
        double ts = event.getTimestamp();
        if (ts > windowStart + length) {
            return Admission.BEYOND_WINDOW;
        }
        if (ts < windowStart) {
            if (latestTimestamp - ts > length) {
                return Admission.LATE;
            }
            windowStart = ts;
        }
        latestTimestamp = Math.max(latestTimestamp, ts);
        events.add(event);
        if (events.size() > maxEvents) {
            evictOldest();
        }
        return Admission.JOINED;
    }

    private void evictOldest() {
        AnomalyEvent oldest = events.stream()
                .min(Comparator.comparingDouble(AnomalyEvent::getTimestamp))
                .orElseThrow();
        events.remove(oldest);
        windowStart = events.stream()
                .mapToDouble(AnomalyEvent::getTimestamp)
                .min()
                .orElse(latestTimestamp);
    }

    boolean isExpired(double now) {
        return windowStart + length < now;
    }

    /**
     * Best confidence per modality seen in this window.
     */
    Map<Modality, Double> bestConfidenceByModality() {
        Map<Modality, Double> best = new EnumMap<>(Modality.class);
        for (AnomalyEvent event : events) {
            best.merge(event.getModality(), event.getConfidence(), Math::max);
        }
        return best;
    }

    double maxConfidence() {
        return events.stream().mapToDouble(AnomalyEvent::getConfidence).max().orElse(0.0);
    }

    Set<Modality> modalities() {
        Set<Modality> modalities = EnumSet.noneOf(Modality.class);
        events.forEach(e -> modalities.add(e.getModality()));
        return modalities;
    }

    boolean isEmitted() {
        return revision > 0;
    }

    int nextRevision(Set<Modality> modalities) {
        revision++;
        emittedModalities = EnumSet.copyOf(modalities);
        return revision;
    }

    Set<Modality> getEmittedModalities() {
        return emittedModalities;
    }

    String getDevice() {
        return device;
    }

    double getWindowStart() {
        return windowStart;
    }

    double getLatestTimestamp() {
        return latestTimestamp;
    }

    List<AnomalyEvent> getEvents() {
        return events;
    }

    int getRevision() {
        return revision;
    }
}
