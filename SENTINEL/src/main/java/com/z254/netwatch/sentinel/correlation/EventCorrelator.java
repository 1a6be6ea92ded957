package com.z254.netwatch.sentinel.correlation;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import com.z254.netwatch.sentinel.domain.model.Modality;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cross-modal event correlator.
 * <p>
 * Groups anomaly events per device into time windows of configurable length and decides
 * when a window becomes an incident:
 * <ul>
 *     <li>as soon as two modalities agree above the confidence floor (returned from {@link #ingest})</li>
 *     <li>again, as a new revision, when a further modality above the floor joins a confirmed window</li>
 *     <li>at window close, for single-modality windows whose best confidence reaches the floor</li>
 * </ul>
 * Windows closed while ingesting are queued and collected with {@link #drainClosed()}.
 * All state is owned by the instance; public operations are serialized on it.
 */
@Slf4j
@Component
public class EventCorrelator {

    private static final double MULTI_MODAL_BOOST = 1.3;

    private final double windowSeconds;
    private final double minConfidence;
    private final double singleModalityDiscount;
    private final int maxEventsPerDevice;
    private final int maxTrackedDevices;
    private final int maxPendingEmissions;

    private final Map<String, DeviceWindow> windows = new HashMap<>();
    private final Deque<CorrelatedEvent> pending = new ArrayDeque<>();

    private final Map<Modality, AtomicLong> eventsByModality = new EnumMap<>(Modality.class);
    private final AtomicLong correlated = new AtomicLong();
    private final AtomicLong multiModalConfirmations = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();
    private final AtomicLong lateDropped = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong pendingDropped = new AtomicLong();

    public EventCorrelator(SentinelProperties properties) {
        SentinelProperties.Correlation config = properties.getCorrelation();
        this.windowSeconds = config.getWindow().toMillis() / 1000.0;
        this.minConfidence = config.getMinCorrelationConfidence();
        this.singleModalityDiscount = config.getSingleModalityDiscount();
        this.maxEventsPerDevice = config.getMaxEventsPerDevice();
        this.maxTrackedDevices = config.getMaxTrackedDevices();
        this.maxPendingEmissions = config.getMaxPendingEmissions();
        for (Modality modality : Modality.values()) {
            eventsByModality.put(modality, new AtomicLong());
        }
        log.info("Event correlator configured: window={}s, minConfidence={}, discount={}",
                windowSeconds, minConfidence, singleModalityDiscount);
    }

    /**
     * Add one event to its device window.
     *
     * @return the correlated event when this event confirms the window across modalities,
     *         or adds a modality to an already confirmed window
     * @throws InvalidSignalException if the event is malformed
     */
    public synchronized Optional<CorrelatedEvent> ingest(AnomalyEvent event) {
        validate(event);

        String device = event.getDevice();
        DeviceWindow window = windows.get(device);
        if (window == null) {
            countAccepted(event);
            openWindow(device, event);
            return evaluate(windows.get(device));
        }

        return switch (window.admit(event)) {
            case JOINED -> {
                countAccepted(event);
                yield evaluate(window);
            }
            case BEYOND_WINDOW -> {
                countAccepted(event);
                yield reopen(window, event);
            }
            case LATE -> {
                lateDropped.incrementAndGet();
                log.debug("Dropped late {} event for {} at {} (window starts {})",
                        event.getModality().getWireName(), device, event.getTimestamp(), window.getWindowStart());
                yield Optional.empty();
            }
        };
    }

    /**
     * Close every window whose end lies before {@code now} (epoch seconds).
     */
    public synchronized List<CorrelatedEvent> expire(double now) {
        List<CorrelatedEvent> emitted = new ArrayList<>();
        Iterator<DeviceWindow> it = windows.values().iterator();
        while (it.hasNext()) {
            DeviceWindow window = it.next();
            if (window.isExpired(now)) {
                it.remove();
                close(window).ifPresent(emitted::add);
            }
        }
        emitted.sort(Comparator.comparingDouble(CorrelatedEvent::getWindowStart));
        return emitted;
    }

    /**
     * Correlated events of windows closed by later traffic or by device eviction.
     */
    public synchronized List<CorrelatedEvent> drainClosed() {
        List<CorrelatedEvent> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    /**
     * Close all open windows regardless of age; used at shutdown.
     * Includes anything still queued by {@link #drainClosed()}.
     */
    public synchronized List<CorrelatedEvent> flush() {
        List<CorrelatedEvent> emitted = drainClosed();
        List<DeviceWindow> open = new ArrayList<>(windows.values());
        windows.clear();
        open.sort(Comparator.comparingDouble(DeviceWindow::getWindowStart));
        for (DeviceWindow window : open) {
            close(window).ifPresent(emitted::add);
        }
        if (!emitted.isEmpty()) {
            log.info("Flushed {} correlated events from open windows", emitted.size());
        }
        return emitted;
    }

    /**
     * Record an event that failed validation upstream of the correlator.
     */
    public void recordRejected() {
        rejected.incrementAndGet();
    }

    public synchronized CorrelationStatistics getStatistics() {
        Map<Modality, Long> totals = new EnumMap<>(Modality.class);
        eventsByModality.forEach((m, count) -> totals.put(m, count.get()));

        Map<Modality, Long> open = new EnumMap<>(Modality.class);
        for (Modality modality : Modality.values()) {
            open.put(modality, 0L);
        }
        for (DeviceWindow window : windows.values()) {
            window.getEvents().forEach(e -> open.merge(e.getModality(), 1L, Long::sum));
        }

        long total = totals.values().stream().mapToLong(Long::longValue).sum();
        long correlatedCount = correlated.get();
        long multiModal = multiModalConfirmations.get();

        return CorrelationStatistics.builder()
                .eventsByModality(Map.copyOf(totals))
                .openEventsByModality(Map.copyOf(open))
                .totalEvents(total)
                .correlated(correlatedCount)
                .multiModalConfirmations(multiModal)
                .suppressed(suppressed.get())
                .lateDropped(lateDropped.get())
                .rejected(rejected.get())
                .pendingDropped(pendingDropped.get())
                .openWindows(windows.size())
                .correlationRate((double) correlatedCount / Math.max(1L, total))
                .multiModalRate((double) multiModal / Math.max(1L, correlatedCount))
                .build();
    }

    public synchronized int getOpenWindowCount() {
        return windows.size();
    }

    /**
     * Drop all windows, queued emissions and counters.
     */
    public synchronized void reset() {
        windows.clear();
        pending.clear();
        eventsByModality.values().forEach(c -> c.set(0));
        correlated.set(0);
        multiModalConfirmations.set(0);
        suppressed.set(0);
        lateDropped.set(0);
        rejected.set(0);
        pendingDropped.set(0);
    }

    private void countAccepted(AnomalyEvent event) {
        eventsByModality.get(event.getModality()).incrementAndGet();
    }

    private Optional<CorrelatedEvent> reopen(DeviceWindow window, AnomalyEvent event) {
        windows.remove(window.getDevice());
        close(window).ifPresent(this::enqueue);
        openWindow(window.getDevice(), event);
        return evaluate(windows.get(window.getDevice()));
    }

    private void openWindow(String device, AnomalyEvent event) {
        if (windows.size() >= maxTrackedDevices) {
            windows.values().stream()
                    .min(Comparator.comparingDouble(DeviceWindow::getWindowStart))
                    .ifPresent(oldest -> {
                        windows.remove(oldest.getDevice());
                        log.warn("Tracked device limit {} reached; closing window of {}",
                                maxTrackedDevices, oldest.getDevice());
                        close(oldest).ifPresent(this::enqueue);
                    });
        }
        windows.put(device, new DeviceWindow(device, event, windowSeconds, maxEventsPerDevice));
    }

    /**
     * Emit when the window is confirmed across modalities for the first time, or when a
     * confirmed window gains a modality above the floor.
     */
    private Optional<CorrelatedEvent> evaluate(DeviceWindow window) {
        Map<Modality, Double> best = window.bestConfidenceByModality();
        if (!isConfirmed(best)) {
            return Optional.empty();
        }
        Set<Modality> modalities = qualifying(best).keySet();
        if (window.isEmitted() && window.getEmittedModalities().containsAll(modalities)) {
            return Optional.empty();
        }
        if (!window.isEmitted()) {
            correlated.incrementAndGet();
            multiModalConfirmations.incrementAndGet();
        }
        int revision = window.nextRevision(modalities);
        CorrelatedEvent result = build(window, best, revision);
        log.debug("Window {} confirmed by {} (revision {})", result.getId(), modalities, revision);
        return Optional.of(result);
    }

    /**
     * Final decision for a window leaving the correlator.
     */
    private Optional<CorrelatedEvent> close(DeviceWindow window) {
        if (window.isEmitted()) {
            return Optional.empty();
        }
        if (window.maxConfidence() < minConfidence) {
            suppressed.incrementAndGet();
            log.debug("Suppressed uncorrelated window for {} (best confidence {})",
                    window.getDevice(), window.maxConfidence());
            return Optional.empty();
        }
        correlated.incrementAndGet();
        int revision = window.nextRevision(window.modalities());
        return Optional.of(build(window, window.bestConfidenceByModality(), revision));
    }

    private void enqueue(CorrelatedEvent event) {
        if (pending.size() >= maxPendingEmissions) {
            CorrelatedEvent dropped = pending.pollFirst();
            pendingDropped.incrementAndGet();
            log.warn("Pending emission queue full ({}); dropped {}", maxPendingEmissions,
                    dropped != null ? dropped.getId() : "none");
        }
        pending.addLast(event);
    }

    private boolean isConfirmed(Map<Modality, Double> best) {
        return qualifying(best).size() >= 2;
    }

    /**
     * Modalities whose best confidence reaches the floor.
     */
    private Map<Modality, Double> qualifying(Map<Modality, Double> best) {
        Map<Modality, Double> above = new EnumMap<>(Modality.class);
        best.forEach((modality, confidence) -> {
            if (confidence >= minConfidence) {
                above.put(modality, confidence);
            }
        });
        return above;
    }

    private CorrelatedEvent build(DeviceWindow window, Map<Modality, Double> best, int revision) {
        List<AnomalyEvent> events = new ArrayList<>(window.getEvents());
        events.sort(Comparator.comparingDouble(AnomalyEvent::getTimestamp));

        boolean multiModal = isConfirmed(best);
        double maxConfidence = window.maxConfidence();
        double strength = multiModal ? 1.0 : maxConfidence * singleModalityDiscount;

        AnomalyEvent primary = events.stream()
                .max(Comparator.comparingDouble(AnomalyEvent::getConfidence)
                        .thenComparing(AnomalyEvent::hasInterface))
                .orElseThrow();
        String primaryInterface = primary.hasInterface()
                ? primary.getInterfaceName()
                : events.stream()
                        .filter(AnomalyEvent::hasInterface)
                        .max(Comparator.comparingDouble(AnomalyEvent::getConfidence))
                        .map(AnomalyEvent::getInterfaceName)
                        .orElse(null);
        String primaryPeer = events.stream()
                .filter(e -> e.getModality() == Modality.BGP && e.hasPeer())
                .findFirst()
                .map(AnomalyEvent::getBgpPeer)
                .orElse(null);

        Set<String> detectedSeries = new LinkedHashSet<>();
        events.forEach(e -> detectedSeries.addAll(e.getDetectedSeries()));

        // weak modalities do not dilute a confirmed window
        Map<Modality, Double> blended = multiModal ? qualifying(best) : best;
        double mean = blended.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double boosted = multiModal ? Math.min(mean * MULTI_MODAL_BOOST, 1.0) : mean;
        double combined = boosted * (0.7 + 0.3 * strength);

        long start = (long) Math.floor(window.getWindowStart());
        return CorrelatedEvent.builder()
                .id("corr-" + window.getDevice() + "-" + start)
                .revision(revision)
                .windowStart(window.getWindowStart())
                .windowEnd(window.getLatestTimestamp())
                .modalities(Set.copyOf(best.keySet()))
                .multiModal(multiModal)
                .correlationStrength(strength)
                .primaryDevice(window.getDevice())
                .primaryInterface(primaryInterface)
                .primaryPeer(primaryPeer)
                .confidence(maxConfidence)
                .combinedConfidence(combined)
                .detectedSeries(Set.copyOf(detectedSeries))
                .events(List.copyOf(events))
                .eventCount(events.size())
                .build();
    }

    private void validate(AnomalyEvent event) {
        String reason = null;
        if (event == null) {
            reason = "event is null";
        } else if (event.getDevice() == null || event.getDevice().isBlank()) {
            reason = "device is required";
        } else if (event.getModality() == null) {
            reason = "modality is required";
        } else if (!Double.isFinite(event.getTimestamp()) || event.getTimestamp() < 0) {
            reason = "invalid timestamp " + event.getTimestamp();
        } else if (!(event.getConfidence() >= 0.0 && event.getConfidence() <= 1.0)) {
            reason = "confidence " + event.getConfidence() + " outside [0, 1]";
        }
        if (reason != null) {
            rejected.incrementAndGet();
            throw new InvalidSignalException("anomaly-event", reason);
        }
    }
}
