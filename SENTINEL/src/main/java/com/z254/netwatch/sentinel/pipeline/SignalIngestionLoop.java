package com.z254.netwatch.sentinel.pipeline;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.FeatureBin;
import com.z254.netwatch.sentinel.domain.model.FeatureVector;
import com.z254.netwatch.sentinel.observability.SentinelMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.concurrent.Queues;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-threaded event loop in front of the {@link AnomalyPipeline}.
 * <p>
 * Producers submit from any thread into a bounded queue; one scheduler thread drains it,
 * interleaved with a periodic window-expiry tick. A full queue rejects the submission
 * instead of blocking the producer. Stopping completes the queue, drains what is left and
 * flushes all open correlation windows.
 */
@Slf4j
@Component
public class SignalIngestionLoop {

    private final AnomalyPipeline pipeline;
    private final SentinelMetrics metrics;
    private final Clock clock;
    private final SentinelProperties.Pipeline config;

    private final Sinks.Many<InboundSignal> inbound;
    private final Sinks.Empty<Void> stopSignal = Sinks.empty();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicInteger queued = new AtomicInteger();

    private Scheduler scheduler;
    private Disposable subscription;
    private volatile boolean running;

    public SignalIngestionLoop(AnomalyPipeline pipeline,
                               SentinelMetrics metrics,
                               Clock clock,
                               SentinelProperties properties) {
        this.pipeline = pipeline;
        this.metrics = metrics;
        this.clock = clock;
        this.config = properties.getPipeline();
        this.inbound = Sinks.many().unicast()
                .onBackpressureBuffer(Queues.<InboundSignal>get(config.getQueueCapacity()).get());
    }

    @PostConstruct
    void autoStart() {
        if (config.isAutoStart()) {
            start();
        }
    }

    /**
     * Start draining the queue. Idempotent.
     */
    public synchronized void start() {
        if (running || subscription != null) {
            return;
        }
        scheduler = Schedulers.newSingle("sentinel-ingest");

        Flux<InboundSignal> ticks = Flux.interval(config.getSweepInterval(), scheduler)
                .map(i -> InboundSignal.tick(clock.millis() / 1000.0))
                .takeUntilOther(stopSignal.asMono());

        subscription = Flux.merge(inbound.asFlux(), ticks)
                .publishOn(scheduler)
                .subscribe(this::dispatch,
                        error -> {
                            log.error("Ingestion loop terminated with error: {}", error.getMessage(), error);
                            terminated.countDown();
                        },
                        () -> {
                            pipeline.flush();
                            log.info("Ingestion loop drained and flushed");
                            terminated.countDown();
                        });
        running = true;
        log.info("Ingestion loop started: queueCapacity={}, sweepInterval={}",
                config.getQueueCapacity(), config.getSweepInterval());
    }

    public boolean submit(AnomalyEvent event) {
        return offer(InboundSignal.event(event));
    }

    public boolean submitRoutingBin(FeatureBin bin) {
        return offer(InboundSignal.routingBin(bin));
    }

    public boolean submitHealthSample(FeatureVector sample) {
        return offer(InboundSignal.healthSample(sample));
    }

    /**
     * Complete the queue, wait for it to drain and flush open windows.
     *
     * @return true if the loop terminated within the configured shutdown timeout
     */
    @PreDestroy
    public boolean stop() {
        synchronized (this) {
            if (!running) {
                return true;
            }
            running = false;
            stopSignal.tryEmitEmpty();
            inbound.tryEmitComplete();
        }

        boolean drained;
        try {
            drained = terminated.await(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            log.warn("Ingestion loop did not drain within {}", config.getShutdownTimeout());
            subscription.dispose();
        }
        scheduler.dispose();
        return drained;
    }

    public boolean isRunning() {
        return running;
    }

    public int getQueuedCount() {
        return queued.get();
    }

    // ========== Private Methods ==========

    private synchronized boolean offer(InboundSignal signal) {
        if (!running) {
            log.debug("Ingestion loop not running; rejecting {}", signal.getKind());
            return false;
        }
        Sinks.EmitResult result = inbound.tryEmitNext(signal);
        if (result.isSuccess()) {
            metrics.setQueueDepth(queued.incrementAndGet());
            return true;
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            metrics.recordDropped();
            log.warn("Inbound queue full ({}); dropping {}", config.getQueueCapacity(), signal.getKind());
        } else {
            log.warn("Could not enqueue {}: {}", signal.getKind(), result);
        }
        return false;
    }

    private void dispatch(InboundSignal signal) {
        if (signal.getKind() != InboundSignal.Kind.TICK) {
            metrics.setQueueDepth(queued.decrementAndGet());
        }
        try {
            switch (signal.getKind()) {
                case EVENT -> pipeline.process((AnomalyEvent) signal.getPayload());
                case ROUTING_BIN -> pipeline.processRoutingBin((FeatureBin) signal.getPayload());
                case HEALTH_SAMPLE -> pipeline.processHealthSample((FeatureVector) signal.getPayload());
                case TICK -> pipeline.expire(signal.getTickTime());
            }
        } catch (RuntimeException e) {
            log.error("Failed to process {} signal: {}", signal.getKind(), e.getMessage(), e);
        }
    }
}
