package com.example.chatsync.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.TimeUnit;

/**
 * Probes the channel every interval and expects inbound traffic of any kind
 * within the timeout of each probe. After {@code maxMisses} consecutive silent
 * probes it stops itself and reports the channel dead, once.
 * <p>
 * Callbacks run outside this monitor's lock.
 */
public class LivenessMonitor {

    private static final Logger logger = LoggerFactory.getLogger(LivenessMonitor.class);

    private final Scheduler scheduler;
    private final long intervalMs;
    private final long timeoutMs;
    private final int maxMisses;
    private final Runnable sendProbe;
    private final Runnable onDead;

    private Disposable probeTask;
    private Disposable timeoutTask;
    private int missed;
    private boolean inboundSinceProbe;
    private boolean running;
    private boolean signaled;

    public LivenessMonitor(Scheduler scheduler, long intervalMs, long timeoutMs, int maxMisses,
                           Runnable sendProbe, Runnable onDead) {
        this.scheduler = scheduler;
        this.intervalMs = intervalMs;
        this.timeoutMs = timeoutMs;
        this.maxMisses = maxMisses;
        this.sendProbe = sendProbe;
        this.onDead = onDead;
    }

    public synchronized void start() {
        if (running || signaled) return;
        running = true;
        missed = 0;
        probeTask = scheduler.schedulePeriodically(this::probe, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void recordInbound() {
        inboundSinceProbe = true;
        missed = 0;
    }

    public synchronized void stop() {
        running = false;
        if (probeTask != null) probeTask.dispose();
        if (timeoutTask != null) timeoutTask.dispose();
        probeTask = null;
        timeoutTask = null;
    }

    public synchronized int getMissed() {
        return missed;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private void probe() {
        synchronized (this) {
            if (!running) return;
            inboundSinceProbe = false;
            if (timeoutTask != null) timeoutTask.dispose();
            timeoutTask = scheduler.schedule(this::checkAck, timeoutMs, TimeUnit.MILLISECONDS);
        }
        sendProbe.run();
    }

    private void checkAck() {
        synchronized (this) {
            if (!running || inboundSinceProbe) return;
            missed++;
            logger.debug("Heartbeat missed ({}/{})", missed, maxMisses);
            if (missed < maxMisses) return;
            stop();
            signaled = true;
        }
        logger.warn("No inbound traffic after {} heartbeats, channel considered dead", maxMisses);
        onDead.run();
    }
}
