package org.foxesworld.glowframe.engine.peripheral;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Discovers peripherals and runs each on its own daemon worker.
 */
public final class PeripheralManager implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(PeripheralManager.class);

    public static final long DEFAULT_JOIN_TIMEOUT_MS = 2_000;

    private final PeripheralOutput output;
    private final long joinTimeoutMs;
    private final List<PeripheralDetector> detectors = new CopyOnWriteArrayList<>();
    private final List<Peripheral> peripherals = new CopyOnWriteArrayList<>();
    private final Map<Peripheral, Thread> workers = new LinkedHashMap<>();

    private boolean started;
    private boolean closed;

    public PeripheralManager(PeripheralOutput output) {
        this(output, DEFAULT_JOIN_TIMEOUT_MS);
    }

    public PeripheralManager(PeripheralOutput output, long joinTimeoutMs) {
        this.output = Objects.requireNonNull(output, "output");
        if (joinTimeoutMs < 0) throw new IllegalArgumentException("joinTimeoutMs must be >= 0: " + joinTimeoutMs);
        this.joinTimeoutMs = joinTimeoutMs;
    }

    /** Detectors registered through {@link ServiceLoader}. */
    public static List<PeripheralDetector> serviceDetectors() {
        List<PeripheralDetector> out = new ArrayList<>();
        for (PeripheralDetector d : ServiceLoader.load(PeripheralDetector.class)) {
            out.add(d);
            log.info("PeripheralDetector registered: {}", d.getClass().getName());
        }
        return out;
    }

    public void addDetector(PeripheralDetector detector) {
        detectors.add(Objects.requireNonNull(detector, "detector"));
    }

    /** Run every detector once and register what it finds. A failing detector is skipped. */
    public int detect() {
        int found = 0;
        for (PeripheralDetector d : detectors) {
            Iterable<? extends Peripheral> result;
            try {
                result = d.detect();
            } catch (RuntimeException e) {
                log.error("Peripheral detection failed: {}", d.getClass().getName(), e);
                continue;
            }
            if (result == null) continue;
            for (Peripheral p : result) {
                register(p);
                found++;
            }
        }
        return found;
    }

    public void register(Peripheral peripheral) {
        Objects.requireNonNull(peripheral, "peripheral");
        synchronized (workers) {
            if (closed) throw new IllegalStateException("PeripheralManager is closed");
            peripherals.add(peripheral);
            log.debug("Peripheral registered: {}", peripheral.name());
            if (started) startWorker(peripheral);
        }
    }

    public void start() {
        synchronized (workers) {
            if (closed) throw new IllegalStateException("PeripheralManager is closed");
            if (started) return;
            started = true;
            for (Peripheral p : peripherals) startWorker(p);
            log.info("Peripheral workers started: {}", peripherals.size());
        }
    }

    public List<Peripheral> peripherals() {
        return Collections.unmodifiableList(peripherals);
    }

    public boolean isRunning(Peripheral peripheral) {
        synchronized (workers) {
            Thread t = workers.get(peripheral);
            return t != null && t.isAlive();
        }
    }

    private void startWorker(Peripheral p) {
        Thread t = new Thread(() -> runPeripheral(p), "glowframe-peripheral-" + p.name());
        t.setDaemon(true);
        workers.put(p, t);
        t.start();
    }

    private void runPeripheral(Peripheral p) {
        try {
            p.run(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Peripheral {} stopped with an error", p.name(), e);
        }
    }

    /** Interrupt every worker, wait up to the join timeout for each, then close the peripherals. */
    @Override
    public void close() {
        List<Map.Entry<Peripheral, Thread>> running;
        synchronized (workers) {
            if (closed) return;
            closed = true;
            running = new ArrayList<>(workers.entrySet());
            workers.clear();
        }

        for (Map.Entry<Peripheral, Thread> e : running) e.getValue().interrupt();

        for (Map.Entry<Peripheral, Thread> e : running) {
            try {
                e.getValue().join(joinTimeoutMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
            if (e.getValue().isAlive()) {
                log.warn("Peripheral {} did not stop within {} ms", e.getKey().name(), joinTimeoutMs);
            }
        }

        for (Peripheral p : peripherals) {
            try {
                p.close();
            } catch (RuntimeException ex) {
                log.error("Peripheral {} close failed", p.name(), ex);
            }
        }
        log.info("Peripheral workers stopped: {}", running.size());
    }
}
