package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits when one producer fires the matchers in order. A gap longer than the timeout restarts
 * the sequence; a non-matching event restarts it too, counting the event as a first step when
 * it matches one.
 */
final class SequencePeripheral implements VirtualPeripheral {

    private record Progress(int index, long lastNanos, List<Input> history) {}

    private final VirtualPeripheralContext ctx;
    private final List<SequenceMatcher> matchers;
    private final long timeoutNanos;
    private final String outputEventType;
    private final Map<Integer, Progress> progress = new HashMap<>();

    /**
     * @param timeoutNanos 0 disables the timeout
     */
    SequencePeripheral(VirtualPeripheralContext ctx, List<SequenceMatcher> matchers, long timeoutNanos, String outputEventType) {
        if (matchers.isEmpty()) throw new IllegalArgumentException("matchers cannot be empty");
        if (timeoutNanos < 0) throw new IllegalArgumentException("timeout must be positive when provided");
        this.ctx = ctx;
        this.matchers = List.copyOf(matchers);
        this.timeoutNanos = timeoutNanos;
        this.outputEventType = outputEventType;
    }

    @Override
    public void handle(Input event) {
        long now = ctx.monotonicNanos();
        Progress state = progress.get(event.producerId());
        int index = 0;
        List<Input> history = List.of();

        if (state != null) {
            index = state.index();
            history = state.history();
            if (timeoutNanos > 0 && now - state.lastNanos() > timeoutNanos) {
                index = 0;
                history = List.of();
            }
        }

        if (matches(index, event)) {
            List<Input> next = new ArrayList<>(history);
            next.add(event);
            if (index + 1 == matchers.size()) {
                progress.remove(event.producerId());
                List<Object> described = new ArrayList<>(next.size());
                for (Input e : next) described.add(Payloads.describe(e));
                ctx.emit(outputEventType, Map.of("sequence", described), event.producerId());
            } else {
                progress.put(event.producerId(), new Progress(index + 1, now, next));
            }
            return;
        }

        if (matches(0, event)) {
            progress.put(event.producerId(), new Progress(1, now, List.of(event)));
        } else {
            progress.remove(event.producerId());
        }
    }

    private boolean matches(int index, Input event) {
        return index < matchers.size() && matchers.get(index).matches(event);
    }

    @Override
    public void shutdown() {
        progress.clear();
    }
}
