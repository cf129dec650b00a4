package org.foxesworld.glowframe.engine.peripheral.bus;

import org.foxesworld.glowframe.engine.peripheral.Input;

import java.util.List;

/**
 * Outcome of one dispatch.
 *
 * @param delivered number of handlers that completed normally
 * @param failures  handlers that threw; their errors were logged and not rethrown
 */
public record DispatchReport(Input event, int delivered, List<HandlerFailure> failures) {

    public DispatchReport {
        failures = List.copyOf(failures);
    }

    public boolean ok() {
        return failures.isEmpty();
    }
}
