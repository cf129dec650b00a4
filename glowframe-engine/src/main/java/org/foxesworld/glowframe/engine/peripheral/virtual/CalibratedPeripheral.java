package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites sensor payloads through a {@link CalibrationProfile} per source event type.
 */
final class CalibratedPeripheral implements VirtualPeripheral {

    private static final Logger log = LogManager.getLogger(CalibratedPeripheral.class);

    private final VirtualPeripheralContext ctx;
    private final Map<String, CalibrationProfile> calibrations;
    private final Map<String, String> outputEventTypes;
    private final Integer outputProducerId;
    private final Map<String, List<String>> passthroughFields;
    private final boolean includeSourceEvent;
    private final boolean includeRawPayload;

    CalibratedPeripheral(VirtualPeripheralContext ctx,
                         Map<String, CalibrationProfile> calibrations,
                         Map<String, String> outputEventTypes,
                         Integer outputProducerId,
                         Map<String, List<String>> passthroughFields,
                         boolean includeSourceEvent,
                         boolean includeRawPayload) {
        this.ctx = ctx;
        this.calibrations = Map.copyOf(calibrations);
        this.outputEventTypes = Map.copyOf(outputEventTypes);
        this.outputProducerId = outputProducerId;
        this.passthroughFields = Map.copyOf(passthroughFields);
        this.includeSourceEvent = includeSourceEvent;
        this.includeRawPayload = includeRawPayload;
    }

    @Override
    public void handle(Input event) {
        CalibrationProfile profile = calibrations.get(event.eventType());
        if (profile == null) return;
        if (!(event.data() instanceof Map)) {
            log.debug("Calibration peripheral {} received non-map payload for {}", ctx.definition().name(), event.eventType());
            return;
        }
        Map<String, Object> data = Payloads.asMap(event.data());
        // our own output routed back when the output type equals the source type
        Object origin = Payloads.asMap(data.get(VirtualPeripheralContext.DESCRIPTOR_KEY)).get("id");
        if (ctx.handle().id().equals(origin)) return;

        Map<String, Double> corrected;
        try {
            corrected = profile.apply(data);
        } catch (RuntimeException e) {
            log.error("Calibration peripheral {} failed to calibrate event {}", ctx.definition().name(), event.eventType(), e);
            return;
        }

        Map<String, Object> payload = new LinkedHashMap<>(corrected);
        for (String field : passthroughFields.getOrDefault(event.eventType(), List.of())) {
            if (data.containsKey(field) && !payload.containsKey(field)) payload.put(field, data.get(field));
        }
        if (includeRawPayload) payload.putIfAbsent("raw", data);
        payload.putIfAbsent("calibration", profile.describe());
        if (includeSourceEvent) payload.putIfAbsent("source_event", Payloads.describe(event));

        String type = outputEventTypes.getOrDefault(event.eventType(), event.eventType());
        int producer = (outputProducerId != null) ? outputProducerId : event.producerId();
        ctx.emit(type, payload, producer);
    }
}
