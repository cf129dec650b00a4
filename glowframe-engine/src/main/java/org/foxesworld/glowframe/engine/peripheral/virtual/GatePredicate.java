package org.foxesworld.glowframe.engine.peripheral.virtual;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;

import java.util.Map;

@FunctionalInterface
public interface GatePredicate {

    boolean test(VirtualPeripheralContext context, Input event);

    /**
     * Reads {@code pressed}, {@code state}, {@code enabled} or {@code value} from a map payload,
     * first key found wins; otherwise the truthiness of the payload itself.
     */
    GatePredicate DEFAULT = (context, event) -> {
        Object data = event.data();
        if (data instanceof Map<?, ?> m) {
            for (String key : new String[]{"pressed", "state", "enabled", "value"}) {
                if (m.containsKey(key)) return Payloads.truthy(m.get(key));
            }
        }
        return Payloads.truthy(data);
    };
}
