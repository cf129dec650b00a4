package org.foxesworld.glowframe.engine;

import org.foxesworld.glowframe.core.SettingsReader;
import org.foxesworld.glowframe.engine.loop.FrameSink;
import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.Payloads;
import org.foxesworld.glowframe.engine.peripheral.virtual.VirtualPeripherals;
import org.foxesworld.glowframe.engine.render.Orientation;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.StatelessRenderer;
import org.foxesworld.glowframe.engine.render.plan.RendererVariant;
import org.foxesworld.glowframe.engine.render.surface.Surface;
import org.foxesworld.glowframe.engine.render.surface.SurfaceSize;
import org.foxesworld.glowframe.engine.stream.ShareStrategy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlowframeRuntimeTest {

    private final List<Surface> frames = new ArrayList<>();
    private final FrameSink sink = frame -> frames.add(frame == null ? null : frame.copy());

    private GlowframeRuntime runtime(Map<String, String> settings) {
        return new GlowframeRuntime(SettingsReader.of(settings), new SurfaceSize(4, 4), Orientation.single(), sink);
    }

    @Test
    void settingsAreResolvedAtStartup() {
        try (GlowframeRuntime rt = runtime(Map.of(
                "glowframe.render.variant", "binary",
                "glowframe.stream.share.strategy", "share"))) {
            assertEquals(RendererVariant.BINARY, rt.pipeline().settings().variant());
            assertEquals(ShareStrategy.SHARE, rt.streamSettings().strategy());
        }
    }

    @Test
    void invalidSettingFailsFast() {
        assertThrows(IllegalArgumentException.class, () -> runtime(Map.of("glowframe.render.max.workers", "0")));
    }

    @Test
    void postedEventsReachRenderersThroughTheLoop() throws Exception {
        try (GlowframeRuntime rt = runtime(Map.of())) {
            List<Object> seen = new ArrayList<>();
            rt.bus().subscribe("button.press.double", e -> seen.add(e.eventType()));
            rt.virtualPeripherals().register(VirtualPeripherals.doubleTap("button.press", "button.press.double"));

            Renderer r = new StatelessRenderer("fill", (s, o) -> s.setPixel(0, 0, 0xFFFFFFFF));
            rt.addRenderer(r);

            rt.bus().post(Input.of("button.press", Map.of("pressed", true), 1));
            rt.bus().post(Input.of("button.press", Map.of("pressed", true), 1));
            assertTrue(rt.loop().tick());

            assertEquals(List.of("button.press.double"), seen);
            assertEquals(0xFFFFFFFF, frames.get(0).pixel(0, 0));
            assertTrue(Payloads.truthy(rt.bus().states().getLatest("button.press", 1).data()));

            assertTrue(rt.removeRenderer(r));
            assertFalse(r.isInitialized());
            assertTrue(rt.renderers().isEmpty());
        }
    }
}
