package org.foxesworld.glowframe.engine.render.pipeline;

import org.foxesworld.glowframe.engine.peripheral.bus.EventBus;
import org.foxesworld.glowframe.engine.render.Orientation;
import org.foxesworld.glowframe.engine.render.RenderContext;
import org.foxesworld.glowframe.engine.render.RenderFrameException;
import org.foxesworld.glowframe.engine.render.RenderSettings;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.StatelessRenderer;
import org.foxesworld.glowframe.engine.render.plan.MergeStrategy;
import org.foxesworld.glowframe.engine.render.plan.RendererVariant;
import org.foxesworld.glowframe.engine.render.surface.SurfaceSize;
import org.foxesworld.glowframe.engine.render.timing.RendererTimingTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenderPipelineTest {

    private static final SurfaceSize WINDOW = new SurfaceSize(16, 16);

    private final List<RenderPipeline> pipelines = new ArrayList<>();

    @AfterEach
    void tearDown() {
        pipelines.forEach(RenderPipeline::shutdown);
    }

    private RenderPipeline pipeline(RenderSettings settings) {
        EventBus bus = new EventBus();
        RenderContext ctx = new RenderContext(bus, bus.states(), Orientation.single(), WINDOW);
        RenderPipeline p = new RenderPipeline(settings.withMaxWorkers(3), new RendererTimingTracker(), ctx);
        pipelines.add(p);
        return p;
    }

    /** Renderer i fills row i and column i with an opaque colour. */
    private static List<Renderer> stripes(int n) {
        List<Renderer> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int idx = i;
            int color = 0xFF000000 | (40 * (i + 1)) << 8;
            out.add(new StatelessRenderer("stripe-" + i, (s, o) -> {
                for (int k = 0; k < s.width(); k++) {
                    s.setPixel(k, idx, color);
                    s.setPixel(idx, k, color);
                }
            }));
        }
        return out;
    }

    @Test
    void serialAndParallelVariantsProduceTheSameFrame() {
        RenderPipeline serial = pipeline(RenderSettings.defaults().withVariant(RendererVariant.ITERATIVE));
        RenderPipeline parallel = pipeline(RenderSettings.defaults().withVariant(RendererVariant.BINARY)
                .withMergeStrategy(MergeStrategy.IN_PLACE));

        RenderResult a = serial.render(stripes(5));
        RenderResult b = parallel.render(stripes(5));

        assertFalse(a.plan().parallel());
        assertTrue(b.plan().parallel());
        assertTrue(a.surface().contentEquals(b.surface()));
    }

    @Test
    void batchedAndCachedCompositionMatchInPlace() {
        RenderPipeline inPlace = pipeline(RenderSettings.defaults().withMergeStrategy(MergeStrategy.IN_PLACE));
        RenderPipeline batched = pipeline(RenderSettings.defaults().withMergeStrategy(MergeStrategy.BATCHED)
                .withCaches(true, true));

        RenderResult a = inPlace.render(stripes(4));
        RenderResult b = batched.render(stripes(4));

        assertEquals(MergeStrategy.BATCHED, b.plan().mergeStrategy());
        assertTrue(a.surface().contentEquals(b.surface()));
    }

    @Test
    void renderersAreInitializedAndTimed() {
        RenderPipeline p = pipeline(RenderSettings.defaults());
        List<Renderer> renderers = stripes(2);

        p.render(renderers);

        assertTrue(renderers.get(0).isInitialized());
        assertNotNull(p.timings().get("stripe-0"));
        assertNotNull(p.timings().get("stripe-1"));
    }

    @Test
    void overrideSelectsVariantForOneFrame() {
        RenderPipeline p = pipeline(RenderSettings.defaults());

        assertEquals(RendererVariant.BINARY, p.render(stripes(2), RendererVariant.BINARY).plan().variant());
        assertEquals(RendererVariant.ITERATIVE, p.render(stripes(2)).plan().variant());
    }

    @Test
    void rendererFailurePropagatesWithItsName() {
        RenderPipeline p = pipeline(RenderSettings.defaults().withVariant(RendererVariant.BINARY));
        List<Renderer> renderers = new ArrayList<>(stripes(2));
        renderers.add(new StatelessRenderer("broken", (s, o) -> {
            throw new IllegalStateException("no data");
        }));

        RenderFrameException e = assertThrows(RenderFrameException.class, () -> p.render(renderers));
        assertEquals("broken", e.rendererName());
    }

    @Test
    void emptyRendererListRendersNothing() {
        assertNull(pipeline(RenderSettings.defaults()).render(List.of()).surface());
    }

    @Test
    void renderAfterShutdownIsRejected() {
        RenderPipeline p = pipeline(RenderSettings.defaults());
        p.shutdown();

        assertThrows(IllegalStateException.class, () -> p.render(stripes(1)));
    }

    @Test
    void resetReturnsRendererToUninitialized() {
        RenderPipeline p = pipeline(RenderSettings.defaults().withCaches(true, false));
        List<Renderer> renderers = stripes(1);
        p.render(renderers);

        p.reset(renderers.get(0));

        assertFalse(renderers.get(0).isInitialized());
    }
}
