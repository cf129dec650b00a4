package org.foxesworld.glowframe.engine.render.state;

import org.foxesworld.glowframe.engine.peripheral.Input;
import org.foxesworld.glowframe.engine.peripheral.bus.Subscription;
import org.foxesworld.glowframe.engine.render.DisplayMode;
import org.foxesworld.glowframe.engine.render.Orientation;
import org.foxesworld.glowframe.engine.render.RenderContext;
import org.foxesworld.glowframe.engine.render.Renderer;
import org.foxesworld.glowframe.engine.render.surface.Surface;
import org.foxesworld.glowframe.engine.stream.SharedStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Renderer whose frames are drawn from an immutable state snapshot.
 *
 * <p>The first snapshot comes from an upstream stream, an initial-state factory, or both (the
 * factory then acts as fallback). Bus events of the configured types are folded in through a
 * {@link StateReducer}.</p>
 */
public final class SnapshotRenderer<S> implements Renderer {

    private final String name;
    private final DisplayMode displayMode;
    private final SnapshotPainter<S> painter;
    private final Function<RenderContext, ? extends S> initialState;
    private final Function<RenderContext, ? extends SharedStream<? extends S>> stateStream;
    private final StateReducer<S> reducer;
    private final List<String> reduceOn;

    private final StateHolder<S> state = new StateHolder<>();
    private final List<Subscription> busSubscriptions = new ArrayList<>();
    private RenderContext context;
    private volatile boolean initialized;

    private SnapshotRenderer(Builder<S> b) {
        this.name = b.name;
        this.displayMode = b.displayMode;
        this.painter = b.painter;
        this.initialState = b.initialState;
        this.stateStream = b.stateStream;
        this.reducer = b.reducer;
        this.reduceOn = List.copyOf(b.reduceOn);
    }

    public static <S> Builder<S> builder(String name, SnapshotPainter<S> painter) {
        return new Builder<>(name, painter);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DisplayMode displayMode() {
        return displayMode;
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public synchronized void initialize(RenderContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        if (initialized) return;

        if (stateStream != null) {
            state.bind(stateStream.apply(ctx), initialState != null ? () -> initialState.apply(ctx) : null);
        } else {
            state.initialize(initialState.apply(ctx));
        }

        if (reducer != null) {
            for (String type : reduceOn) {
                busSubscriptions.add(ctx.bus().subscribe(type, this::update));
            }
        }
        this.context = ctx;
        this.initialized = true;
    }

    /** Fold {@code event} into the snapshot. */
    public void update(Input event) {
        if (reducer == null) throw new IllegalStateException("Renderer '" + name + "' has no reducer");
        state.update(s -> reducer.reduce(s, event));
    }

    @Override
    public void render(Surface surface, Orientation orientation) {
        if (!initialized) {
            throw new IllegalStateException("Renderer '" + name + "' rendered before initialize");
        }
        painter.paint(surface, orientation, state.require());
    }

    @Override
    public synchronized void reset() {
        if (context != null) {
            for (Subscription s : busSubscriptions) context.bus().unsubscribe(s);
        }
        busSubscriptions.clear();
        state.reset();
        context = null;
        initialized = false;
    }

    /** @return current snapshot, or null before initialization */
    public S state() {
        return state.get();
    }

    public StateHolder<S> holder() {
        return state;
    }

    @Override
    public String toString() {
        return "SnapshotRenderer{" + name + ", " + displayMode + '}';
    }

    public static final class Builder<S> {
        private final String name;
        private final SnapshotPainter<S> painter;
        private DisplayMode displayMode = DisplayMode.FULL;
        private Function<RenderContext, ? extends S> initialState;
        private Function<RenderContext, ? extends SharedStream<? extends S>> stateStream;
        private StateReducer<S> reducer;
        private final List<String> reduceOn = new ArrayList<>();

        private Builder(String name, SnapshotPainter<S> painter) {
            this.name = Objects.requireNonNull(name, "name");
            this.painter = Objects.requireNonNull(painter, "painter");
        }

        public Builder<S> displayMode(DisplayMode mode) {
            this.displayMode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder<S> state(S constant) {
            Objects.requireNonNull(constant, "constant");
            this.initialState = ctx -> constant;
            return this;
        }

        public Builder<S> initialState(Function<RenderContext, ? extends S> factory) {
            this.initialState = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder<S> stateStream(Function<RenderContext, ? extends SharedStream<? extends S>> factory) {
            this.stateStream = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder<S> reducer(StateReducer<S> reducer, String... eventTypes) {
            this.reducer = Objects.requireNonNull(reducer, "reducer");
            this.reduceOn.addAll(List.of(eventTypes));
            return this;
        }

        public SnapshotRenderer<S> build() {
            if (initialState == null && stateStream == null) {
                throw new IllegalStateException("SnapshotRenderer '" + name + "' needs a state, initialState or stateStream");
            }
            return new SnapshotRenderer<>(this);
        }
    }
}
