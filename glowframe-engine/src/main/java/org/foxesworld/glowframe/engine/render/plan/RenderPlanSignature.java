package org.foxesworld.glowframe.engine.render.plan;

import org.foxesworld.glowframe.engine.render.Renderer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered key of a renderer set. Elements compare by reference: renderer instances for
 * {@link SignatureStrategy#IDENTITY}, renderer classes for {@link SignatureStrategy#TYPE}.
 */
public final class RenderPlanSignature {

    private final SignatureStrategy strategy;
    private final List<Object> keys;
    private final int hash;

    private RenderPlanSignature(SignatureStrategy strategy, List<Object> keys) {
        this.strategy = strategy;
        this.keys = Collections.unmodifiableList(keys);
        int h = strategy.hashCode();
        for (Object k : keys) h = 31 * h + System.identityHashCode(k);
        this.hash = h;
    }

    public static RenderPlanSignature of(List<? extends Renderer> renderers, SignatureStrategy strategy) {
        Objects.requireNonNull(renderers, "renderers");
        Objects.requireNonNull(strategy, "strategy");
        List<Object> keys = new ArrayList<>(renderers.size());
        for (Renderer r : renderers) {
            keys.add(strategy == SignatureStrategy.TYPE ? r.getClass() : r);
        }
        return new RenderPlanSignature(strategy, keys);
    }

    public SignatureStrategy strategy() {
        return strategy;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenderPlanSignature)) return false;
        RenderPlanSignature that = (RenderPlanSignature) o;
        if (strategy != that.strategy || hash != that.hash || keys.size() != that.keys.size()) return false;
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i) != that.keys.get(i)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "RenderPlanSignature{" + strategy + ", size=" + keys.size() + '}';
    }
}
