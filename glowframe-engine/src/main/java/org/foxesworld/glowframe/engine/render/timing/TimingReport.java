package org.foxesworld.glowframe.engine.render.timing;

import java.util.List;

/**
 * Per-renderer snapshots for a renderer set plus the names that have never been measured.
 */
public record TimingReport(List<RendererTimingSnapshot> snapshots, List<String> missing) {

    public TimingReport {
        snapshots = List.copyOf(snapshots);
        missing = List.copyOf(missing);
    }
}
