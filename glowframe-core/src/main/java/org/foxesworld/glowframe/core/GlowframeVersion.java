package org.foxesworld.glowframe.core;

public final class GlowframeVersion {
    public static final String NAME = "Glowframe";
    public static final String VERSION = "0.1.0";

    /** Prefix shared by every system property the runtime reads. */
    public static final String PROPERTY_PREFIX = "glowframe.";

    private GlowframeVersion() {}
}
