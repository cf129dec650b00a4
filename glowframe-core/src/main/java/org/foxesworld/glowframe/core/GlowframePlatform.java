package org.foxesworld.glowframe.core;

public final class GlowframePlatform {
    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static int processors() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private GlowframePlatform() {}
}
