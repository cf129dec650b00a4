package org.foxesworld.glowframe.engine.render;

/**
 * A renderer failed while producing a frame. The frame is lost; the caller decides whether to
 * drop it or stop the loop.
 */
public final class RenderFrameException extends RuntimeException {

    private final String rendererName;

    public RenderFrameException(String rendererName, String message, Throwable cause) {
        super(message, cause);
        this.rendererName = rendererName;
    }

    public RenderFrameException(String rendererName, Throwable cause) {
        this(rendererName, "Renderer '" + rendererName + "' failed: " + cause, cause);
    }

    /** @return name of the failing renderer, or null when the failure was in composition */
    public String rendererName() {
        return rendererName;
    }
}
