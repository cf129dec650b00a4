package org.foxesworld.glowframe.engine.stream;

/**
 * Live link to an upstream source. Closing it stops the source for this connection.
 */
@FunctionalInterface
public interface StreamConnection extends AutoCloseable {

    @Override
    void close();
}
