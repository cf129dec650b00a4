package org.foxesworld.glowframe.engine.loop;

import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = TimeUnit.NANOSECONDS::sleep;

    void sleep(long nanos) throws InterruptedException;
}
