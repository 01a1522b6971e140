package com.obsidx.watch;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Producer side of the watch loop: filesystem change notifications, one
 * changed path per call.
 */
public interface ChangeEventSource extends Closeable {
    /**
     * Blocks until the next change.
     *
     * @return the changed path, or {@code null} once the source is closed
     */
    Path take() throws InterruptedException;

    /**
     * @return the changed path, or {@code null} if none arrived within the
     *         timeout or the source is closed
     */
    Path poll(long timeout, TimeUnit unit) throws InterruptedException;
}
