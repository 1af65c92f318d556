package com.williamcallahan.codelab.service.codelab;

/**
 * Restores the walk cursor saved by {@link WalkContext#descend} when closed.
 */
@FunctionalInterface
interface CursorScope extends AutoCloseable {

    @Override
    void close();
}
