package com.github.jnthnclt.os.bloom.core.guts;

import com.github.jnthnclt.os.bloom.core.api.CursorError;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageTooLargeException;

/**
 * Immutable status of a lazy bloom cursor. Transitions return a new state and never mutate.
 * <ul>
 * <li>{@link #fail} moves to PAGE_TOO_LARGE for an oversized page and to FAILED for anything else.
 * FAILED keeps its first cause.</li>
 * <li>{@link #onSeek} clears PAGE_TOO_LARGE, nothing else clears.</li>
 * </ul>
 */
public final class CursorState {

    public enum Status {
        READY, PAGE_TOO_LARGE, FAILED
    }

    public static final CursorState READY = new CursorState(Status.READY, null);

    public final Status status;
    public final CursorError error;

    private CursorState(Status status, CursorError error) {
        this.status = status;
        this.error = error;
    }

    public CursorState fail(CursorError.Source source, BloomBlockException cause) {
        if (status == Status.FAILED) {
            return this;
        }
        Status next = cause instanceof BloomPageTooLargeException ? Status.PAGE_TOO_LARGE : Status.FAILED;
        return new CursorState(next, new CursorError(source, cause));
    }

    public CursorState onSeek() {
        return status == Status.PAGE_TOO_LARGE ? READY : this;
    }

    public boolean isReady() {
        return status == Status.READY;
    }

    @Override
    public String toString() {
        return "CursorState{" + "status=" + status + ", error=" + error + '}';
    }
}
