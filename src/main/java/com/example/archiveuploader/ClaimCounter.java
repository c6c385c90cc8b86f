package com.example.archiveuploader;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Session-wide watermark of claimed archive positions, shared by every scanner.
 */
public final class ClaimCounter {
    private final AtomicLong next = new AtomicLong();

    /**
     * Claims the entry at {@code position} (zero based, counting only non-empty
     * entries) unless a faster scanner already has. On success the watermark
     * moves to {@code position + 1}.
     */
    public boolean tryClaim(long position) {
        long current = next.get();
        while (position >= current) {
            if (next.compareAndSet(current, position + 1)) {
                return true;
            }
            current = next.get();
        }
        return false;
    }

    /**
     * Number of entries claimed so far.
     */
    public long claimed() {
        return next.get();
    }
}
