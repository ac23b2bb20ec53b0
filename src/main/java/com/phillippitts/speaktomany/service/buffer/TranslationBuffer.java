package com.phillippitts.speaktomany.service.buffer;

import com.phillippitts.speaktomany.domain.SegmentSnapshot;
import com.phillippitts.speaktomany.domain.SegmentUpdate;

import java.util.Optional;

/**
 * Per-session queue of in-flight transcript segments.
 *
 * <p>The buffer owns every segment's lifecycle. It decides when a segment is ready to
 * translate (final, high confidence, or older than the configured max delay) and hands
 * it to every registered {@link SegmentListener} exactly once.
 */
public interface TranslationBuffer {

    /**
     * Creates or merges the segment identified by {@code update.segmentId()}.
     *
     * @param update proposed segment state
     * @return {@code true} if the update was applied; {@code false} if it was ignored
     *         (blank text, segment no longer pending, speaker mismatch, or buffer not running)
     */
    boolean submit(SegmentUpdate update);

    /**
     * Registers a dispatch callback. Replaces any callback already registered under the same id.
     */
    void registerListener(String listenerId, SegmentListener listener);

    void unregisterListener(String listenerId);

    void start();

    /**
     * Stops the drain loop. Pending segments are abandoned; later submits are ignored.
     */
    void stop();

    boolean isRunning();

    BufferStats stats();

    /**
     * Current view of a segment, available until it is cleaned up after completion.
     */
    Optional<SegmentSnapshot> segmentInfo(String segmentId);
}
