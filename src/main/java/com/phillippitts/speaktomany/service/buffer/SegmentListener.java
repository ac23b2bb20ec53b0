package com.phillippitts.speaktomany.service.buffer;

import com.phillippitts.speaktomany.domain.SegmentSnapshot;

/**
 * Callback invoked once per dispatched segment.
 *
 * <p>Returning normally counts as success. Throwing marks this listener as failed for the
 * segment without affecting other listeners.
 */
@FunctionalInterface
public interface SegmentListener {

    void onSegmentReady(SegmentSnapshot segment);
}
