package com.phillippitts.speaktomany.service.buffer;

/**
 * Point-in-time counters for one translation buffer.
 *
 * @param segmentsDispatched    segments that entered TRANSLATING
 * @param segmentsCompleted     segments that reached COMPLETED
 * @param segmentsFailed        segments that reached FAILED
 * @param forcedDispatches      dispatches triggered by the max-delay sweep
 * @param avgDispatchLatencyMs  mean time from first submission to dispatch
 * @param maxDispatchLatencyMs  worst time from first submission to dispatch
 * @param pendingSegments       segments still waiting
 * @param queueSize             segments queued for immediate dispatch
 * @param targetDelayMs         configured max delay
 * @param listeners             registered dispatch listeners
 */
public record BufferStats(
        long segmentsDispatched,
        long segmentsCompleted,
        long segmentsFailed,
        long forcedDispatches,
        double avgDispatchLatencyMs,
        long maxDispatchLatencyMs,
        int pendingSegments,
        int queueSize,
        long targetDelayMs,
        int listeners
) {
}
