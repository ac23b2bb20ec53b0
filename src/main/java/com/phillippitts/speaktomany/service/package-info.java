/**
 * Service layer: the per-session translation pipeline.
 *
 * <ul>
 *   <li>{@code service.recognition} - recognizer streams, transcript normalization, watchdog</li>
 *   <li>{@code service.buffer} - latency-bounded segment buffer and dispatch</li>
 *   <li>{@code service.session} - session state, coordinator fan-out, registry</li>
 *   <li>{@code service.agent} - per-user agents</li>
 *   <li>{@code service.routing} - who hears what</li>
 *   <li>{@code service.translation} - translation and synthesis providers</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions from
 * {@code com.phillippitts.speaktomany.exception}.
 */
package com.phillippitts.speaktomany.service;
