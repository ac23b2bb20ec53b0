/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speaktomany.exception.SpeakToManyException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.speaktomany.exception.TranslationException} - Thrown when the
 *       translation provider fails, times out, or returns an unusable response</li>
 *   <li>{@link com.phillippitts.speaktomany.exception.RecognitionException} - Thrown when a
 *       recognizer stream cannot be opened or restarted</li>
 *   <li>{@link com.phillippitts.speaktomany.exception.SessionException} - Thrown on illegal
 *       session or agent lifecycle transitions</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and carry a context
 * field (provider, participant, or session id).
 */
package com.phillippitts.speaktomany.exception;
