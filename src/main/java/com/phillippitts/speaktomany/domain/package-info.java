/**
 * Immutable domain types shared by the buffer, routing and session layers.
 */
package com.phillippitts.speaktomany.domain;
