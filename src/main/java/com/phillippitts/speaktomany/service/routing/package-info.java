/**
 * Session-wide audio routing. Pure policy: decides which raw streams each listener hears and
 * which translations are played, and hands those decisions to subscribers. It never touches audio.
 */
package com.phillippitts.speaktomany.service.routing;
