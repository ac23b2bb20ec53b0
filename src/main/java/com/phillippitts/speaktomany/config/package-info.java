/**
 * Spring configuration: executors, HTTP clients and typed properties.
 *
 * <p>All tuneable values live in {@code application.properties} and are bound to the
 * validated classes in {@code config.properties}.
 */
package com.phillippitts.speaktomany.config;
