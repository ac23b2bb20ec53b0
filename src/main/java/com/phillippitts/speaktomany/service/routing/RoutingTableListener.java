package com.phillippitts.speaktomany.service.routing;

/**
 * Receives every new routing table. Called while the policy lock is held, so implementations
 * must be quick and must not block.
 */
@FunctionalInterface
public interface RoutingTableListener {

    void onRoutingChanged(RoutingTable table);
}
