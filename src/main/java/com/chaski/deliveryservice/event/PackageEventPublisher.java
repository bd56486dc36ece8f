package com.chaski.deliveryservice.event;

/**
 * Event sink for bid and package transitions.
 */
public interface PackageEventPublisher {

    void publish(PackageEvent event);
}
