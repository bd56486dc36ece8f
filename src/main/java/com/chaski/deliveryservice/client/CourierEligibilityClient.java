package com.chaski.deliveryservice.client;

/**
 * Identity collaborator. Verification itself happens elsewhere; this service only
 * asks whether an already-authenticated courier may bid.
 */
public interface CourierEligibilityClient {

    boolean isEligibleToBid(Long courierId);
}
