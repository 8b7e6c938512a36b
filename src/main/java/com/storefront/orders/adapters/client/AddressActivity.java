package com.storefront.orders.adapters.client;

import lombok.Builder;
import lombok.Value;

/**
 * What the chain shows for a deposit address.
 */
@Value
@Builder
public class AddressActivity {

    String address;
    long receivedSatoshis;
    /** Confirmations of the least-confirmed payment to the address; 0 while any is in the mempool. */
    int confirmations;
    String latestTransactionHash;
}
