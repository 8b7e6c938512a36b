package com.storefront.orders.adapters.client;

/**
 * Deposit address issuance and on-chain lookups for Bitcoin payments.
 */
public interface BitcoinNetworkClient {

    /** Derives a fresh, never-used receive address from the merchant's wallet. */
    String newAddress();

    AddressActivity getAddressActivity(String address);
}
