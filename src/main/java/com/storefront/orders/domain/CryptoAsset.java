package com.storefront.orders.domain;

/**
 * Crypto currencies accepted at checkout, with the price-feed id and the number of
 * decimal places amounts are quoted in.
 */
public enum CryptoAsset {
    BTC("bitcoin", 8, "bitcoin"),
    XMR("monero", 12, "monero");

    private final String priceFeedId;
    private final int scale;
    private final String uriScheme;

    CryptoAsset(String priceFeedId, int scale, String uriScheme) {
        this.priceFeedId = priceFeedId;
        this.scale = scale;
        this.uriScheme = uriScheme;
    }

    public String getPriceFeedId() {
        return priceFeedId;
    }

    public int getScale() {
        return scale;
    }

    public String getUriScheme() {
        return uriScheme;
    }
}
