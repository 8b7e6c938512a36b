package com.storefront.orders.domain;

/**
 * Shipping carriers we can build a public tracking link for.
 */
public enum Carrier {
    UPS("https://www.ups.com/track?tracknum="),
    FEDEX("https://www.fedex.com/fedextrack/?tracknumbers="),
    DHL("https://www.dhl.com/en/express/tracking.html?AWB="),
    USPS("https://tools.usps.com/go/TrackConfirmAction?tLabels="),
    ROYAL_MAIL("https://www.royalmail.com/track-your-item#/tracking-results/"),
    OTHER(null);

    private final String trackingUrlPrefix;

    Carrier(String trackingUrlPrefix) {
        this.trackingUrlPrefix = trackingUrlPrefix;
    }

    /** Returns null for {@link #OTHER}; the caller must supply a URL in that case. */
    public String trackingUrl(String trackingNumber) {
        if (trackingUrlPrefix == null || trackingNumber == null) {
            return null;
        }
        return trackingUrlPrefix + trackingNumber.trim();
    }
}
