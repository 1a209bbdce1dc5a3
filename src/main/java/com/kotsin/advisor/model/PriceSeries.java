package com.kotsin.advisor.model;

/**
 * Oldest-first closes and volumes for one instrument.
 */
public record PriceSeries(String pair, VenueKind venue, double[] prices, double[] volumes, long[] timestamps) {

    public PriceSeries {
        if (prices == null) {
            prices = new double[0];
        }
        if (volumes == null) {
            volumes = new double[0];
        }
        if (timestamps == null) {
            timestamps = new long[0];
        }
    }

    public double currentPrice() {
        return prices.length == 0 ? 0.0 : prices[prices.length - 1];
    }

    public double currentVolume() {
        return volumes.length == 0 ? 0.0 : volumes[volumes.length - 1];
    }

    public int size() {
        return prices.length;
    }
}
