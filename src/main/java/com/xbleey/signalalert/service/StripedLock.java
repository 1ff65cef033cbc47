package com.xbleey.signalalert.service;

/**
 * Fixed set of monitors selected by key hash. Work for one key is serialized, unrelated keys
 * rarely contend.
 */
public class StripedLock {

    private final Object[] stripes;

    public StripedLock(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be >= 1");
        }
        this.stripes = new Object[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new Object();
        }
    }

    public Object lockFor(String key) {
        int hash = key == null ? 0 : key.hashCode();
        return stripes[Math.floorMod(hash ^ (hash >>> 16), stripes.length)];
    }
}
