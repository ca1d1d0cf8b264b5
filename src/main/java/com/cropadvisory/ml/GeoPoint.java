package com.cropadvisory.ml;

public record GeoPoint(Double latitude, Double longitude) {

    public static GeoPoint unknown() {
        return new GeoPoint(null, null);
    }
}
