package org.mitre.dispersion;

import static java.lang.Math.*;

import org.mitre.caasd.commons.LatLong;

/**
 * Measures great-circle distance (in kilometers) with the haversine formula on a spherical Earth.
 * <p>
 * No ellipsoidal correction is applied. LatLong guarantees its coordinates are in range, so the
 * result is always finite and non-negative.
 */
public class HaversineDistance implements DistanceMetric<LatLong> {

    /** Mean Earth radius used by the haversine formula. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    @Override
    public double distanceBtw(LatLong item1, LatLong item2) {
        return haversineKm(item1, item2);
    }

    public static double haversineKm(LatLong a, LatLong b) {

        double lat1 = toRadians(a.latitude());
        double lat2 = toRadians(b.latitude());
        double dLat = lat2 - lat1;
        double dLon = toRadians(b.longitude() - a.longitude());

        double h = pow(sin(dLat / 2), 2) + cos(lat1) * cos(lat2) * pow(sin(dLon / 2), 2);
        // h can drift a hair above 1.0 for antipodal points
        double c = 2 * atan2(sqrt(h), sqrt(max(0.0, 1 - h)));

        return EARTH_RADIUS_KM * c;
    }

    public static HaversineDistance haversine() {
        return new HaversineDistance();
    }
}
