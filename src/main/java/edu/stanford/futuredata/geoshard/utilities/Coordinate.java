package edu.stanford.futuredata.geoshard.utilities;

import java.util.Objects;

/**
 * A WGS84 (longitude, latitude) pair in degrees.
 */
public final class Coordinate {

    private static final double EARTH_RADIUS_METERS = 6371008.8;

    public final double lon;
    public final double lat;

    public Coordinate(double lon, double lat) {
        if (Double.isNaN(lon) || Double.isNaN(lat) || lon < -180.0 || lon > 180.0 || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException(String.format("Invalid coordinate (%s, %s)", lon, lat));
        }
        this.lon = lon;
        this.lat = lat;
    }

    /** Great-circle distance in meters. */
    public double distanceMeters(Coordinate other) {
        double dLat = Math.toRadians(other.lat - lat);
        double dLon = Math.toRadians(other.lon - lon);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat)) * Math.cos(Math.toRadians(other.lat))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    /**
     * Distance in meters from this point to the segment a-b, on an equirectangular projection centered on the
     * segment.  Accurate enough to rank gateway candidates near a shard boundary.
     */
    public double distanceToSegmentMeters(Coordinate a, Coordinate b) {
        double cosLat = Math.cos(Math.toRadians((a.lat + b.lat) / 2));
        double ax = a.lon * cosLat, ay = a.lat;
        double bx = b.lon * cosLat, by = b.lat;
        double px = lon * cosLat, py = lat;
        double dx = bx - ax, dy = by - ay;
        double lengthSquared = dx * dx + dy * dy;
        double t = lengthSquared == 0 ? 0 : ((px - ax) * dx + (py - ay) * dy) / lengthSquared;
        t = Math.max(0, Math.min(1, t));
        double cx = ax + t * dx, cy = ay + t * dy;
        double degrees = Math.sqrt((px - cx) * (px - cx) + (py - cy) * (py - cy));
        return Math.toRadians(degrees) * EARTH_RADIUS_METERS;
    }

    /** Point a fraction t of the way from this coordinate to other, interpolated linearly in degrees. */
    public Coordinate interpolate(Coordinate other, double t) {
        return new Coordinate(lon + (other.lon - lon) * t, lat + (other.lat - lat) * t);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate)) {
            return false;
        }
        Coordinate c = (Coordinate) o;
        return Double.compare(c.lon, lon) == 0 && Double.compare(c.lat, lat) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lon, lat);
    }

    @Override
    public String toString() {
        return String.format("(%s,%s)", lon, lat);
    }
}
