package edu.stanford.futuredata.geoshard.utilities;

import java.util.Objects;
import java.util.Optional;

/**
 * An axis-aligned (min_lon, min_lat, max_lon, max_lat) box.  Boxes never wrap the antimeridian.
 */
public final class BoundingBox {
    public final double minLon;
    public final double minLat;
    public final double maxLon;
    public final double maxLat;

    public BoundingBox(double minLon, double minLat, double maxLon, double maxLat) {
        if (minLon > maxLon || minLat > maxLat) {
            throw new IllegalArgumentException(
                    String.format("Invalid bounding box %s,%s,%s,%s", minLon, minLat, maxLon, maxLat));
        }
        this.minLon = minLon;
        this.minLat = minLat;
        this.maxLon = maxLon;
        this.maxLat = maxLat;
    }

    /** Parse the "min_lon,min_lat,max_lon,max_lat" form used by osmium and the shard catalog. */
    public static BoundingBox parse(String bbox) {
        String[] parts = bbox.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Bounding box needs four values: " + bbox);
        }
        return new BoundingBox(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()),
                Double.parseDouble(parts[2].trim()), Double.parseDouble(parts[3].trim()));
    }

    public boolean contains(Coordinate c) {
        return c.lon >= minLon && c.lon <= maxLon && c.lat >= minLat && c.lat <= maxLat;
    }

    public Optional<BoundingBox> intersection(BoundingBox other) {
        double lo = Math.max(minLon, other.minLon);
        double la = Math.max(minLat, other.minLat);
        double hi = Math.min(maxLon, other.maxLon);
        double ha = Math.min(maxLat, other.maxLat);
        if (lo > hi || la > ha) {
            return Optional.empty();
        }
        return Optional.of(new BoundingBox(lo, la, hi, ha));
    }

    /** Grow the box by the given number of degrees on every side, clamped to valid WGS84 ranges. */
    public BoundingBox expand(double degrees) {
        return new BoundingBox(Math.max(-180.0, minLon - degrees), Math.max(-90.0, minLat - degrees),
                Math.min(180.0, maxLon + degrees), Math.min(90.0, maxLat + degrees));
    }

    public Coordinate center() {
        return new Coordinate((minLon + maxLon) / 2, (minLat + maxLat) / 2);
    }

    /** Area in square degrees. */
    public double area() {
        return (maxLon - minLon) * (maxLat - minLat);
    }

    public double width() {
        return maxLon - minLon;
    }

    public double height() {
        return maxLat - minLat;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundingBox)) {
            return false;
        }
        BoundingBox b = (BoundingBox) o;
        return Double.compare(b.minLon, minLon) == 0 && Double.compare(b.minLat, minLat) == 0
                && Double.compare(b.maxLon, maxLon) == 0 && Double.compare(b.maxLat, maxLat) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minLon, minLat, maxLon, maxLat);
    }

    @Override
    public String toString() {
        return String.format("%s,%s,%s,%s", minLon, minLat, maxLon, maxLat);
    }
}
