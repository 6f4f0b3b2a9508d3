package edu.stanford.futuredata.geoshard.engine;

import edu.stanford.futuredata.geoshard.utilities.Coordinate;

public final class RouteStep {

    public static final String DEPART = "depart";
    public static final String ARRIVE = "arrive";
    public static final String CONTINUE = "continue";
    public static final String BOUNDARY_INSTRUCTION = "Continue across region boundary";

    public final String type;
    public final String modifier;
    public final String name;
    public final String instruction;
    public final Coordinate location;
    public final double distance;
    public final double duration;

    public RouteStep(String type, String modifier, String name, String instruction, Coordinate location,
                     double distance, double duration) {
        this.type = type == null ? "" : type;
        this.modifier = modifier == null ? "" : modifier;
        this.name = name == null ? "" : name;
        this.instruction = instruction == null ? describe(this.type, this.modifier, this.name) : instruction;
        this.location = location;
        this.distance = distance;
        this.duration = duration;
    }

    /** The synthetic step inserted where a stitched route passes from one shard into the next. */
    public static RouteStep boundaryCrossing(Coordinate gateway) {
        return new RouteStep(CONTINUE, "straight", "", BOUNDARY_INSTRUCTION, gateway, 0.0, 0.0);
    }

    // Build a short human-readable instruction from an engine maneuver.
    static String describe(String type, String modifier, String name) {
        StringBuilder sb = new StringBuilder();
        switch (type) {
            case DEPART:
                sb.append("Head out");
                break;
            case ARRIVE:
                sb.append("Arrive at destination");
                break;
            case "":
                sb.append("Continue");
                break;
            default:
                sb.append(Character.toUpperCase(type.charAt(0))).append(type.substring(1));
                if (!modifier.isEmpty()) {
                    sb.append(' ').append(modifier);
                }
        }
        if (!name.isEmpty() && !type.equals(ARRIVE)) {
            sb.append(" onto ").append(name);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("%s @%s", instruction, location);
    }
}
