package edu.stanford.futuredata.geoshard.pipeline;

/** Graph preprocessing steps, named after the OSRM tools that run them. */
public enum JobKind {
    EXTRACT("extract"),
    PARTITION("partition"),
    CONTRACT("contract"),
    CUSTOMIZE("customize");

    public final String operation;

    JobKind(String operation) {
        this.operation = operation;
    }

    public String binary() {
        return "osrm-" + operation;
    }
}
