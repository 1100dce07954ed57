package com.healthecon.common.constants;

/**
 * Lifecycle of a research query: {@code pending -> inFlight -> complete | failed}.
 * Terminal states never transition again.
 */
public enum QueryStatus {
    PENDING("pending"),
    IN_FLIGHT("inFlight"),
    COMPLETE("complete"),
    FAILED("failed");

    private final String wireValue;

    QueryStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public static QueryStatus fromString(String value) {
        for (QueryStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown query status: " + value);
    }
}
