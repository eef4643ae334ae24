package com.jumpad.mathapi.model;

/**
 * Arithmetic operations offered by the service.
 */
public enum Operation {

    SUM("soma", "sum"),
    AVERAGE("média", "average");

    private final String label;
    private final String tag;

    Operation(String label, String tag) {
        this.label = label;
        this.tag = tag;
    }

    /**
     * Name used in client-facing error messages.
     */
    public String label() {
        return label;
    }

    /**
     * Name used as a metrics tag.
     */
    public String tag() {
        return tag;
    }
}
