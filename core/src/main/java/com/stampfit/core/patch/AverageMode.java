package com.stampfit.core.patch;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public enum AverageMode {
    MEAN("mean"),
    MEDIAN("median");

    private final String label;

    AverageMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(AverageMode::getLabel).collect(Collectors.toList());
    }

    /**
     * Parses a mode name, exactly as written ("mean" or "median").
     *
     * @throws IllegalArgumentException naming the offending value and the valid modes
     */
    public static AverageMode fromLabel(String label) {
        for (AverageMode mode : values()) {
            if (mode.label.equals(label)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Found a mode of " + label + " but it must be in the list " + labels() + ".");
    }
}
