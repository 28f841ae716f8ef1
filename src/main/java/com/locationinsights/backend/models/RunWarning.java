package com.locationinsights.backend.models;

import lombok.Value;

@Value
public class RunWarning {
    WarningCode code;
    /** Tile, page or place the warning refers to; null for run-wide warnings. */
    String unit;
    String message;

    public static RunWarning of(WarningCode code, String unit, String message) {
        return new RunWarning(code, unit, message);
    }
}
