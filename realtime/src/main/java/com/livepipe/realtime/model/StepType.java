package com.livepipe.realtime.model;

import java.time.Duration;
import java.util.Locale;

/**
 * The three fixed steps of the demo ELT pipeline, in execution order.
 *
 * The order of the constants is the order the engine runs them in;
 * transform consumes load's output, load consumes extract's.
 */
public enum StepType {

    EXTRACT("extract-step", "Extract Data",
            "Extract data from source systems",
            Duration.ofMillis(2000)),

    LOAD("load-step", "Load Data",
            "Load raw data into the data warehouse",
            Duration.ofMillis(1500)),

    TRANSFORM("transform-step", "Transform Data",
            "Transform and clean data within the warehouse",
            Duration.ofMillis(3000));

    private final String   stepId;
    private final String   displayName;
    private final String   description;
    private final Duration estimatedDuration;

    StepType(String stepId, String displayName, String description, Duration estimatedDuration) {
        this.stepId            = stepId;
        this.displayName       = displayName;
        this.description       = description;
        this.estimatedDuration = estimatedDuration;
    }

    public String   stepId()            { return stepId; }
    public String   displayName()       { return displayName; }
    public String   description()       { return description; }
    public Duration estimatedDuration() { return estimatedDuration; }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
