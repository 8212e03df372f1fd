package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Actual values for a day. Distances are listed per activity type in the order Fitbit returns them. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Summary(
        Integer activeScore,
        Integer activityCalories,
        @JsonProperty("caloriesBMR") Integer caloriesBmr,
        Integer caloriesOut,
        List<Distance> distances,
        Integer fairlyActiveMinutes,
        Integer lightlyActiveMinutes,
        Integer marginalCalories,
        Integer sedentaryMinutes,
        Integer steps,
        Integer veryActiveMinutes
) {
    public Summary {
        distances = distances == null ? null : Collections.unmodifiableList(new ArrayList<>(distances));
    }
}
