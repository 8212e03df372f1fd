package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Profile attributes of the authenticated user. Units follow the user's {@code weightUnit},
 * {@code heightUnit} and {@code distanceUnit} preferences; dates are {@code yyyy-MM-dd} strings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
        String encodedId,
        String fullName,
        String displayName,
        String gender,
        Integer age,
        String dateOfBirth,
        String memberSince,
        String country,
        String locale,
        String timezone,
        @JsonProperty("offsetFromUTCMillis") Integer offsetFromUtcMillis,
        String startDayOfWeek,
        Double height,
        String heightUnit,
        Double weight,
        String weightUnit,
        String distanceUnit,
        String glucoseUnit,
        Double strideLengthWalking,
        String strideLengthWalkingType,
        Double strideLengthRunning,
        String strideLengthRunningType,
        Integer averageDailySteps,
        Boolean corporate,
        String avatar,
        String avatar150
) {
}
