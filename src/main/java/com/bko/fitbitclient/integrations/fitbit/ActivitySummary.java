package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A single day of activity: the user's goals and what was actually achieved. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActivitySummary(Goals goals, Summary summary) {
}
