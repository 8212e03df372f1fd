package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Goals(Integer activeMinutes, Integer caloriesOut, Double distance, Integer steps) {
}
