package com.bko.fitbitclient.integrations.fitbit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Distance(String activity, Double distance) {
}
