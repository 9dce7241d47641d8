package com.wellnessplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Skip and downgrade rates for one category, as percentages rounded to one decimal. */
public record CategoryRates(
    @JsonProperty("skipRate")      double skipRate,
    @JsonProperty("downgradeRate") double downgradeRate
) {}
