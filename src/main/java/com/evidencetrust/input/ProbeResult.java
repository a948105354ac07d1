package com.evidencetrust.input;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Outcome of one adversarial probe; {@code succeeded} means the probe got past the control.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProbeResult(
        String probeId,
        String target,
        String vector,
        @JsonAlias("success") boolean succeeded) {
}
