package com.evidencetrust.governance.document;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.evidencetrust.evidence.Timestamps;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.DocumentBundle;

/**
 * Warns when the document date is older than the freshness threshold or cannot be read.
 * Documents without a date are not checked.
 */
public class RecencyCheck {
    public static final Duration DEFAULT_THRESHOLD = Duration.ofDays(180);

    private final Clock clock;
    private final Duration threshold;

    public RecencyCheck(Clock clock) {
        this(clock, DEFAULT_THRESHOLD);
    }

    public RecencyCheck(Clock clock, Duration threshold) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
    }

    public Optional<Finding> check(DocumentBundle bundle) {
        String date = bundle.metadata().date();
        if (date == null || date.isBlank() || bundle.controls().isEmpty()) {
            return Optional.empty();
        }
        List<String> ids = bundle.controls().stream().map(Control::id).distinct().toList();

        Instant issued = Timestamps.parse(date);
        if (issued == null) {
            return Optional.of(Finding.warning(
                    "RC-DOC-STALE",
                    FindingCategory.EVIDENCE_RECENCY,
                    "Document date \"" + date.trim() + "\" could not be read; evidence freshness is unknown",
                    "Record the document date in ISO-8601 form (YYYY-MM-DD)",
                    ids));
        }
        long ageDays = Duration.between(issued, clock.instant()).toDays();
        if (ageDays <= threshold.toDays()) {
            return Optional.empty();
        }
        return Optional.of(Finding.warning(
                "RC-DOC-STALE",
                FindingCategory.EVIDENCE_RECENCY,
                "Evidence is " + ageDays + " days old, beyond the " + threshold.toDays() + "-day freshness window",
                "Collect fresh evidence for the controls in this document",
                ids));
    }
}
