package com.evidencetrust.governance;

import java.util.Collection;

public record SeverityCounts(int critical, int warning, int info) {

    public static SeverityCounts tally(Collection<Finding> findings) {
        int critical = 0;
        int warning = 0;
        int info = 0;
        for (Finding finding : findings) {
            switch (finding.severity()) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                case INFO -> info++;
            }
        }
        return new SeverityCounts(critical, warning, info);
    }
}
