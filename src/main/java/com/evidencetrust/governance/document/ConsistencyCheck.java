package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;

/**
 * Flags controls that several tools assessed with different outcomes. A control reported
 * twice by the same tool is not a conflict.
 */
public class ConsistencyCheck {

    public List<Finding> check(DocumentBundle bundle) {
        Map<String, Set<String>> toolsById = new LinkedHashMap<>();
        Map<String, Set<ControlStatus>> statusesById = new LinkedHashMap<>();
        for (Control control : bundle.controls()) {
            toolsById.computeIfAbsent(control.id(), id -> new LinkedHashSet<>()).add(control.toolOr(bundle.source()));
            statusesById.computeIfAbsent(control.id(), id -> new LinkedHashSet<>()).add(control.status());
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : toolsById.entrySet()) {
            Set<ControlStatus> statuses = statusesById.get(entry.getKey());
            if (entry.getValue().size() < 2 || statuses.size() < 2) {
                continue;
            }
            findings.add(Finding.critical(
                    "CN-" + entry.getKey(),
                    FindingCategory.CONSISTENCY,
                    "Control " + entry.getKey() + " has conflicting statuses ("
                            + String.join(", ", statuses.stream().map(ControlStatus::label).toList())
                            + ") across sources (" + String.join(", ", entry.getValue()) + ")",
                    "Reconcile the tool results and re-test the control before relying on either outcome",
                    List.of(entry.getKey())));
        }
        return findings;
    }
}
