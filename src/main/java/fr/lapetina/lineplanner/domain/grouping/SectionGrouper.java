package fr.lapetina.lineplanner.domain.grouping;

import fr.lapetina.lineplanner.domain.model.BalancedOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets balanced operations by section label in first-seen order.
 *
 * Labels are trimmed; a blank label goes to {@link #UNKNOWN_SECTION}.
 * Operations keep their input order within a bucket.
 */
public final class SectionGrouper {

    public static final String UNKNOWN_SECTION = "Unknown";

    public Map<String, List<BalancedOperation>> group(List<BalancedOperation> balanced) {
        Map<String, List<BalancedOperation>> sections = new LinkedHashMap<>();
        for (BalancedOperation item : balanced) {
            sections.computeIfAbsent(sectionOf(item), k -> new ArrayList<>()).add(item);
        }

        Map<String, List<BalancedOperation>> frozen = new LinkedHashMap<>();
        sections.forEach((name, items) -> frozen.put(name, Collections.unmodifiableList(items)));
        return Collections.unmodifiableMap(frozen);
    }

    static String sectionOf(BalancedOperation item) {
        String section = item.operation().section();
        if (section == null || section.isBlank()) {
            return UNKNOWN_SECTION;
        }
        return section.trim();
    }
}
