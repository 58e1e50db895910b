package fr.lapetina.lineplanner.domain.catalog;

import fr.lapetina.lineplanner.domain.placement.ClassificationTable;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves free-text machine types to a category and a footprint.
 *
 * Both lookups are ordered keyword tables. Categories match on a compacted
 * label (lower-cased, without whitespace, '_', '-', '.' or '/'), so
 * "Lock-Stitch" and "lockstitch" agree; footprints match on the lower-cased
 * label. Unknown types resolve to {@link MachineCategory#DEFAULT} and
 * {@link #DEFAULT_FOOTPRINT}.
 */
public final class MachineCatalog {

    static final Footprint STANDARD_STITCHER = Footprint.ofFeet(4, 2.5);
    static final Footprint DEFAULT_FOOTPRINT = new Footprint(1.2, 0.8);

    private static final Pattern SEPARATORS = Pattern.compile("[\\s_\\-./]");

    private static final MachineCatalog DEFAULT = new MachineCatalog();

    private final ClassificationTable<MachineCategory> categories;
    private final ClassificationTable<Footprint> footprints;

    public MachineCatalog() {
        this.categories = ClassificationTable.<MachineCategory>builder()
                .whenContainsAny(compactAll("snls", "single needle", "lock stitch"), MachineCategory.SNLS)
                .whenContainsAny(compactAll("snec", "overlock", "edge"), MachineCategory.SNEC)
                .whenContainsAny(compactAll("iron", "press", "fusing"), MachineCategory.IRON)
                .whenContainsAny(compactAll("button", "b/hole"), MachineCategory.BUTTON)
                .whenContainsAny(compactAll("bartack", "bar tack"), MachineCategory.BARTACK)
                .whenContainsAny(compactAll("helper", "table"), MachineCategory.HELPER)
                .whenContainsAny(compactAll("special", "contour", "turning", "pointing", "notch", "wrapping"),
                        MachineCategory.SPECIAL)
                .build();

        this.footprints = ClassificationTable.<Footprint>builder()
                .whenContainsAny(List.of("snls", "dnls", "overlock", "snec", "bartack"), STANDARD_STITCHER)
                .whenContainsAny(List.of("button hole"), STANDARD_STITCHER)
                .whenContainsAny(List.of("button"), STANDARD_STITCHER)
                .whenContainsAny(List.of("notch"), STANDARD_STITCHER)
                .whenContainsAny(List.of("foa", "feed off"), Footprint.ofFeet(4.5, 2.5))
                .whenContainsAny(List.of("turning", "pointing"), Footprint.ofFeet(4, 3))
                .whenContainsAny(List.of("contour"), Footprint.ofFeet(4.5, 3))
                .whenContainsAny(List.of("iron", "press"), Footprint.ofFeet(5, 3.5))
                .whenContainsAny(List.of("inspection"), Footprint.ofFeet(6, 4))
                .build();
    }

    public static MachineCatalog defaultCatalog() {
        return DEFAULT;
    }

    public MachineCategory categoryOf(String machineType) {
        return categories.classifyOrDefault(compact(machineType), MachineCategory.DEFAULT);
    }

    public Footprint footprintOf(String machineType) {
        return footprints.classifyOrDefault(machineType, DEFAULT_FOOTPRINT);
    }

    static String compact(String label) {
        if (label == null) {
            return "";
        }
        return SEPARATORS.matcher(label.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private static List<String> compactAll(String... keywords) {
        return Arrays.stream(keywords).map(MachineCatalog::compact).toList();
    }
}
