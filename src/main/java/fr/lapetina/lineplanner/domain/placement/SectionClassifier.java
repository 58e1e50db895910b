package fr.lapetina.lineplanner.domain.placement;

/**
 * Maps a section label to its {@link SectionKind}.
 *
 * Precedence: assembly, then CD keywords, then AB keywords; anything else
 * is laid out on AB.
 */
public final class SectionClassifier {

    private final ClassificationTable<SectionKind> table;

    public SectionClassifier(LayoutSettings.Keywords keywords) {
        this.table = ClassificationTable.<SectionKind>builder()
                .whenContainsAny(keywords.assembly(), SectionKind.ASSEMBLY)
                .whenContainsAny(keywords.cdSections(), SectionKind.CD)
                .whenContainsAny(keywords.abSections(), SectionKind.AB)
                .build();
    }

    public SectionKind classify(String sectionLabel) {
        return table.classifyOrDefault(sectionLabel, SectionKind.AB);
    }
}
