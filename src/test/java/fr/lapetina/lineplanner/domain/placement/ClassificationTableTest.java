package fr.lapetina.lineplanner.domain.placement;

import fr.lapetina.lineplanner.domain.model.Facing;
import fr.lapetina.lineplanner.domain.model.Lane;
import fr.lapetina.lineplanner.domain.model.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationTableTest {

    @Nested
    @DisplayName("ClassificationTable")
    class Table {

        @Test
        @DisplayName("should return the first matching rule")
        void shouldReturnFirstMatch() {
            ClassificationTable<String> table = ClassificationTable.<String>builder()
                    .whenContainsAny(List.of("front"), "first")
                    .whenContainsAny(List.of("front", "back"), "second")
                    .build();

            assertThat(table.classify("Front Placket")).contains("first");
            assertThat(table.classify("Back Yoke")).contains("second");
            assertThat(table.classify("Pocket")).isEmpty();
        }

        @Test
        @DisplayName("should match case-insensitively and treat null as empty")
        void shouldNormalizeLabels() {
            ClassificationTable<Integer> table = ClassificationTable.<Integer>builder()
                    .whenContainsAny(List.of("IRON"), 1)
                    .build();

            assertThat(table.classify("steam iron table")).contains(1);
            assertThat(table.classifyOrDefault(null, 0)).isZero();
        }

        @Test
        @DisplayName("should keep rules in insertion order")
        void shouldExposeRules() {
            ClassificationTable<String> table = ClassificationTable.<String>builder()
                    .rule("empty", String::isEmpty, "blank")
                    .whenContainsAny(List.of("a"), "has a")
                    .build();

            assertThat(table.getRules()).extracting(ClassificationTable.Rule::outcome)
                    .containsExactly("blank", "has a");
        }
    }

    @Nested
    @DisplayName("SectionClassifier")
    class Sections {

        private final SectionClassifier classifier = new SectionClassifier(LayoutSettings.Keywords.defaults());

        @Test
        @DisplayName("should classify known section keywords")
        void shouldClassifyKnownSections() {
            assertThat(classifier.classify("Assembly")).isEqualTo(SectionKind.ASSEMBLY);
            assertThat(classifier.classify("Collar")).isEqualTo(SectionKind.CD);
            assertThat(classifier.classify("FRONT")).isEqualTo(SectionKind.CD);
            assertThat(classifier.classify("Cuff")).isEqualTo(SectionKind.AB);
            assertThat(classifier.classify("Sleeve")).isEqualTo(SectionKind.AB);
            assertThat(classifier.classify("Back")).isEqualTo(SectionKind.AB);
        }

        @Test
        @DisplayName("should let assembly win over lane-pair keywords")
        void shouldApplyPrecedence() {
            assertThat(classifier.classify("Collar Assembly")).isEqualTo(SectionKind.ASSEMBLY);
            assertThat(classifier.classify("Front and Back")).isEqualTo(SectionKind.CD);
        }

        @Test
        @DisplayName("should default unknown sections to AB")
        void shouldDefaultToAb() {
            assertThat(classifier.classify("Unknown")).isEqualTo(SectionKind.AB);
            assertThat(classifier.classify("Pocket")).isEqualTo(SectionKind.AB);
        }
    }

    @Nested
    @DisplayName("StationRules")
    class Stations {

        private final StationRules rules = new StationRules(LayoutSettings.Keywords.defaults());

        @Test
        @DisplayName("should face paired lanes towards each other")
        void shouldUseLaneFacing() {
            assertThat(rules.facingFor(Lane.A, "SNLS")).isEqualTo(Facing.LEFT);
            assertThat(rules.facingFor(Lane.B, "SNLS")).isEqualTo(Facing.RIGHT);
            assertThat(rules.facingFor(Lane.C, "SNLS")).isEqualTo(Facing.RIGHT);
            assertThat(rules.facingFor(Lane.D, "SNLS")).isEqualTo(Facing.LEFT);
        }

        @Test
        @DisplayName("should force front facing for pressing and inspection")
        void shouldForceFront() {
            assertThat(rules.facingFor(Lane.B, "Iron Table")).isEqualTo(Facing.FRONT);
            assertThat(rules.facingFor(Lane.C, "Fusing Press")).isEqualTo(Facing.FRONT);
            assertThat(rules.facingFor(Lane.D, "Inspection")).isEqualTo(Facing.FRONT);
        }

        @Test
        @DisplayName("should detect buttoning by machine type or operation name")
        void shouldDetectButtoning() {
            assertThat(rules.isButtoning(new Operation("1", "Attach", "Button Hole", 0.5, "Assembly"))).isTrue();
            assertThat(rules.isButtoning(new Operation("2", "Sew BUTTON", "SNLS", 0.5, "Assembly"))).isTrue();
            assertThat(rules.isButtoning(new Operation("3", "Side seam", "SNEC", 0.5, "Assembly"))).isFalse();
        }
    }
}
