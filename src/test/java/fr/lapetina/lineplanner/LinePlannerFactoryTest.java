package fr.lapetina.lineplanner;

import fr.lapetina.lineplanner.domain.model.Operation;
import fr.lapetina.lineplanner.domain.model.PlacedEntity;
import fr.lapetina.lineplanner.engine.LayoutGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinePlannerFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should wire a generator from the test configuration")
    void shouldCreateFromClasspath() {
        try (LinePlannerFactory factory = LinePlannerFactory.create("test-config.yaml")) {
            assertThat(factory.getGenerator()).isNotNull();
            assertThat(factory.getGenerator().getSettings().transitionFixtures()).isTrue();
            assertThat(factory.getMetricsRegistry()).isNotNull();
        }
    }

    @Test
    @DisplayName("should rebuild the generator when the configuration is reloaded")
    void shouldRebuildOnReload() throws Exception {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, "spacing:\n  machinePitch: 2.0\nmetrics:\n  enabled: false\n");

        try (LinePlannerFactory factory = LinePlannerFactory.create(file.toString())) {
            LayoutGenerator before = factory.getGenerator();
            assertThat(factory.getMetricsRegistry()).isNull();

            Files.writeString(file, "spacing:\n  machinePitch: 4.0\nmetrics:\n  enabled: false\n");
            factory.getConfigLoader().reload();

            LayoutGenerator after = factory.getGenerator();
            assertThat(after).isNotSameAs(before);
            assertThat(after.getSettings().spacing().machinePitch()).isEqualTo(4.0);

            List<PlacedEntity> machines = after
                    .generate(List.of(Operation.of("10", "SNLS", 2.0, "Cuff")), 480, 480)
                    .stream()
                    .filter(PlacedEntity::isMachine)
                    .toList();
            assertThat(machines).extracting(e -> e.position().x()).containsExactly(3.5, 7.5);
        }
    }
}
