package fr.lapetina.lineplanner.domain.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MachineCatalogTest {

    private final MachineCatalog catalog = MachineCatalog.defaultCatalog();

    @Test
    @DisplayName("should categorise common machine types")
    void shouldCategorise() {
        assertThat(catalog.categoryOf("SNLS")).isEqualTo(MachineCategory.SNLS);
        assertThat(catalog.categoryOf("3T Overlock")).isEqualTo(MachineCategory.SNEC);
        assertThat(catalog.categoryOf("Iron Table")).isEqualTo(MachineCategory.IRON);
        assertThat(catalog.categoryOf("Button Hole")).isEqualTo(MachineCategory.BUTTON);
        assertThat(catalog.categoryOf("Bartack")).isEqualTo(MachineCategory.BARTACK);
        assertThat(catalog.categoryOf("Special M/C")).isEqualTo(MachineCategory.SPECIAL);
        assertThat(catalog.categoryOf("Helper")).isEqualTo(MachineCategory.HELPER);
    }

    @Test
    @DisplayName("should ignore case and separators when categorising")
    void shouldIgnoreSeparators() {
        assertThat(catalog.categoryOf("Lock-Stitch")).isEqualTo(MachineCategory.SNLS);
        assertThat(catalog.categoryOf("Single Needle")).isEqualTo(MachineCategory.SNLS);
        assertThat(catalog.categoryOf("single_needle")).isEqualTo(MachineCategory.SNLS);
        assertThat(catalog.categoryOf("B/Hole")).isEqualTo(MachineCategory.BUTTON);
        assertThat(catalog.categoryOf("Bar Tack")).isEqualTo(MachineCategory.BARTACK);
        assertThat(MachineCatalog.compact(" Bar-Tack./_ ")).isEqualTo("bartack");
    }

    @Test
    @DisplayName("should apply category rules in table order")
    void shouldApplyRulesInOrder() {
        assertThat(catalog.categoryOf("Fusing Machine")).isEqualTo(MachineCategory.IRON);
        assertThat(catalog.categoryOf("Edge Cutter")).isEqualTo(MachineCategory.SNEC);
        assertThat(catalog.categoryOf("Contour Table")).isEqualTo(MachineCategory.HELPER);
        assertThat(catalog.categoryOf("Overlock Press")).isEqualTo(MachineCategory.SNEC);
        assertThat(catalog.categoryOf("FOA")).isEqualTo(MachineCategory.DEFAULT);
    }

    @Test
    @DisplayName("should size button machines as standard stitchers")
    void shouldSizeButtonMachines() {
        assertThat(catalog.footprintOf("Button Hole")).isEqualTo(MachineCatalog.STANDARD_STITCHER);
        assertThat(catalog.footprintOf("Button Sew")).isEqualTo(MachineCatalog.STANDARD_STITCHER);
        assertThat(catalog.footprintOf("FOA")).isEqualTo(Footprint.ofFeet(4.5, 2.5));
    }

    @Test
    @DisplayName("should fall back to the default category and footprint")
    void shouldFallBack() {
        assertThat(catalog.categoryOf("Laser Cutter")).isEqualTo(MachineCategory.DEFAULT);
        assertThat(catalog.categoryOf(null)).isEqualTo(MachineCategory.DEFAULT);
        assertThat(catalog.footprintOf("Laser Cutter")).isEqualTo(MachineCatalog.DEFAULT_FOOTPRINT);
    }

    @Test
    @DisplayName("should convert footprints from feet")
    void shouldConvertFeet() {
        Footprint stitcher = catalog.footprintOf("snls");
        assertThat(stitcher.length()).isCloseTo(1.2192, within(1e-9));
        assertThat(stitcher.width()).isCloseTo(0.762, within(1e-9));

        Footprint press = catalog.footprintOf("Steam Press");
        assertThat(press.length()).isCloseTo(1.524, within(1e-9));
        assertThat(press.width()).isCloseTo(1.0668, within(1e-9));
        assertThat(press.area()).isCloseTo(1.524 * 1.0668, within(1e-9));
    }
}
