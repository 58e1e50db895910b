package fr.lapetina.lineplanner.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LaneCursorsTest {

    @Test
    @DisplayName("should advance a single lane and leave the others")
    void shouldAdvanceSingleLane() {
        LaneCursors cursors = LaneCursors.START.advanceBy(Lane.B, 4.0);

        assertThat(cursors.get(Lane.A)).isZero();
        assertThat(cursors.get(Lane.B)).isEqualTo(4.0);
        assertThat(cursors.get(Lane.C)).isZero();
        assertThat(cursors.get(Lane.D)).isZero();
    }

    @Test
    @DisplayName("should never move a cursor backwards")
    void shouldBeMonotonic() {
        LaneCursors cursors = LaneCursors.START.advanceTo(Lane.C, 10.0).advanceTo(Lane.C, 3.0);

        assertThat(cursors.get(Lane.C)).isEqualTo(10.0);
    }

    @Test
    @DisplayName("should sync a group to one offset")
    void shouldSyncGroup() {
        LaneCursors cursors = new LaneCursors(3, 7, 1, 1).syncGroup(LaneGroup.AB, 9);

        assertThat(cursors).isEqualTo(new LaneCursors(9, 9, 1, 1));
        assertThat(cursors.max(LaneGroup.CD)).isEqualTo(1);
    }

    @Test
    @DisplayName("should sync all lanes")
    void shouldSyncAll() {
        LaneCursors cursors = new LaneCursors(3, 7, 1, 12);

        assertThat(cursors.maxAll()).isEqualTo(12);
        assertThat(cursors.syncAll(14)).isEqualTo(new LaneCursors(14, 14, 14, 14));
    }

    @Test
    @DisplayName("should be immutable")
    void shouldBeImmutable() {
        LaneCursors original = new LaneCursors(1, 2, 3, 4);
        original.syncAll(100);

        assertThat(original).isEqualTo(new LaneCursors(1, 2, 3, 4));
    }

    @Test
    @DisplayName("should expose lane pairing")
    void shouldExposeLanePairing() {
        assertThat(Lane.A.getGroup()).isEqualTo(LaneGroup.AB);
        assertThat(Lane.D.getGroup()).isEqualTo(LaneGroup.CD);
        assertThat(Lane.A.isInner()).isTrue();
        assertThat(Lane.B.isInner()).isFalse();
        assertThat(LaneGroup.CD.inner()).isEqualTo(Lane.C);
        assertThat(LaneGroup.CD.outer()).isEqualTo(Lane.D);
    }
}
