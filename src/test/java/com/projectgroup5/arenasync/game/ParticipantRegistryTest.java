package com.projectgroup5.arenasync.game;

import com.projectgroup5.arenasync.dto.RosterEntryDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class ParticipantRegistryTest {

    private static final String LOCAL = "me";

    private ColorAllocator colors;
    private HealthOverlay overlay;
    private PhysicsEngine physics;
    private boolean geometryReady;
    private ParticipantRegistry registry;

    @BeforeEach
    void setUp() {
        colors = new ColorAllocator();
        overlay = new HealthOverlay();
        physics = new PhysicsEngine();
        geometryReady = false;
        registry = new ParticipantRegistry(LOCAL, 100, colors, overlay, physics, () -> geometryReady);
    }

    private static RosterEntryDto entry(String id, double x, double y, Integer health) {
        return new RosterEntryDto(id, x, y, "name-" + id, health);
    }

    @Test
    void membershipEqualsSnapshotIdsWithoutLocal() {
        Random random = new Random(7);
        List<String> pool = List.of(LOCAL, "a", "b", "c", "d", "e", "f");

        for (int round = 0; round < 50; round++) {
            List<RosterEntryDto> snapshot = new ArrayList<>();
            Set<String> expected = new HashSet<>();
            for (String id : pool) {
                if (random.nextBoolean()) {
                    snapshot.add(entry(id, random.nextInt(2000), random.nextInt(2000), 100));
                    if (!id.equals(LOCAL)) expected.add(id);
                }
            }

            registry.applyRosterSnapshot(snapshot);

            assertThat(registry.ids()).isEqualTo(expected);
            assertThat(registry.contains(LOCAL)).isFalse();
        }
    }

    @Test
    void newParticipantTakesSnapshotValues() {
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 70)));

        Participant p1 = registry.get("p1").orElseThrow();
        assertThat(p1.x).isEqualTo(10);
        assertThat(p1.y).isEqualTo(20);
        assertThat(p1.health).isEqualTo(70);
        assertThat(p1.name).isEqualTo("name-p1");
        assertThat(p1.colorIndex).isEqualTo(1);
        assertThat(physics.positionOf("p1")).hasValueSatisfying(pos -> assertThat(pos).containsExactly(10, 20));
    }

    @Test
    void missingHealthDefaultsAndMissingNameIsUnknown() {
        registry.applyRosterSnapshot(List.of(new RosterEntryDto("p1", 1.0, 2.0, null, null)));

        Participant p1 = registry.get("p1").orElseThrow();
        assertThat(p1.health).isEqualTo(100);
        assertThat(p1.name).isEqualTo("Unknown");
    }

    @Test
    void knownParticipantPositionIsLastWriteWins() {
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));
        registry.applyRosterSnapshot(List.of(entry("p1", 300, 400, 100)));

        Participant p1 = registry.get("p1").orElseThrow();
        assertThat(p1.x).isEqualTo(300);
        assertThat(p1.y).isEqualTo(400);
        assertThat(p1.colorIndex).isEqualTo(1);
    }

    @Test
    void overlayHealthWinsOverSnapshot() {
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));
        overlay.recordLocalDamage("p1", 90);

        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));

        assertThat(registry.get("p1").orElseThrow().health).isEqualTo(90);
    }

    @Test
    void departureReleasesOverlayAndCollider() {
        geometryReady = true;
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));
        overlay.recordLocalDamage("p1", 90);
        assertThat(physics.hasWorldCollider("p1")).isTrue();

        registry.applyRosterSnapshot(List.of());

        assertThat(registry.contains("p1")).isFalse();
        assertThat(overlay.contains("p1")).isFalse();
        assertThat(physics.hasWorldCollider("p1")).isFalse();
    }

    @Test
    void colliderOnlyRegisteredOnceGeometryExists() {
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));
        geometryReady = true;
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100), entry("p2", 50, 50, 100)));

        assertThat(physics.hasWorldCollider("p1")).isFalse();
        assertThat(physics.hasWorldCollider("p2")).isTrue();
    }

    @Test
    void malformedEntriesAreSkippedWithoutFailingBatch() {
        List<RosterEntryDto> snapshot = new ArrayList<>();
        snapshot.add(null);
        snapshot.add(new RosterEntryDto(null, 1.0, 1.0, "ghost", 100));
        snapshot.add(new RosterEntryDto("nopos", null, 5.0, "x", 100));
        snapshot.add(entry("ok", 5, 5, 100));

        registry.applyRosterSnapshot(snapshot);

        assertThat(registry.ids()).containsExactly("ok");
    }

    @Test
    void entryWithoutPositionKeepsExistingParticipant() {
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));

        registry.applyRosterSnapshot(List.of(new RosterEntryDto("p1", null, null, null, 40)));

        Participant p1 = registry.get("p1").orElseThrow();
        assertThat(p1.x).isEqualTo(10);
        assertThat(p1.health).isEqualTo(100);
    }

    @Test
    void nullSnapshotIsIgnored() {
        registry.applyRosterSnapshot(List.of(entry("p1", 10, 20, 100)));
        registry.applyRosterSnapshot(null);

        assertThat(registry.ids()).containsExactly("p1");
    }
}
