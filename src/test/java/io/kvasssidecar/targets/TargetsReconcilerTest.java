package io.kvasssidecar.targets;

import io.kvasssidecar.enums.TargetState;
import io.kvasssidecar.models.ScrapeStatus;
import io.kvasssidecar.models.Target;
import io.kvasssidecar.models.TargetsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for TargetsReconciler.
 */
class TargetsReconcilerTest {

    private TargetsReconciler reconciler;
    private TargetsSnapshot snapshot;

    @BeforeEach
    void setUp() {
        reconciler = new TargetsReconciler();
        snapshot = new TargetsSnapshot();
    }

    @Test
    void testNewTargetsGetFreshStatus() {
        // Given
        Map<String, List<Target>> desired = Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL)));

        // When
        ReconcileResult result = reconciler.reconcile(snapshot, desired);

        // Then
        assertThat(snapshot.getTargets()).isEqualTo(desired);
        assertThat(snapshot.getStatus()).containsOnlyKeys(1L);
        ScrapeStatus status = snapshot.getStatus().get(1L);
        assertThat(status.getSeries()).isEqualTo(10L);
        assertThat(status.getScrapeAttempts()).isZero();
        assertThat(status.getTargetState()).isEqualTo(TargetState.NORMAL);
        assertThat(result.added()).isEqualTo(1);
        assertThat(result.kept()).isZero();
        assertThat(result.removed()).isZero();
        assertThat(result.transitions()).isEmpty();
    }

    @Test
    void testExistingStatusIsCarriedForward() {
        // Given: a tracked target that has been scraped
        reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL))));
        ScrapeStatus before = snapshot.getStatus().get(1L);
        before.setScrapeAttempts(7);
        before.updateSeries(99);

        // When: the same hash arrives again with a different series estimate
        ReconcileResult result = reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 500L, TargetState.NORMAL))));

        // Then
        ScrapeStatus after = snapshot.getStatus().get(1L);
        assertThat(after).isSameAs(before);
        assertThat(after.getScrapeAttempts()).isEqualTo(7L);
        assertThat(after.getSeries()).isEqualTo(99L);
        assertThat(result.kept()).isEqualTo(1);
        assertThat(result.added()).isZero();
    }

    @Test
    void testNormalToInTransferResetsAttempts() {
        // Given
        reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL))));
        snapshot.getStatus().get(1L).setScrapeAttempts(42);
        Target transferring = new Target(1L, 10L, TargetState.IN_TRANSFER);

        // When
        ReconcileResult result = reconciler.reconcile(snapshot, Map.of("job1", List.of(transferring)));

        // Then
        ScrapeStatus status = snapshot.getStatus().get(1L);
        assertThat(status.getScrapeAttempts()).isZero();
        assertThat(status.getTargetState()).isEqualTo(TargetState.IN_TRANSFER);
        assertThat(result.transitions()).containsExactly(new TargetTransition("job1", transferring));
    }

    @Test
    void testStayingInTransferKeepsAttempts() {
        // Given
        reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.IN_TRANSFER))));
        snapshot.getStatus().get(1L).setScrapeAttempts(3);

        // When
        ReconcileResult result = reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.IN_TRANSFER))));

        // Then
        assertThat(snapshot.getStatus().get(1L).getScrapeAttempts()).isEqualTo(3L);
        assertThat(result.transitions()).isEmpty();
    }

    @Test
    void testInTransferBackToNormalKeepsAttempts() {
        // Given
        reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.IN_TRANSFER))));
        snapshot.getStatus().get(1L).setScrapeAttempts(5);

        // When
        ReconcileResult result = reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL))));

        // Then
        ScrapeStatus status = snapshot.getStatus().get(1L);
        assertThat(status.getScrapeAttempts()).isEqualTo(5L);
        assertThat(status.getTargetState()).isEqualTo(TargetState.NORMAL);
        assertThat(result.transitions()).isEmpty();
    }

    @Test
    void testNewTargetArrivingInTransferIsReportedAsTransition() {
        // When
        ReconcileResult result = reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.IN_TRANSFER))));

        // Then
        assertThat(result.transitions()).hasSize(1);
        assertThat(snapshot.getStatus().get(1L).getScrapeAttempts()).isZero();
    }

    @Test
    void testMissingHashesAreDropped() {
        // Given
        Map<String, List<Target>> first = new LinkedHashMap<>();
        first.put("job1", List.of(new Target(1L, 10L, TargetState.NORMAL), new Target(2L, 20L, TargetState.NORMAL)));
        first.put("job2", List.of(new Target(3L, 30L, TargetState.NORMAL)));
        reconciler.reconcile(snapshot, first);

        // When: job2 disappears and hash 2 leaves job1
        ReconcileResult result = reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL))));

        // Then
        assertThat(snapshot.getTargets()).containsOnlyKeys("job1");
        assertThat(snapshot.getStatus()).containsOnlyKeys(1L);
        assertThat(result.removed()).isEqualTo(2);
    }

    @Test
    void testStatusKeysMatchTargetHashes() {
        // Given
        Map<String, List<Target>> desired = new LinkedHashMap<>();
        desired.put("job1", List.of(new Target(1L, 1L, TargetState.NORMAL), new Target(2L, 1L, TargetState.NORMAL)));
        desired.put("job2", List.of(new Target(3L, 1L, TargetState.IN_TRANSFER)));
        desired.put("empty", List.of());

        // When
        reconciler.reconcile(snapshot, desired);

        // Then
        assertThat(snapshot.getStatus()).containsOnlyKeys(1L, 2L, 3L);
    }

    @Test
    void testSameHashInTwoJobsSharesOneStatus() {
        // Given
        Map<String, List<Target>> desired = new LinkedHashMap<>();
        desired.put("job1", List.of(new Target(1L, 10L, TargetState.NORMAL)));
        desired.put("job2", List.of(new Target(1L, 10L, TargetState.NORMAL)));

        // When
        ReconcileResult result = reconciler.reconcile(snapshot, desired);

        // Then
        assertThat(snapshot.getStatus()).hasSize(1);
        assertThat(result.added()).isEqualTo(1);
        assertThat(result.tracked()).isEqualTo(1);
    }

    @Test
    void testNullDesiredSetClearsEverything() {
        // Given
        reconciler.reconcile(snapshot, Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL))));

        // When
        ReconcileResult result = reconciler.reconcile(snapshot, null);

        // Then
        assertThat(snapshot.getTargets()).isEmpty();
        assertThat(snapshot.getStatus()).isEmpty();
        assertThat(result.removed()).isEqualTo(1);
    }

    @Test
    void testDesiredSetIsCopied() {
        // Given
        List<Target> job1 = new ArrayList<>(List.of(new Target(1L, 10L, TargetState.NORMAL)));
        Map<String, List<Target>> desired = new LinkedHashMap<>();
        desired.put("job1", job1);
        reconciler.reconcile(snapshot, desired);

        // When
        desired.put("job2", List.of(new Target(2L, 20L, TargetState.NORMAL)));
        job1.clear();

        // Then
        assertThat(snapshot.getTargets()).isNotSameAs(desired);
        assertThat(snapshot.getTargets()).containsOnlyKeys("job1");
        assertThat(snapshot.getTargets().get("job1")).hasSize(1);
        assertThat(snapshot.getStatus()).containsOnlyKeys(1L);
    }
}
