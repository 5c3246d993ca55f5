package io.paradedb.operator.crd.paradedb.status;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.paradedb.operator.core.CRPhase;
import io.paradedb.operator.core.Conditions;
import io.paradedb.operator.core.OperatorConfig;
import io.paradedb.operator.crd.paradedb.ParadeDB;
import io.paradedb.operator.crd.paradedb.ParadeDBStatus;
import org.jspecify.annotations.NullMarked;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@NullMarked
class StatusAggregatorTest {
    private StatusAggregator statusAggregator;
    private ParadeDB paradeDB;
    private ParadeDBStatus status;

    @BeforeEach
    void setUp() {
        statusAggregator = new StatusAggregator(
                mock(KubernetesClient.class),
                mock(OperatorConfig.class)
        );

        paradeDB = new ParadeDB();
        paradeDB.getMetadata().setName("search");
        paradeDB.getMetadata().setNamespace("default");
        paradeDB.getMetadata().setGeneration(4L);
        paradeDB.getSpec().setReplicas(3);

        status = new ParadeDBStatus();
    }

    @Test
    @DisplayName("All replicas ready means Running and Ready")
    void applyReplicaState_whenAllReady_shouldBeRunning() {
        // given / when
        statusAggregator.applyReplicaState(paradeDB, status, 3);

        // then
        assertThat(status.getPhase()).isEqualTo(CRPhase.RUNNING);
        assertThat(status.getMessage()).isEqualTo("ParadeDB is running");
        assertThat(status.getReadyReplicas()).isEqualTo(3);
        assertThat(status.getObservedGeneration()).isEqualTo(4L);

        var conditions = status.getConditions();
        assertThat(Conditions.isTrue(conditions, Conditions.TYPE_READY)).isTrue();
        assertThat(Conditions.isTrue(conditions, Conditions.TYPE_PROGRESSING)).isFalse();
        assertThat(Conditions.isTrue(conditions, Conditions.TYPE_DEGRADED)).isFalse();
        assertThat(Conditions.find(conditions, Conditions.TYPE_READY))
                .get()
                .satisfies(condition -> assertThat(condition.getReason()).isEqualTo("AllReplicasReady"));
    }

    @Test
    @DisplayName("Some replicas ready means Updating and Progressing")
    void applyReplicaState_whenPartiallyReady_shouldBeUpdating() {
        // given / when
        statusAggregator.applyReplicaState(paradeDB, status, 1);

        // then
        assertThat(status.getPhase()).isEqualTo(CRPhase.UPDATING);
        assertThat(status.getMessage()).isEqualTo("Scaling: 1/3 replicas ready");
        assertThat(Conditions.isTrue(status.getConditions(), Conditions.TYPE_PROGRESSING)).isTrue();
        assertThat(Conditions.isTrue(status.getConditions(), Conditions.TYPE_READY)).isFalse();
        assertThat(Conditions.find(status.getConditions(), Conditions.TYPE_PROGRESSING))
                .get()
                .satisfies(condition -> assertThat(condition.getReason()).isEqualTo("Scaling"));
    }

    @Test
    @DisplayName("No replica ready means Creating")
    void applyReplicaState_whenNoneReady_shouldBeCreating() {
        // given / when
        statusAggregator.applyReplicaState(paradeDB, status, 0);

        // then
        assertThat(status.getPhase()).isEqualTo(CRPhase.CREATING);
        assertThat(status.getMessage()).isEqualTo("Waiting for replicas to become ready");
        assertThat(status.getReadyReplicas()).isZero();
        assertThat(Conditions.find(status.getConditions(), Conditions.TYPE_PROGRESSING))
                .get()
                .satisfies(condition -> assertThat(condition.getReason()).isEqualTo("Creating"));
    }

    @Test
    @DisplayName("During a scale-down the reported count never exceeds the desired count")
    void applyReplicaState_whenScalingDown_shouldCapReadyReplicas() {
        // given / when
        statusAggregator.applyReplicaState(paradeDB, status, 5);

        // then
        assertThat(status.getPhase()).isEqualTo(CRPhase.UPDATING);
        assertThat(status.getMessage()).isEqualTo("Scaling down: 5/3 replicas ready");
        assertThat(status.getReadyReplicas()).isEqualTo(3);
    }

    @ParameterizedTest
    @CsvSource({"0", "1", "2", "3", "4", "10"})
    @DisplayName("Ready replicas are bounded by the desired replicas")
    void applyReplicaState_readyReplicasNeverExceedDesired(int ready) {
        // given / when
        statusAggregator.applyReplicaState(paradeDB, status, ready);

        // then
        assertThat(status.getReadyReplicas()).isBetween(0, paradeDB.getSpec().getReplicas());
    }

    @Test
    @DisplayName("A recovered resource is no longer Degraded")
    void applyReplicaState_afterFailure_shouldClearDegraded() {
        // given
        Conditions.set(status.getConditions(), Conditions.TYPE_DEGRADED, true, "ReconciliationFailed", "StatefulSet: boom", 3L);
        status.setPhase(CRPhase.FAILED);

        // when
        statusAggregator.applyReplicaState(paradeDB, status, 3);

        // then
        assertThat(status.getPhase()).isEqualTo(CRPhase.RUNNING);
        assertThat(Conditions.isTrue(status.getConditions(), Conditions.TYPE_DEGRADED)).isFalse();
        assertThat(status.getConditions())
                .filteredOn(condition -> Conditions.TYPE_DEGRADED.equals(condition.getType()))
                .hasSize(1);
    }
}
