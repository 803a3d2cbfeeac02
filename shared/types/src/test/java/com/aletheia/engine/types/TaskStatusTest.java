package com.aletheia.engine.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TaskStatusTest {

    @Test
    void fromIdResolvesEveryStatus() {
        for (TaskStatus status : TaskStatus.values()) {
            assertThat(TaskStatus.fromId(status.id())).isSameAs(status);
        }
    }

    @Test
    void fromIdRejectsUnknownId() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> TaskStatus.fromId(42))
                .withMessageContaining("42");
    }

    @Test
    void onlyAssignedAndInProgressAcceptSubmissions() {
        assertThat(TaskStatus.values())
                .filteredOn(TaskStatus::acceptsSubmissions)
                .containsExactly(TaskStatus.ASSIGNED, TaskStatus.IN_PROGRESS);
    }

    @Test
    void fraudLevelsOrderedBySeverity() {
        assertThat(FraudLevel.CRITICAL.isAtLeast(FraudLevel.HIGH)).isTrue();
        assertThat(FraudLevel.MEDIUM.isAtLeast(FraudLevel.HIGH)).isFalse();
        assertThat(FraudLevel.values())
                .filteredOn(FraudLevel::isFraudulent)
                .containsExactly(FraudLevel.HIGH, FraudLevel.CRITICAL);
    }
}
