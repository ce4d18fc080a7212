package com.checkpoint.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FlagStatus}.
 */
class FlagStatusTest {

    @Test
    void newFlag_isUnclassifiedWithEmptyTexts() {
        FlagStatus flag = new FlagStatus("dry-run");

        assertThat(flag.getName()).isEqualTo("dry-run");
        assertThat(flag.getStatus()).isNull();
        assertThat(flag.getShortForm()).isEmpty();
        assertThat(flag.getDescription()).isEmpty();
        assertThat(flag.getActualBehavior()).isEmpty();
        assertThat(flag.getConflicts()).isEmpty();
    }

    @Test
    void ghost_isPlannedOnly() {
        FlagStatus ghost = FlagStatus.ghost("turbo");

        assertThat(ghost.isDefinedInPlanning()).isTrue();
        assertThat(ghost.isDefinedInCode()).isFalse();
        assertThat(ghost.getStatus()).isEqualTo(ImplementationStatus.PLANNED_NOT_IMPLEMENTED);
    }

    @Test
    void conflicts_accumulateAndAreReadOnly() {
        FlagStatus flag = new FlagStatus("json");
        FlagConflict conflict = new FlagConflict(ConflictType.PLANNING_MISMATCH, "planning", "code",
            "planned only", ConflictSeverity.HIGH);

        flag.addConflict(conflict);
        flag.addConflict(conflict);

        assertThat(flag.getConflicts()).hasSize(2);
        assertThat(flag.hasConflict(ConflictType.PLANNING_MISMATCH)).isTrue();
        assertThat(flag.hasConflict(ConflictType.ORPHANED_FLAG)).isFalse();
        assertThatThrownBy(() -> flag.getConflicts().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
