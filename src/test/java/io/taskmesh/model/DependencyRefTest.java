package io.taskmesh.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DependencyRefTest {
    @Test
    void parseShouldDistinguishTasksFromSubtasks() {
        assertEquals(DependencyRef.task(7), DependencyRef.parse("7"));
        assertEquals(DependencyRef.subtask(7, 2), DependencyRef.parse("7.2"));
        assertEquals(DependencyRef.task(3), DependencyRef.parse(" 3 "));
    }

    @Test
    void parseShouldRejectMalformedIds() {
        assertThrows(IllegalArgumentException.class, () -> DependencyRef.parse(""));
        assertThrows(IllegalArgumentException.class, () -> DependencyRef.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> DependencyRef.parse("1.x"));
        assertThrows(IllegalArgumentException.class, () -> DependencyRef.parse("0"));
        assertThrows(IllegalArgumentException.class, () -> DependencyRef.parse("-4"));
    }

    @Test
    void bareIntegersInSubtaskListsBelowLimitAreSiblings() {
        assertEquals(DependencyRef.subtask(5, 2), DependencyRef.fromSubtaskInt(5, 2));
        assertEquals(DependencyRef.subtask(5, 99), DependencyRef.fromSubtaskInt(5, 99));
        assertEquals(DependencyRef.task(100), DependencyRef.fromSubtaskInt(5, 100));
        assertEquals(DependencyRef.task(150), DependencyRef.fromSubtaskInt(5, 150));
    }

    @Test
    void orderPutsTasksBeforeSubtasks() {
        List<DependencyRef> refs = new ArrayList<>(List.of(
                DependencyRef.subtask(1, 2),
                DependencyRef.task(3),
                DependencyRef.task(1),
                DependencyRef.subtask(1, 1)
        ));
        refs.sort(DependencyRef.ORDER);
        assertEquals("[1, 3, 1.1, 1.2]", refs.toString());
    }
}
