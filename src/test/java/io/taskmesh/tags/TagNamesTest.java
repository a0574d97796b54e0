package io.taskmesh.tags;

import io.taskmesh.error.ReservedNameException;
import io.taskmesh.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagNamesTest {
    @Test
    void sanitizeBranchShouldProduceValidTagNames() {
        assertEquals("feature-new_thing", TagNames.sanitizeBranch("feature/New_Thing!!"));
        assertEquals("a-b", TagNames.sanitizeBranch("--a//b--"));
        assertEquals("", TagNames.sanitizeBranch("///"));
        assertEquals(50, TagNames.sanitizeBranch("x".repeat(80)).length());
    }

    @Test
    void integrationBranchesDoNotGetTags() {
        assertFalse(TagNames.isValidBranchForTag("main"));
        assertFalse(TagNames.isValidBranchForTag("Develop"));
        assertFalse(TagNames.isValidBranchForTag("HEAD"));
        assertFalse(TagNames.isValidBranchForTag("///"));
        assertFalse(TagNames.isValidBranchForTag(null));
        assertTrue(TagNames.isValidBranchForTag("feature/login"));
    }

    @Test
    void newNamesMustBeWellFormedAndUnreserved() {
        assertEquals("feature_1-b", TagNames.requireValidNewName("feature_1-b"));
        assertThrows(ValidationException.class, () -> TagNames.requireValidNewName(""));
        assertThrows(ValidationException.class, () -> TagNames.requireValidNewName("has space"));
        assertThrows(ValidationException.class, () -> TagNames.requireValidNewName("dot.ted"));
        assertThrows(ReservedNameException.class, () -> TagNames.requireValidNewName("master"));
        assertThrows(ReservedNameException.class, () -> TagNames.requireValidNewName("Main"));
        assertThrows(ReservedNameException.class, () -> TagNames.requireValidNewName("DEFAULT"));
    }
}
