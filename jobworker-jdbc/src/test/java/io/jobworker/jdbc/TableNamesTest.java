package io.jobworker.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void acceptsIdentifiers() {
        assertEquals("jobs", TableNames.validate("jobs"));
        assertEquals("_bot_jobs2", TableNames.validate("_bot_jobs2"));
    }

    @Test
    void rejectsAnythingElse() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("2jobs"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("jobs;--"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("public.jobs"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }
}
