package me.golemcore.mindbase.collector.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoleAliasesTest {

    @Test
    void shouldMapUserAliases() {
        assertEquals("user", RoleAliases.normalize("Human"));
        assertEquals("user", RoleAliases.normalize(" prompt "));
        assertEquals("user", RoleAliases.normalize("USER"));
    }

    @Test
    void shouldMapAssistantAliases() {
        assertEquals("assistant", RoleAliases.normalize("Claude"));
        assertEquals("assistant", RoleAliases.normalize("cascade"));
        assertEquals("assistant", RoleAliases.normalize("model"));
    }

    @Test
    void shouldMapSystemAliases() {
        assertEquals("system", RoleAliases.normalize("instruction"));
        assertEquals("system", RoleAliases.normalize("System"));
    }

    @Test
    void shouldDefaultUnknownAndNullToAssistant() {
        assertEquals("assistant", RoleAliases.normalize("narrator"));
        assertEquals("assistant", RoleAliases.normalize(null));
    }

    @Test
    void shouldRecognizeCanonicalRoles() {
        assertTrue(RoleAliases.isCanonical("user"));
        assertTrue(RoleAliases.isCanonical("system"));
        assertFalse(RoleAliases.isCanonical("human"));
    }
}
