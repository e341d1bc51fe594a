package com.gateflow.core.persistence;

import com.gateflow.core.model.Gate;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StateKeysTest {

    @Test
    void keysFollowTheRecordLayout() {
        assertEquals("docsearch-login-pipeline", StateKeys.pipeline("docsearch", "login"));
        assertEquals("docsearch-login-gate2-output", StateKeys.gateOutput("docsearch", "login", Gate.ELEMENT_MAPPING));
        assertEquals("docsearch-login-gate4-healing", StateKeys.healing("docsearch", "login"));
        assertEquals("docsearch-login-audit", StateKeys.audit("docsearch", "login"));
        assertEquals("docsearch-login-learnings", StateKeys.learnings("docsearch", "login"));
    }

    @Test
    void partsAreSlugged() {
        assertEquals("doc-search-user-group-management-pipeline",
                StateKeys.pipeline("  Doc Search ", "User Group_Management!"));
    }

    @Test
    void differentSpellingsMapToTheSameKey() {
        assertEquals(StateKeys.pipeline("docsearch", "user-groups"), StateKeys.pipeline("DocSearch", "User Groups"));
    }

    @Test
    void blankOrSymbolOnlyPartsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> StateKeys.slug(" "));
        assertThrows(IllegalArgumentException.class, () -> StateKeys.slug(null));
        assertThrows(IllegalArgumentException.class, () -> StateKeys.slug("---"));
    }
}
