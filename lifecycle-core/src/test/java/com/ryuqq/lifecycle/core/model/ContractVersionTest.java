package com.ryuqq.lifecycle.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContractVersion 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ContractVersionTest {

    @Test
    void parse_WellFormed_Succeeds() {
        // When
        ContractVersion version = ContractVersion.parse("1.2.3");

        // Then
        assertEquals(1, version.major());
        assertEquals(2, version.minor());
        assertEquals(3, version.patch());
        assertEquals("1.2.3", version.toString());
    }

    @Test
    void parse_Malformed_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ContractVersion.parse("1.2"));
        assertThrows(IllegalArgumentException.class, () -> ContractVersion.parse("1.x.0"));
        assertThrows(IllegalArgumentException.class, () -> ContractVersion.parse(""));
        assertThrows(IllegalArgumentException.class, () -> ContractVersion.parse(null));
    }

    @Test
    void constructor_NegativeComponent_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ContractVersion.of(1, -1, 0));
    }

    @Test
    void satisfies_SameMajorNewerOrEqual_True() {
        ContractVersion loaded = ContractVersion.of(1, 4, 0);

        assertTrue(loaded.satisfies(ContractVersion.of(1, 0, 0)));
        assertTrue(loaded.satisfies(ContractVersion.of(1, 4, 0)));
    }

    @Test
    void satisfies_OlderOrDifferentMajor_False() {
        ContractVersion loaded = ContractVersion.of(1, 4, 0);

        assertFalse(loaded.satisfies(ContractVersion.of(1, 5, 0)));
        assertFalse(loaded.satisfies(ContractVersion.of(2, 0, 0)));
        assertFalse(ContractVersion.of(2, 0, 0).satisfies(ContractVersion.of(1, 0, 0)));
    }

    @Test
    void compareTo_OrdersByComponents() {
        assertTrue(ContractVersion.of(1, 0, 9).compareTo(ContractVersion.of(1, 1, 0)) < 0);
        assertTrue(ContractVersion.of(2, 0, 0).compareTo(ContractVersion.of(1, 9, 9)) > 0);
        assertEquals(0, ContractVersion.of(1, 2, 3).compareTo(ContractVersion.parse("1.2.3")));
    }
}
