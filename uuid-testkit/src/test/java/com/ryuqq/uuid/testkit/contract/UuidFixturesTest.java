package com.ryuqq.uuid.testkit.contract;

import com.ryuqq.uuid.core.model.UuidValidator;
import com.ryuqq.uuid.core.model.Uuids;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fixture sanity checks.
 *
 * @author UUID SDK Team
 * @since 1.0.0
 */
class UuidFixturesTest {

    @Test
    void validByVersion_AreValidAndOrderedByVersion() {
        for (int i = 0; i < UuidFixtures.VALID_BY_VERSION.size(); i++) {
            String value = UuidFixtures.VALID_BY_VERSION.get(i);
            assertTrue(UuidValidator.isValid(value), value);
            assertEquals(i + 1, Uuids.version(value));
        }
    }

    @Test
    void malformed_AreNotValid() {
        for (String value : UuidFixtures.MALFORMED) {
            assertFalse(UuidValidator.isValid(value), value);
        }
    }

    @Test
    void arbitraryBytes_ReturnsFreshArray() {
        assertNotSame(UuidFixtures.arbitraryBytes(), UuidFixtures.arbitraryBytes());
        assertFalse(UuidValidator.isValidBytes(UuidFixtures.arbitraryBytes()));
    }
}
