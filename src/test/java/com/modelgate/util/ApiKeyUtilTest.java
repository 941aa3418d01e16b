package com.modelgate.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ApiKeyUtil.
 */
class ApiKeyUtilTest {

    @Test
    void generateApiKey_HasPrefixAndIsUnique() {
        String first = ApiKeyUtil.generateApiKey();
        String second = ApiKeyUtil.generateApiKey();

        assertTrue(first.startsWith(ApiKeyUtil.API_KEY_PREFIX));
        assertNotEquals(first, second);
    }

    @Test
    void hashApiKey_IsSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ApiKeyUtil.hashApiKey("abc"));
    }
}
