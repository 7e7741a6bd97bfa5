package net.shelfsync.core.key;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoordinationKeysTest {

    @Test
    void lockKey_hasComponentTypeAndResource() {
        assertEquals("shelfsync:CollectionImport:42", CoordinationKeys.lock("CollectionImport", "42"));
        assertEquals("shelfsync:Record:urn:isbn:123", CoordinationKeys.lock("Record", "urn:isbn:123"));
    }

    @Test
    void uploadKeys() {
        assertEquals("shelfsync:upload:lib-1:run-9", CoordinationKeys.uploadSession("lib-1:run-9"));
        assertEquals("shelfsync:upload:s1:out/a.mrc", CoordinationKeys.uploadBuffer("s1", "out/a.mrc"));
        assertEquals("shelfsync:IdentifierSet:lib-1:run-9", CoordinationKeys.identifierSet("lib-1", "run-9"));
    }

    @Test
    void invalidParts_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> CoordinationKeys.of(" ", List.of("x")));
        assertThrows(IllegalArgumentException.class, () -> CoordinationKeys.of("Record", Arrays.asList("a", null)));
    }
}
