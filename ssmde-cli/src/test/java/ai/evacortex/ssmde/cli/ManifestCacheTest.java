/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.exceptions.InvalidManifestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ManifestCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void resolve_defaultsWhenSourceIsEmpty() {
        ManifestCache cache = new ManifestCache(4);
        assertSame(Manifest.DEFAULT, cache.resolve(""));
        assertSame(Manifest.DEFAULT, cache.resolve(null));
    }

    @Test
    void resolve_parsesInlineJson() {
        ManifestCache cache = new ManifestCache(4);
        assertEquals("INLINE", cache.resolve("{\"manifest_id\":\"INLINE\"}").manifestId());
        assertEquals(0, cache.size());
        assertThrows(InvalidManifestException.class, () -> cache.resolve("{broken"));
    }

    @Test
    void get_cachesUntilFileChanges() throws Exception {
        Path file = tempDir.resolve("m.json");
        Files.writeString(file, "{\"manifest_id\":\"V1\"}");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2025-01-01T00:00:00Z")));

        ManifestCache cache = new ManifestCache(4);
        Manifest first = cache.resolve(file.toString());
        assertSame(first, cache.resolve(file.toString()));
        assertEquals("V1", first.manifestId());

        Files.writeString(file, "{\"manifest_id\":\"V2\"}");
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2025-01-02T00:00:00Z")));
        assertEquals("V2", cache.resolve(file.toString()).manifestId());
    }
}
