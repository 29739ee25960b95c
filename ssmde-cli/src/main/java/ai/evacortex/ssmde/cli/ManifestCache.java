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
import ai.evacortex.ssmde.core.manifest.ManifestCodec;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Resolves manifest sources. Files are cached per path and modification time, so an edited
 * manifest is re-read on the next lookup.
 */
public class ManifestCache {

    private record Key(Path path, long modifiedMillis) {}

    private final LoadingCache<Key, Manifest> cache;

    public ManifestCache(int maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build(key -> ManifestCodec.read(key.path()));
    }

    /**
     * The default manifest for an empty source, the cached file manifest for a file path,
     * otherwise the source parsed as inline JSON.
     */
    public Manifest resolve(String source) {
        if (source == null || source.isBlank()) {
            return Manifest.DEFAULT;
        }
        Path path = existingFile(source);
        return path != null ? get(path) : ManifestCodec.parse(source);
    }

    public Manifest get(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        try {
            return cache.get(new Key(normalized, Files.getLastModifiedTime(normalized).toMillis()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat manifest " + normalized, e);
        }
    }

    public long size() {
        return cache.estimatedSize();
    }

    private static Path existingFile(String source) {
        try {
            Path p = Path.of(source);
            return Files.isRegularFile(p) ? p : null;
        } catch (InvalidPathException e) {
            // not a usable path, so it is parsed as inline JSON
            return null;
        }
    }
}
