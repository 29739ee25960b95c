/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.util;

import ai.evacortex.ssmde.core.json.CanonicalJson;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

public class HashingUtil {

    public static final int SHA256_HEX_LENGTH = 64;
    public static final int MIN_PREVIOUS_DIGEST_LENGTH = 8;

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

    private static final ThreadLocal<MessageDigest> SHA256_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 algorithm not available", e);
        }
    });

    private HashingUtil() {}

    public static byte[] sha256(String input) {
        MessageDigest digest = SHA256_DIGEST.get();
        digest.reset();
        return digest.digest(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(String input) {
        return HexFormat.of().formatHex(sha256(input));
    }

    /**
     * SHA-256 over the canonical JSON form of {@code content}.
     */
    public static String computeContentDigest(JsonNode content) {
        return sha256Hex(CanonicalJson.write(content));
    }

    /**
     * A previous-stamp reference is accepted when it is a hex string of at least
     * {@value #MIN_PREVIOUS_DIGEST_LENGTH} characters.
     */
    public static boolean isValidPreviousDigest(String candidate) {
        return candidate != null
                && candidate.length() >= MIN_PREVIOUS_DIGEST_LENGTH
                && HEX.matcher(candidate).matches();
    }

    /**
     * Lowercase form of a valid previous-stamp reference, or {@code null} when
     * {@code candidate} is not one.
     */
    public static String normalizePreviousDigest(String candidate) {
        return isValidPreviousDigest(candidate) ? candidate.toLowerCase(Locale.ROOT) : null;
    }
}
