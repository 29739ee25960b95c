/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.stamp;

import ai.evacortex.ssmde.core.exceptions.InvalidStampException;
import ai.evacortex.ssmde.core.util.HashingUtil;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Audit stamp binding a UTC second, a time-of-day angle, the content digest and the digest of
 * the previous stamp in the chain.
 *
 * <pre>
 *   SSMCLOCK1|2025-01-01T12:00:00Z|theta=180.00|sha256=&lt;64 hex&gt;|prev=&lt;hex or NONE&gt;
 * </pre>
 *
 * @param timestamp capture time, whole seconds
 * @param theta     clock angle in degrees, two decimals
 * @param digest    lowercase SHA-256 hex of the canonical record content
 * @param previous  digest of the previous stamp, or {@code null} when there is none
 */
public record Stamp(Instant timestamp, double theta, String digest, String previous) {

    public static final String TAG = "SSMCLOCK1";
    public static final String NO_PREVIOUS = "NONE";

    private static final Pattern GRAMMAR = Pattern.compile(
            "^SSMCLOCK1\\|(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z)\\|"
                    + "theta=(\\d+\\.\\d{2})\\|sha256=([0-9a-f]{64})\\|prev=([0-9a-f]{8,}|NONE)$");

    public Stamp {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(digest, "digest must not be null");
    }

    public boolean hasPrevious() {
        return previous != null;
    }

    public String format() {
        return TAG
                + "|" + DateTimeFormatter.ISO_INSTANT.format(timestamp)
                + "|theta=" + String.format(Locale.ROOT, "%.2f", theta)
                + "|sha256=" + digest
                + "|prev=" + (previous != null ? previous : NO_PREVIOUS);
    }

    /**
     * SHA-256 of the formatted stamp; the value the next record in a chain references.
     */
    public String chainDigest() {
        return HashingUtil.sha256Hex(format());
    }

    @Override
    public String toString() {
        return format();
    }

    public static boolean matchesGrammar(String text) {
        return text != null && GRAMMAR.matcher(text).matches();
    }

    public static Stamp parse(String text) {
        if (text == null) {
            throw new InvalidStampException("null");
        }
        Matcher m = GRAMMAR.matcher(text);
        if (!m.matches()) {
            throw new InvalidStampException("does not match " + TAG + " grammar: " + text);
        }
        Instant ts;
        try {
            ts = Instant.parse(m.group(1));
        } catch (DateTimeParseException e) {
            throw new InvalidStampException("bad timestamp " + m.group(1), e);
        }
        String prev = NO_PREVIOUS.equals(m.group(4)) ? null : m.group(4);
        return new Stamp(ts, Double.parseDouble(m.group(2)), m.group(3), prev);
    }
}
