/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.stamp;

import ai.evacortex.ssmde.core.util.HashingUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Produces {@link Stamp}s from the wall clock. Wall-clock time is not monotonic across
 * restarts; theta is a human freshness hint, not a security primitive.
 */
public class RecordStamper {

    private static final Logger log = LoggerFactory.getLogger(RecordStamper.class);

    private static final int SECONDS_PER_DAY = 86_400;

    private final Clock clock;

    public RecordStamper() {
        this(Clock.systemUTC());
    }

    public RecordStamper(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param content        the pre-stamp record content
     * @param previousDigest digest of the previous stamp; anything shorter than eight hex
     *                       characters is recorded as {@code NONE}
     */
    public Stamp stamp(JsonNode content, String previousDigest) {
        Objects.requireNonNull(content, "content must not be null");

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        String digest = HashingUtil.computeContentDigest(content);

        String prev = HashingUtil.normalizePreviousDigest(previousDigest);
        if (prev == null && previousDigest != null && !previousDigest.isBlank()) {
            log.warn("Ignoring invalid previous digest '{}'; stamping with {}", previousDigest, Stamp.NO_PREVIOUS);
        }

        return new Stamp(now, theta(now), digest, prev);
    }

    /**
     * Clock angle of the UTC time of day: {@code (secondOfDay mod 86400) * 360 / 86400},
     * rounded to two decimals. Rounding is half-even on the exact binary value of the double
     * quotient, so ties such as 0.025 resolve by their representation error.
     */
    public static double theta(Instant instant) {
        int secondOfDay = LocalTime.ofInstant(instant, ZoneOffset.UTC).toSecondOfDay() % SECONDS_PER_DAY;
        double degrees = secondOfDay * 360.0 / SECONDS_PER_DAY;
        return new BigDecimal(degrees).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
