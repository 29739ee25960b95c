/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.verify;

import ai.evacortex.ssmde.core.exceptions.InvalidStampException;
import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.record.AlignRecord;
import ai.evacortex.ssmde.core.stamp.Stamp;
import ai.evacortex.ssmde.core.util.HashingUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-derives content digests and chain links of emitted records.
 *
 * <p>A record passes when its stamp matches the grammar, its {@code sha256} equals the digest
 * of its {@code value, align, band, manifest_id} fields, and its {@code prev} is either
 * {@code NONE} or the SHA-256 of the preceding record's stamp.</p>
 */
public final class ChainVerifier {

    private static final Logger log = LoggerFactory.getLogger(ChainVerifier.class);

    private ChainVerifier() {}

    public static ChainVerification verify(List<? extends JsonNode> records) {
        List<ChainVerification.Issue> issues = new ArrayList<>();
        int segments = 0;
        String expectedPrev = null;

        for (int i = 0; i < records.size(); i++) {
            JsonNode rec = records.get(i);
            JsonNode stampNode = rec == null ? null : rec.get(AlignRecord.STAMP);
            if (stampNode == null || !stampNode.isTextual()) {
                issues.add(new ChainVerification.Issue(i, "missing stamp"));
                expectedPrev = null;
                continue;
            }
            String stampText = stampNode.textValue();

            Stamp stamp;
            try {
                stamp = Stamp.parse(stampText);
            } catch (InvalidStampException e) {
                issues.add(new ChainVerification.Issue(i, e.getMessage()));
                expectedPrev = HashingUtil.sha256Hex(stampText);
                continue;
            }

            String actual = HashingUtil.computeContentDigest(content(rec));
            if (!actual.equals(stamp.digest())) {
                issues.add(new ChainVerification.Issue(i, "content digest mismatch: stamp has "
                        + stamp.digest() + ", content hashes to " + actual));
            }

            if (!stamp.hasPrevious() || i == 0) {
                segments++;
            } else if (expectedPrev == null) {
                issues.add(new ChainVerification.Issue(i, "prev " + stamp.previous()
                        + " follows a record without a stamp"));
            } else if (!expectedPrev.equalsIgnoreCase(stamp.previous())) {
                issues.add(new ChainVerification.Issue(i, "chain break: prev " + stamp.previous()
                        + " does not reference preceding stamp " + expectedPrev));
            }

            expectedPrev = HashingUtil.sha256Hex(stampText);
        }

        if (!issues.isEmpty()) {
            log.warn("Chain verification found {} issue(s) in {} record(s)", issues.size(), records.size());
        }
        return new ChainVerification(records.size(), segments, issues);
    }

    private static ObjectNode content(JsonNode rec) {
        ObjectNode node = CanonicalJson.newObject();
        for (String field : List.of(AlignRecord.VALUE, AlignRecord.ALIGN, AlignRecord.BAND, AlignRecord.MANIFEST_ID)) {
            JsonNode v = rec.get(field);
            if (v != null) node.set(field, v);
        }
        return node;
    }
}
