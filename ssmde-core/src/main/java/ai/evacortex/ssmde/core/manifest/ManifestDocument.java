/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.manifest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The recognized fields of a manifest document. Anything else in the file is descriptive and
 * ignored on load.
 *
 * @param manifestId       {@code manifest_id}
 * @param epsA             top-level {@code eps_a}, overridden by {@code align_computation.eps_a}
 * @param epsW             top-level {@code eps_w}, overridden by {@code align_computation.eps_w}
 * @param alignComputation nested computation block
 * @param bands            {@code bands}, a list of objects or of {@code [name, lo, hi]} triples
 * @param bandsTuple       {@code bands_tuple}, consulted when {@code bands} is empty or absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestDocument(
        @JsonProperty("manifest_id") String manifestId,
        @JsonProperty("eps_a") Double epsA,
        @JsonProperty("eps_w") Double epsW,
        @JsonProperty("align_computation") AlignComputation alignComputation,
        @JsonProperty("bands") JsonNode bands,
        @JsonProperty("bands_tuple") JsonNode bandsTuple
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AlignComputation(
            @JsonProperty("eps_a") Double epsA,
            @JsonProperty("eps_w") Double epsW
    ) {}
}
