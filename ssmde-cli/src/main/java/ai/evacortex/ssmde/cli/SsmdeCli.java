/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import ai.evacortex.ssmde.core.exceptions.InvalidManifestException;
import ai.evacortex.ssmde.core.exceptions.InvalidRecordException;
import ai.evacortex.ssmde.core.exceptions.InvalidSeriesException;
import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.manifest.ManifestCodec;
import ai.evacortex.ssmde.core.manifest.ManifestValidator;
import ai.evacortex.ssmde.core.manifest.ValidationReport;
import ai.evacortex.ssmde.core.record.AlignRecord;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.record.RecordChain;
import ai.evacortex.ssmde.core.verify.ChainVerification;
import ai.evacortex.ssmde.core.verify.ChainVerifier;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * Command line entry point. Records and JSON go to stdout, diagnostics to stderr.
 */
public class SsmdeCli {

    private static final Logger log = LoggerFactory.getLogger(SsmdeCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILED = 2;

    private static final int MANIFEST_CACHE_SIZE = 16;

    private final RecordBuilder builder;
    private final ManifestCache manifests;
    private final PrintStream out;
    private final PrintStream err;

    public SsmdeCli(RecordBuilder builder, PrintStream out, PrintStream err) {
        this.builder = builder;
        this.manifests = new ManifestCache(MANIFEST_CACHE_SIZE);
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new SsmdeCli(new RecordBuilder(), System.out, System.err).run(args);
        System.exit(code);
    }

    public int run(String[] args) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (CliUsageException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (opts.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        Manifest manifest;
        try {
            manifest = manifests.resolve(opts.manifestFrom());
        } catch (InvalidManifestException | UncheckedIOException e) {
            err.println("Failed to load manifest from " + opts.manifestFrom() + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            return dispatch(opts, manifest);
        } catch (CliUsageException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        } catch (InvalidRecordException | InvalidSeriesException e) {
            err.println("Invalid input JSON(s): " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("Invalid argument: " + e.getMessage());
            return EXIT_USAGE;
        } catch (UncheckedIOException e) {
            log.error("I/O failure", e);
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int dispatch(CliOptions opts, Manifest manifest) {
        if (opts.manifestValidate()) {
            return validate(manifest);
        }
        if (!opts.manifestDumpEffective().isEmpty()) {
            JsonlConverter.writeJson(Path.of(opts.manifestDumpEffective()), ManifestCodec.toEffectiveJson(manifest));
            out.println("Wrote effective manifest: " + opts.manifestDumpEffective());
            return EXIT_OK;
        }
        if (opts.bandCard()) {
            BandCard.render(manifest).forEach(out::println);
            return EXIT_OK;
        }
        if (!opts.emitManifest().isEmpty()) {
            JsonlConverter.writeJson(Path.of(opts.emitManifest()), ManifestCodec.template());
            out.println("Wrote manifest template: " + opts.emitManifest());
            return EXIT_OK;
        }
        if (!opts.emitExamples().isEmpty()) {
            Random random = opts.seed() != null ? new Random(opts.seed()) : new Random();
            List<AlignRecord> records = new ExampleGenerator(builder, random).generate(manifest, opts.examples());
            JsonlConverter.writeRecords(Path.of(opts.emitExamples()), records);
            out.println("Wrote " + records.size() + " examples: " + opts.emitExamples());
            return EXIT_OK;
        }
        if (opts.batchRequested()) {
            if (opts.fromJsonl().isEmpty() || opts.toJsonl().isEmpty()) {
                throw new CliUsageException("--from-jsonl and --to-jsonl must be given together");
            }
            int n = new JsonlConverter(builder).convert(Path.of(opts.fromJsonl()), Path.of(opts.toJsonl()), manifest);
            out.println("Converted " + n + " record(s) JSONL -> " + opts.toJsonl());
            return EXIT_OK;
        }
        if (!opts.verifyJsonl().isEmpty()) {
            return verify(Path.of(opts.verifyJsonl()));
        }
        if (opts.demo() || !opts.singleRecordRequested()) {
            demo(manifest, opts.pretty());
            return EXIT_OK;
        }

        RecordInput input = RecordInput.fromArguments(opts.value(), opts.aRaw(), opts.weights(), opts.prev());
        AlignRecord record = builder.build(input.value(), input.series(), manifest, input.weights(), input.prev());
        print(record, opts.pretty());
        return EXIT_OK;
    }

    private int validate(Manifest manifest) {
        ValidationReport report = ManifestValidator.validate(manifest);
        out.println("MANIFEST VALIDATION: " + (report.passed() ? "PASS" : "FAIL"));
        for (ValidationReport.Diagnostic d : report.diagnostics()) {
            out.println("- " + d);
        }
        return report.passed() ? EXIT_OK : EXIT_FAILED;
    }

    private int verify(Path path) {
        ChainVerification result = ChainVerifier.verify(JsonlConverter.readRecords(path));
        out.println("CHAIN VERIFICATION: " + (result.intact() ? "PASS" : "FAIL")
                + " (" + result.checked() + " record(s), " + result.segments() + " segment(s))");
        result.issues().forEach(i -> out.println("- " + i));
        return result.intact() ? EXIT_OK : EXIT_FAILED;
    }

    private void demo(Manifest manifest, boolean pretty) {
        RecordChain chain = RecordChain.start(builder, manifest);

        ObjectNode v1 = CanonicalJson.newObject().put("temperature_K", 279.92).put("a_phase", -0.62);
        ObjectNode v2 = CanonicalJson.newObject()
                .put("refund_amount_usd", 184.50).put("model_score", 0.912).put("stress_score", 0.35);
        ObjectNode v3 = CanonicalJson.newObject().put("V_rms", 253.7).put("pf", 0.81).put("stress_score", 0.72);

        print(chain.append(v1, new double[]{-0.60, -0.64, -0.62}), pretty);
        print(chain.append(v2, new double[]{0.10, 0.05, 0.20}), pretty);
        print(chain.append(v3, new double[]{-0.55, -0.68, -0.75}), pretty);
    }

    private void print(AlignRecord record, boolean pretty) {
        out.println(pretty ? CanonicalJson.pretty(record.toJson()) : record.toCanonicalJson());
    }
}
