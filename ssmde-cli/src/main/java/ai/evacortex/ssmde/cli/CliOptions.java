/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import java.util.Set;

/**
 * Parsed command line. Empty strings mean "not given".
 */
public record CliOptions(
        boolean demo,
        boolean pretty,
        boolean help,
        String value,
        String aRaw,
        String prev,
        String weights,
        String manifestFrom,
        String manifestDumpEffective,
        boolean manifestValidate,
        boolean bandCard,
        String emitManifest,
        String emitExamples,
        int examples,
        Long seed,
        String fromJsonl,
        String toJsonl,
        String verifyJsonl
) {

    static final int DEFAULT_EXAMPLES = 10;

    private static final Set<String> FLAGS = Set.of(
            "--demo", "--pretty", "--help", "--manifest-validate", "--band-card");

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: ssmde [options]",
            "  --demo                              print three chained example records",
            "  --value <json> --a_raw <json>       build one record",
            "      [--weights <json>] [--prev <hex>] [--pretty]",
            "  --manifest-from <json|path>         use this manifest instead of the default",
            "  --manifest-dump-effective <path>    write the effective manifest",
            "  --manifest-validate                 validate the manifest (exit 2 on failure)",
            "  --band-card                         print the effective band table",
            "  --emit-manifest <path>              write a manifest template",
            "  --emit-examples <path>              write example records as JSONL",
            "      [--examples N] [--seed S]",
            "  --from-jsonl <in> --to-jsonl <out>  convert {value,a_raw,prev?} lines to records",
            "  --verify-jsonl <path>               verify digests and chain links of a record file");

    public boolean singleRecordRequested() {
        return !value.isEmpty() || !aRaw.isEmpty();
    }

    public boolean batchRequested() {
        return !fromJsonl.isEmpty() || !toJsonl.isEmpty();
    }

    public static CliOptions parse(String[] args) {
        boolean demo = false, pretty = false, help = false, validate = false, bandCard = false;
        String value = "", aRaw = "", prev = "", weights = "", manifestFrom = "", dump = "";
        String emitManifest = "", emitExamples = "", fromJsonl = "", toJsonl = "", verifyJsonl = "";
        int examples = DEFAULT_EXAMPLES;
        Long seed = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inline = arg.substring(eq + 1);
            }

            if (FLAGS.contains(name)) {
                if (inline != null) throw new CliUsageException(name + " takes no value");
                switch (name) {
                    case "--demo" -> demo = true;
                    case "--pretty" -> pretty = true;
                    case "--help" -> help = true;
                    case "--manifest-validate" -> validate = true;
                    default -> bandCard = true;
                }
                continue;
            }

            String v;
            if (inline != null) {
                v = inline;
            } else if (i + 1 < args.length) {
                v = args[++i];
            } else {
                throw new CliUsageException("Missing value for " + name);
            }

            switch (name) {
                case "--value" -> value = v;
                case "--a_raw" -> aRaw = v;
                case "--prev" -> prev = v;
                case "--weights" -> weights = v;
                case "--manifest-from" -> manifestFrom = v;
                case "--manifest-dump-effective" -> dump = v;
                case "--emit-manifest" -> emitManifest = v;
                case "--emit-examples" -> emitExamples = v;
                case "--examples" -> examples = parseInt(name, v);
                case "--seed" -> seed = parseLong(name, v);
                case "--from-jsonl" -> fromJsonl = v;
                case "--to-jsonl" -> toJsonl = v;
                case "--verify-jsonl" -> verifyJsonl = v;
                default -> throw new CliUsageException("Unknown option: " + name);
            }
        }

        if (examples < 0) throw new CliUsageException("--examples must be >= 0");

        return new CliOptions(demo, pretty, help, value, aRaw, prev, weights, manifestFrom, dump,
                validate, bandCard, emitManifest, emitExamples, examples, seed, fromJsonl, toJsonl, verifyJsonl);
    }

    private static long parseLong(String name, String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new CliUsageException(name + " expects an integer, got '" + v + "'", e);
        }
    }

    private static int parseInt(String name, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new CliUsageException(name + " expects an integer, got '" + v + "'", e);
        }
    }
}
