package com.bashnorm.normalize;

/**
 * Settings of a {@link CommandNormalizer}.
 *
 * @param normalizeDigits      replace digit runs in arguments with {@link WordNormalizer#NUM}
 * @param normalizeLongPattern replace arguments containing whitespace with {@link WordNormalizer#LONG_PATTERN}
 * @param recoverQuotation     keep the quotes of quoted words
 * @param maxDepth             deepest nesting of commands, substitutions and embedded commands accepted
 * @param flagSplitPolicy      which flags are split into single-letter flags
 */
public record NormalizerOptions(boolean normalizeDigits,
                                boolean normalizeLongPattern,
                                boolean recoverQuotation,
                                int maxDepth,
                                FlagSplitPolicy flagSplitPolicy) {

    public static final int DEFAULT_MAX_DEPTH = 32;

    public NormalizerOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        if (flagSplitPolicy == null) {
            flagSplitPolicy = FlagSplitPolicy.CLUSTERED_SHORT_OPTIONS;
        }
    }

    public static NormalizerOptions defaults() {
        return new NormalizerOptions(true, true, true, DEFAULT_MAX_DEPTH, FlagSplitPolicy.CLUSTERED_SHORT_OPTIONS);
    }

    public NormalizerOptions withNormalizeDigits(boolean value) {
        return new NormalizerOptions(value, normalizeLongPattern, recoverQuotation, maxDepth, flagSplitPolicy);
    }

    public NormalizerOptions withNormalizeLongPattern(boolean value) {
        return new NormalizerOptions(normalizeDigits, value, recoverQuotation, maxDepth, flagSplitPolicy);
    }

    public NormalizerOptions withRecoverQuotation(boolean value) {
        return new NormalizerOptions(normalizeDigits, normalizeLongPattern, value, maxDepth, flagSplitPolicy);
    }

    public NormalizerOptions withMaxDepth(int value) {
        return new NormalizerOptions(normalizeDigits, normalizeLongPattern, recoverQuotation, value, flagSplitPolicy);
    }

    public NormalizerOptions withFlagSplitPolicy(FlagSplitPolicy value) {
        return new NormalizerOptions(normalizeDigits, normalizeLongPattern, recoverQuotation, maxDepth, value);
    }
}
