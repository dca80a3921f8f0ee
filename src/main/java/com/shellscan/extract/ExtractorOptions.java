package com.shellscan.extract;

public record ExtractorOptions(int maxSubstitutionDepth, boolean scanCompoundRedirects) {
    public static final int DEFAULT_MAX_SUBSTITUTION_DEPTH = 16;

    public ExtractorOptions {
        if (maxSubstitutionDepth < 0) {
            throw new IllegalArgumentException("maxSubstitutionDepth must not be negative: " + maxSubstitutionDepth);
        }
    }

    public static ExtractorOptions defaults() {
        return new ExtractorOptions(DEFAULT_MAX_SUBSTITUTION_DEPTH, false);
    }

    public ExtractorOptions withMaxSubstitutionDepth(int depth) {
        return new ExtractorOptions(depth, scanCompoundRedirects);
    }

    public ExtractorOptions withScanCompoundRedirects(boolean scan) {
        return new ExtractorOptions(maxSubstitutionDepth, scan);
    }
}
