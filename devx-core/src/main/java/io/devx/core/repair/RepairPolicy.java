package io.devx.core.repair;

import java.util.List;

/**
 * Thresholds for discarding history. A discard needs at least {@code minOrphans} orphaned results and an
 * orphan share of all results of at least {@code minOrphanRatio}.
 */
public record RepairPolicy(
    int minOrphans,
    double minOrphanRatio,
    List<String> analysisPromptMarkers,
    String fallbackPrompt
) {
    public static final int DEFAULT_MIN_ORPHANS = 3;
    public static final double DEFAULT_MIN_ORPHAN_RATIO = 0.8;
    public static final List<String> DEFAULT_MARKERS = List.of("Analyze *only*", "preceding response");
    public static final String DEFAULT_FALLBACK_PROMPT = "Please continue with the previous request.";

    public RepairPolicy {
        minOrphans = Math.max(1, minOrphans);
        minOrphanRatio = minOrphanRatio <= 0 || minOrphanRatio > 1 ? DEFAULT_MIN_ORPHAN_RATIO : minOrphanRatio;
        analysisPromptMarkers = analysisPromptMarkers == null ? List.of() : List.copyOf(analysisPromptMarkers);
        fallbackPrompt = fallbackPrompt == null || fallbackPrompt.isBlank() ? DEFAULT_FALLBACK_PROMPT : fallbackPrompt;
    }

    public static RepairPolicy defaults() {
        return new RepairPolicy(DEFAULT_MIN_ORPHANS, DEFAULT_MIN_ORPHAN_RATIO, DEFAULT_MARKERS, DEFAULT_FALLBACK_PROMPT);
    }

    public boolean isAnalysisPrompt(String text) {
        for (String marker : analysisPromptMarkers) {
            if (!marker.isEmpty() && text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
