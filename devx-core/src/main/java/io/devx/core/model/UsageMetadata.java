package io.devx.core.model;

public record UsageMetadata(int promptUnits, int completionUnits) {

    public static final UsageMetadata ZERO = new UsageMetadata(0, 0);

    public UsageMetadata {
        promptUnits = Math.max(0, promptUnits);
        completionUnits = Math.max(0, completionUnits);
    }

    public UsageMetadata plus(UsageMetadata other) {
        if (other == null) {
            return this;
        }
        return new UsageMetadata(promptUnits + other.promptUnits, completionUnits + other.completionUnits);
    }

    public int totalUnits() {
        return promptUnits + completionUnits;
    }
}
