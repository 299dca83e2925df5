package in.voltedge.domain.signal;

import java.util.List;

/**
 * Outcome of one multi-timeframe validation, with every intermediate value kept for inspection.
 *
 * {@code finalSignal} is after alignment gating. {@code resolvedSignal} and
 * {@code resolutionConfidence} are what conflict resolution produced before gating.
 */
public record ConsensusResult(
    int finalSignal,
    double confidence,
    ResolutionMethod resolutionMethod,
    double alignmentScore,
    boolean aligned,
    double weightedScore,
    int consensusSignal,
    double consensusStrength,
    double conflictSeverity,
    int resolvedSignal,
    double resolutionConfidence,
    double overallConfidence,
    List<String> conflicts,
    String reason
) {
    public ConsensusResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public boolean validated() {
        return finalSignal != 0;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
