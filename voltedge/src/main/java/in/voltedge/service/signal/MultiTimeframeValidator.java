package in.voltedge.service.signal;

import in.voltedge.config.MultiTimeframeConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.signal.ConsensusResult;
import in.voltedge.domain.signal.ResolutionMethod;
import in.voltedge.domain.signal.TimeframeSignal;
import in.voltedge.service.core.EventService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reconciles per-timeframe oscillator signals into one decision.
 *
 * Steps: alignment of confirmations with the primary, weighted consensus, conflict detection,
 * ordered conflict resolution, then alignment gating.
 */
public final class MultiTimeframeValidator {
    private static final Logger log = LoggerFactory.getLogger(MultiTimeframeValidator.class);

    private static final double MISALIGNED_CONFIDENCE_FACTOR = 0.3;
    private static final double NO_CONFLICT_CONFIDENCE_FACTOR = 0.8;
    private static final double MIN_CONFLICT_CONFIDENCE_FACTOR = 0.2;
    private static final double NO_CONFIRMATION_SCORE = 0.5;

    private final MultiTimeframeConfig config;
    private final EventService events;

    public MultiTimeframeValidator(MultiTimeframeConfig config, EventService events) {
        this.config = config;
        this.events = events;
    }

    record Alignment(boolean aligned, int primarySignal, double score, String reason) {}

    record Consensus(int signal, double strength, double weightedScore) {}

    record Conflict(boolean present, double severity, List<Timeframe> buys, List<Timeframe> sells) {}

    record Resolution(ResolutionMethod method, int signal, double confidence, String reason) {}

    // ═══════════════════════════════════════════════════════════════
    // VALIDATION
    // ═══════════════════════════════════════════════════════════════

    public ConsensusResult validate(String symbol, Map<Timeframe, TimeframeSignal> signals) {
        Alignment alignment = checkAlignment(signals);
        Consensus consensus = consensus(signals);
        Conflict conflict = detectConflicts(signals);
        Resolution resolution = resolve(signals, conflict, consensus);

        double overall = overallConfidence(alignment, consensus, conflict);

        int finalSignal;
        double confidence;
        String reason;
        if (config.alignmentRequired() && !alignment.aligned()) {
            finalSignal = 0;
            confidence = 0.0;
            reason = "Alignment required but not achieved: " + alignment.reason();
        } else if (conflict.present()) {
            finalSignal = resolution.signal();
            confidence = resolution.confidence();
            reason = resolution.reason();
        } else {
            finalSignal = alignment.primarySignal() != 0 ? alignment.primarySignal() : consensus.signal();
            confidence = finalSignal != 0 ? overall : 0.0;
            reason = finalSignal != 0 ? "Timeframes agree" : "No directional signal";
        }

        List<String> conflicting = new ArrayList<>();
        conflict.buys().forEach(tf -> conflicting.add(tf.getLabel()));
        conflict.sells().forEach(tf -> conflicting.add(tf.getLabel()));

        ConsensusResult result = new ConsensusResult(
            finalSignal, confidence, resolution.method(),
            alignment.score(), alignment.aligned(),
            consensus.weightedScore(), consensus.signal(), consensus.strength(),
            conflict.severity(), resolution.signal(), resolution.confidence(), overall,
            conflicting, reason
        );

        events.emit(EventType.CONSENSUS_COMPUTED, symbol, "mtf-validator", signals, result);
        log.debug("[MTF] {} final={} conf={} method={} aligned={} score={}",
            symbol, finalSignal, confidence, resolution.method(), alignment.aligned(), consensus.weightedScore());
        return result;
    }

    // ═══════════════════════════════════════════════════════════════
    // STEPS
    // ═══════════════════════════════════════════════════════════════

    Alignment checkAlignment(Map<Timeframe, TimeframeSignal> signals) {
        TimeframeSignal primary = signals.get(config.primary());
        if (primary == null) {
            return new Alignment(false, 0, 0.0, "Primary timeframe " + config.primary() + " not available");
        }
        if (primary.signal() == 0) {
            return new Alignment(false, 0, 0.0, "No primary signal detected");
        }

        int agreeing = 0;
        int available = 0;
        for (Timeframe tf : config.confirmations()) {
            TimeframeSignal c = signals.get(tf);
            if (c == null) {
                continue;
            }
            available++;
            if (Integer.signum(c.signal()) == Integer.signum(primary.signal())) {
                agreeing++;
            }
        }

        if (available == 0) {
            return new Alignment(false, primary.signal(), NO_CONFIRMATION_SCORE,
                "No confirmation timeframes available");
        }
        double score = (double) agreeing / available;
        boolean aligned = score >= config.minConfirmationRatio();
        return new Alignment(aligned, primary.signal(), score, agreeing + "/" + available + " timeframes aligned");
    }

    Consensus consensus(Map<Timeframe, TimeframeSignal> signals) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (TimeframeSignal s : signals.values()) {
            double weight = config.weightOf(s.timeframe());
            if (weight <= 0.0) {
                continue;
            }
            weighted += s.signal() * s.strength() * config.decayOf(s.timeframe()) * weight;
            totalWeight += weight;
        }
        if (totalWeight == 0.0) {
            return new Consensus(0, 0.0, 0.0);
        }
        int sign = weighted > config.consensusThreshold() ? 1
            : weighted < -config.consensusThreshold() ? -1 : 0;
        return new Consensus(sign, Math.abs(weighted) / totalWeight, weighted);
    }

    Conflict detectConflicts(Map<Timeframe, TimeframeSignal> signals) {
        List<Timeframe> buys = new ArrayList<>();
        List<Timeframe> sells = new ArrayList<>();
        for (Timeframe tf : orderedKeys(signals)) {
            int s = signals.get(tf).signal();
            if (s > 0) {
                buys.add(tf);
            } else if (s < 0) {
                sells.add(tf);
            }
        }
        if (buys.isEmpty() || sells.isEmpty()) {
            return new Conflict(false, 0.0, List.of(), List.of());
        }
        double buyWeight = sideWeight(signals, buys);
        double sellWeight = sideWeight(signals, sells);
        double total = buyWeight + sellWeight;
        double severity = total > 0.0 ? Math.min(buyWeight, sellWeight) / total : 0.0;
        return new Conflict(true, severity, buys, sells);
    }

    Resolution resolve(Map<Timeframe, TimeframeSignal> signals, Conflict conflict, Consensus consensus) {
        if (!conflict.present()) {
            return new Resolution(ResolutionMethod.NO_CONFLICT, consensus.signal(), 1.0, "No conflicts detected");
        }

        TimeframeSignal primary = signals.get(config.primary());
        if (primary != null && primary.signal() != 0) {
            return new Resolution(ResolutionMethod.PRIMARY_OVERRIDE, primary.signal(),
                config.primaryOverrideConfidence(),
                "Primary timeframe " + config.primary() + " takes precedence");
        }

        if (Math.abs(consensus.weightedScore()) > config.weightedResolutionThreshold()) {
            return new Resolution(ResolutionMethod.WEIGHTED_CONSENSUS, consensus.signal(),
                Math.min(config.weightedConfidenceCap(), consensus.strength()),
                String.format("Weighted consensus: %.3f", consensus.weightedScore()));
        }

        Timeframe[] byPriority = Timeframe.values();
        Arrays.sort(byPriority, Comparator.comparingInt(Timeframe::getPriority).reversed());
        for (Timeframe tf : byPriority) {
            TimeframeSignal s = signals.get(tf);
            if (s != null && s.signal() != 0 && s.strength() > config.priorityStrengthThreshold()) {
                return new Resolution(ResolutionMethod.HIGHER_TIMEFRAME_PRIORITY, s.signal(),
                    config.priorityConfidence(), "Higher timeframe " + tf + " priority");
            }
        }

        return new Resolution(ResolutionMethod.NO_RESOLUTION, 0, 0.0, "Conflicting signals cannot be resolved");
    }

    private double overallConfidence(Alignment alignment, Consensus consensus, Conflict conflict) {
        List<Double> factors = new ArrayList<>();
        factors.add(alignment.aligned() ? alignment.score() : MISALIGNED_CONFIDENCE_FACTOR);
        if (consensus.strength() > 0.0) {
            factors.add(consensus.strength());
        }
        factors.add(conflict.present()
            ? Math.max(MIN_CONFLICT_CONFIDENCE_FACTOR, 1.0 - conflict.severity())
            : NO_CONFLICT_CONFIDENCE_FACTOR);
        return factors.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private double sideWeight(Map<Timeframe, TimeframeSignal> signals, List<Timeframe> side) {
        double w = 0.0;
        for (Timeframe tf : side) {
            w += config.conflictWeightOf(tf) * signals.get(tf).strength();
        }
        return w;
    }

    private static List<Timeframe> orderedKeys(Map<Timeframe, TimeframeSignal> signals) {
        List<Timeframe> keys = new ArrayList<>(signals.keySet());
        keys.sort(Comparator.comparingInt(Timeframe::getPriority));
        return keys;
    }
}
