package in.voltedge.service.execution;

import in.voltedge.config.ExecutionConfig;
import in.voltedge.config.MultiTimeframeConfig;
import in.voltedge.config.VolumeConfirmationConfig;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.signal.ConsensusResult;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.SignalAction;
import in.voltedge.domain.signal.TimeframeSignal;
import in.voltedge.domain.signal.VolumeConfirmation;
import in.voltedge.service.market.SeriesStore;
import in.voltedge.service.risk.RejectReason;
import in.voltedge.service.risk.RiskController;
import in.voltedge.service.signal.MultiTimeframeValidator;
import in.voltedge.service.signal.TimeframeSignalCache;
import in.voltedge.service.signal.VolumeConfirmationFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Entry search: picks the strongest scanner signals and passes each through the volume and
 * multi-timeframe gates before handing it to the lifecycle manager.
 */
public final class EntryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(EntryCoordinator.class);

    private final PositionLifecycleManager manager;
    private final PositionBook book;
    private final RiskController risk;
    private final SeriesStore store;
    private final VolumeConfirmationFilter volumeFilter;
    private final MultiTimeframeValidator validator;
    private final TimeframeSignalCache cache;
    private final ExecutionConfig execution;
    private final VolumeConfirmationConfig volume;
    private final MultiTimeframeConfig mtf;

    public EntryCoordinator(PositionLifecycleManager manager, PositionBook book, RiskController risk,
                            SeriesStore store, VolumeConfirmationFilter volumeFilter,
                            MultiTimeframeValidator validator, TimeframeSignalCache cache,
                            ExecutionConfig execution, VolumeConfirmationConfig volume, MultiTimeframeConfig mtf) {
        this.manager = manager;
        this.book = book;
        this.risk = risk;
        this.store = store;
        this.volumeFilter = volumeFilter;
        this.validator = validator;
        this.cache = cache;
        this.execution = execution;
        this.volume = volume;
        this.mtf = mtf;
    }

    /**
     * @param signals ranked scanner output, best first
     * @return number of positions opened
     */
    public int run(List<Signal> signals, BooleanSupplier running) {
        List<Signal> candidates = signals.stream()
            .filter(s -> s.action() != SignalAction.HOLD)
            .filter(s -> s.confidence() >= execution.entryConfidenceThreshold())
            .filter(s -> !book.contains(s.symbol()))
            .limit(execution.maxEntriesPerCycle())
            .toList();

        int opened = 0;
        for (Signal signal : candidates) {
            if (!running.getAsBoolean()) {
                break;
            }
            if (!passesGates(signal)) {
                continue;
            }
            EntryOutcome outcome = manager.enter(signal);
            if (outcome.opened()) {
                opened++;
            }
        }
        if (!candidates.isEmpty()) {
            log.info("[EntryCoordinator] {} candidates, {} opened", candidates.size(), opened);
        }
        return opened;
    }

    boolean passesGates(Signal signal) {
        String symbol = signal.symbol();
        if (volume.enabled()) {
            VolumeConfirmation vc = volumeFilter.confirm(store.window(symbol, volume.period() * 2 + 1), signal);
            if (!vc.confirmed()) {
                log.debug("[EntryCoordinator] {} volume not confirmed: ratio={} reasons={}",
                    symbol, String.format("%.2f", vc.volumeRatio()), vc.reasons());
                risk.reject(symbol, RejectReason.VOLUME_NOT_CONFIRMED, signal.confidence());
                return false;
            }
        }

        if (mtf.enabled()) {
            Map<Timeframe, TimeframeSignal> timeframes = cache.get(symbol);
            if (timeframes.isEmpty()) {
                risk.reject(symbol, RejectReason.MTF_NO_DATA, signal.confidence());
                return false;
            }
            ConsensusResult consensus = validator.validate(symbol, timeframes);
            if (consensus.finalSignal() != signal.action().direction()) {
                log.debug("[EntryCoordinator] {} timeframes disagree: final={} method={} reason={}",
                    symbol, consensus.finalSignal(), consensus.resolutionMethod(), consensus.reason());
                risk.reject(symbol, RejectReason.MTF_DISAGREES, signal.confidence());
                return false;
            }
        }
        return true;
    }
}
