package org.janelia.coreprep.orchestration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import org.janelia.coreprep.assembly.CoreAssembler;
import org.janelia.coreprep.common.CondTimeoutException;
import org.janelia.coreprep.common.ContinuationCond;
import org.janelia.coreprep.common.DatedObject;
import org.janelia.coreprep.common.TimedCond;
import org.janelia.coreprep.cores.CoreSpec;
import org.janelia.coreprep.cores.RegionExtractor;
import org.janelia.coreprep.fragments.FragmentStore;
import org.janelia.coreprep.imaging.ChannelImage;
import org.janelia.coreprep.imaging.ChannelImageOpener;
import org.janelia.coreprep.imaging.ImagePlane;
import org.janelia.coreprep.transfer.FileAvailability;
import org.janelia.coreprep.utils.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a preparation run to completion with a single threaded reconciliation loop.
 *
 * Every pass checks each unsettled channel. A channel that became available is opened once and cut for all cores
 * that still need it, then its source file is released. Cores that have received all their channels are assembled
 * in the same pass. The loop stops when every channel is settled and every core is assembled or failed, or when
 * the configured maximum wait is exceeded.
 */
public class PreparationOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(PreparationOrchestrator.class);

    private final FileAvailability fileAvailability;
    private final RegionExtractor regionExtractor;
    private final FragmentStore fragmentStore;
    private final CoreAssembler coreAssembler;
    private final ChannelImageOpener imageOpener;
    private final Duration pollInterval;
    private final Duration maxWait;
    private final Sleeper sleeper;
    private final Ticker ticker;

    public PreparationOrchestrator(FileAvailability fileAvailability,
                                   RegionExtractor regionExtractor,
                                   FragmentStore fragmentStore,
                                   CoreAssembler coreAssembler,
                                   ChannelImageOpener imageOpener,
                                   Duration pollInterval,
                                   Duration maxWait,
                                   Sleeper sleeper,
                                   Ticker ticker) {
        this.fileAvailability = fileAvailability;
        this.regionExtractor = regionExtractor;
        this.fragmentStore = fragmentStore;
        this.coreAssembler = coreAssembler;
        this.imageOpener = imageOpener;
        this.pollInterval = pollInterval;
        this.maxWait = maxWait;
        this.sleeper = sleeper;
        this.ticker = ticker;
    }

    public PreparationSummary run(PreparationRun run) {
        LOG.info("Start preparing cores from channels {}", run.getChannels());
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        DatedObject<PreparationRun> datedRun = new DatedObject<>(run, ticker);
        ContinuationCond<DatedObject<PreparationRun>> runCompleted =
                dr -> new TimedCond<>(dr, reconcile(dr.getObj()), maxWait.toMillis());
        for (int pass = 1; ; pass++) {
            LOG.debug("Reconciliation pass {}", pass);
            ContinuationCond.Cond<DatedObject<PreparationRun>> passResult = runCompleted.checkCond(datedRun);
            try {
                if (passResult.isCondValue()) {
                    break;
                }
            } catch (CondTimeoutException e) {
                LOG.error("Gave up waiting for channels {}: {}", run.getUnsettledChannels(), e.getMessage());
                run.getUnsettledChannels().forEach(channel -> run.failChannel(channel, "timed out waiting for the channel image"));
                break;
            }
            waitForNextPass();
        }
        PreparationSummary summary = run.toSummary();
        LOG.info("Core preparation finished in {}: {} cores assembled, {} cores failed, {} channels failed",
                stopwatch, summary.getAssembledCores().size(), summary.getFailedCores().size(), summary.getFailedChannels().size());
        summary.getFailedChannels().forEach((channel, reason) -> LOG.warn("  Failed channel {}: {}", channel, reason));
        summary.getFailedCores().forEach((coreId, reason) -> LOG.warn("  Failed core {}: {}", coreId, reason));
        return summary;
    }

    /**
     * One reconciliation pass.
     *
     * @return true if the run is complete
     */
    boolean reconcile(PreparationRun run) {
        for (String channel : run.getChannels()) {
            if (run.getChannelState(channel).isSettled()) {
                continue;
            }
            if (checkFailedTransfer(run, channel)) {
                continue;
            }
            Path channelPath = run.getChannelPath(channel);
            if (fileAvailability.fetchOrWait(channel, channelPath)) {
                run.updateChannelState(channel, ChannelState.LOCAL_READY);
                cutChannel(run, channel, channelPath);
            } else if (!checkFailedTransfer(run, channel) && run.getChannelState(channel) == ChannelState.DISCOVERED) {
                run.updateChannelState(channel, ChannelState.PENDING_TRANSFER);
            }
        }
        assembleReadyCores(run);
        if (run.getUnsettledChannels().isEmpty()) {
            // every channel is settled so cores still waiting can never complete
            run.getWaitingCores().forEach(coreId -> run.failCore(coreId, "fragments missing after all channels were processed"));
        }
        return run.isComplete();
    }

    private boolean checkFailedTransfer(PreparationRun run, String channel) {
        if (fileAvailability.getFailedChannels().contains(channel)) {
            run.failChannel(channel, fileAvailability.getFailureReason(channel).orElse("channel image could not be fetched"));
            return true;
        }
        return false;
    }

    private void cutChannel(PreparationRun run, String channel, Path channelPath) {
        List<CoreSpec> cores = run.getCoresAwaiting(channel);
        if (cores.isEmpty()) {
            LOG.info("No core needs channel {} any more", channel);
            releaseChannel(run, channel, channelPath);
            return;
        }
        LOG.info("Cutting {} cores from channel {} ({})", cores.size(), channel, channelPath);
        try (ChannelImage channelImage = imageOpener.open(channelPath)) {
            for (CoreSpec core : cores) {
                try {
                    ImagePlane corePlane = regionExtractor.extract(channelImage, core);
                    fragmentStore.write(core.getCoreId(), channel, corePlane);
                    run.recordFragment(core.getCoreId(), channel);
                    LOG.debug("Cut and saved core {}, channel {}", core.getCoreId(), channel);
                } catch (RuntimeException e) {
                    LOG.error("Error cutting core {} from channel {}", core.getCoreId(), channel, e);
                    run.failCore(core.getCoreId(), "extraction from channel " + channel + " failed: " + e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            LOG.error("Error reading channel {} from {}", channel, channelPath, e);
            run.failChannel(channel, "channel image could not be read: " + e.getMessage());
            return;
        }
        releaseChannel(run, channel, channelPath);
    }

    private void releaseChannel(PreparationRun run, String channel, Path channelPath) {
        run.updateChannelState(channel, ChannelState.CUT);
        fileAvailability.cleanup(channel, channelPath);
        run.updateChannelState(channel, ChannelState.CLEANED);
    }

    private void assembleReadyCores(PreparationRun run) {
        for (String coreId : run.getReadyCores()) {
            LOG.info("Assembling full core {}", coreId);
            try {
                Path artifactPath = coreAssembler.assemble(coreId, run.getRequiredChannels(coreId));
                run.markAssembled(coreId, artifactPath);
            } catch (RuntimeException e) {
                run.failCore(coreId, e.getMessage());
            }
        }
    }

    private void waitForNextPass() {
        try {
            sleeper.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for channel images", e);
        }
    }
}
