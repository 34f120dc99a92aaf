package org.janelia.coreprep.config;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.coreprep.channels.ChannelSelectionCriteria;

/**
 * Validated settings of a core preparation run.
 */
public class PreparationSettings {

    public static final String MARGIN = "CorePrep.Margin";
    public static final String MASK_VALUE = "CorePrep.MaskValue";
    public static final String MAX_PYRAMID_LEVELS = "CorePrep.MaxPyramidLevels";
    public static final String DOWNSCALE = "CorePrep.Downscale";
    public static final String INCLUDE_CHANNELS = "CorePrep.IncludeChannels";
    public static final String EXCLUDE_CHANNELS = "CorePrep.ExcludeChannels";
    public static final String USE_CHANNELS = "CorePrep.UseChannels";
    public static final String PROCESSING_PASS = "CorePrep.ProcessingPass";
    public static final String TRANSFER_CLEANUP_ENABLED = "CorePrep.TransferCleanupEnabled";
    public static final String CORE_CLEANUP_ENABLED = "CorePrep.CoreCleanupEnabled";
    public static final String POLL_INTERVAL_SECONDS = "CorePrep.PollIntervalSeconds";
    public static final String MAX_WAIT_SECONDS = "CorePrep.MaxWaitSeconds";

    public static class Builder {
        private int margin = 0;
        private double maskValue = 0;
        private int maxPyramidLevels = 3;
        private int downscale = 2;
        private Set<String> includeChannels = ImmutableSet.of();
        private Set<String> excludeChannels = ImmutableSet.of();
        private Set<String> useChannels = ImmutableSet.of();
        private int processingPass = ChannelSelectionCriteria.DEFAULT_PROCESSING_PASS;
        private boolean transferCleanupEnabled = true;
        private boolean coreCleanupEnabled = true;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration maxWait = Duration.ZERO;

        public Builder margin(int margin) {
            this.margin = margin;
            return this;
        }

        public Builder maskValue(double maskValue) {
            this.maskValue = maskValue;
            return this;
        }

        public Builder maxPyramidLevels(int maxPyramidLevels) {
            this.maxPyramidLevels = maxPyramidLevels;
            return this;
        }

        public Builder downscale(int downscale) {
            this.downscale = downscale;
            return this;
        }

        public Builder includeChannels(Collection<String> includeChannels) {
            this.includeChannels = ImmutableSet.copyOf(includeChannels);
            return this;
        }

        public Builder excludeChannels(Collection<String> excludeChannels) {
            this.excludeChannels = ImmutableSet.copyOf(excludeChannels);
            return this;
        }

        public Builder useChannels(Collection<String> useChannels) {
            this.useChannels = ImmutableSet.copyOf(useChannels);
            return this;
        }

        public Builder processingPass(int processingPass) {
            this.processingPass = processingPass;
            return this;
        }

        public Builder transferCleanupEnabled(boolean transferCleanupEnabled) {
            this.transferCleanupEnabled = transferCleanupEnabled;
            return this;
        }

        public Builder coreCleanupEnabled(boolean coreCleanupEnabled) {
            this.coreCleanupEnabled = coreCleanupEnabled;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public PreparationSettings build() {
            Preconditions.checkArgument(margin >= 0, "%s must be >= 0 but was %s", MARGIN, margin);
            Preconditions.checkArgument(maxPyramidLevels >= 1, "%s must be >= 1 but was %s", MAX_PYRAMID_LEVELS, maxPyramidLevels);
            Preconditions.checkArgument(downscale >= 2, "%s must be >= 2 but was %s", DOWNSCALE, downscale);
            Preconditions.checkArgument(pollInterval != null && !pollInterval.isNegative(), "%s must not be negative", POLL_INTERVAL_SECONDS);
            Preconditions.checkArgument(maxWait != null && !maxWait.isNegative(), "%s must not be negative", MAX_WAIT_SECONDS);
            return new PreparationSettings(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PreparationSettings fromConfig(ApplicationConfig config) {
        return builder()
                .margin(config.getIntegerPropertyValue(MARGIN, 0))
                .maskValue(config.getDoublePropertyValue(MASK_VALUE, 0.))
                .maxPyramidLevels(config.getIntegerPropertyValue(MAX_PYRAMID_LEVELS, 3))
                .downscale(config.getIntegerPropertyValue(DOWNSCALE, 2))
                .includeChannels(config.getStringListPropertyValue(INCLUDE_CHANNELS))
                .excludeChannels(config.getStringListPropertyValue(EXCLUDE_CHANNELS))
                .useChannels(config.getStringListPropertyValue(USE_CHANNELS))
                .processingPass(config.getIntegerPropertyValue(PROCESSING_PASS, ChannelSelectionCriteria.DEFAULT_PROCESSING_PASS))
                .transferCleanupEnabled(config.getBooleanPropertyValue(TRANSFER_CLEANUP_ENABLED, true))
                .coreCleanupEnabled(config.getBooleanPropertyValue(CORE_CLEANUP_ENABLED, true))
                .pollInterval(Duration.ofMillis(Math.round(config.getDoublePropertyValue(POLL_INTERVAL_SECONDS, 10.) * 1000)))
                .maxWait(Duration.ofSeconds(config.getLongPropertyValue(MAX_WAIT_SECONDS, 0L)))
                .build();
    }

    private final int margin;
    private final double maskValue;
    private final int maxPyramidLevels;
    private final int downscale;
    private final ChannelSelectionCriteria channelSelection;
    private final boolean transferCleanupEnabled;
    private final boolean coreCleanupEnabled;
    private final Duration pollInterval;
    private final Duration maxWait;

    private PreparationSettings(Builder builder) {
        this.margin = builder.margin;
        this.maskValue = builder.maskValue;
        this.maxPyramidLevels = builder.maxPyramidLevels;
        this.downscale = builder.downscale;
        this.channelSelection = new ChannelSelectionCriteria(builder.includeChannels, builder.excludeChannels, builder.useChannels, builder.processingPass);
        this.transferCleanupEnabled = builder.transferCleanupEnabled;
        this.coreCleanupEnabled = builder.coreCleanupEnabled;
        this.pollInterval = builder.pollInterval;
        this.maxWait = builder.maxWait;
    }

    public int getMargin() {
        return margin;
    }

    public double getMaskValue() {
        return maskValue;
    }

    public int getMaxPyramidLevels() {
        return maxPyramidLevels;
    }

    public int getDownscale() {
        return downscale;
    }

    public ChannelSelectionCriteria getChannelSelection() {
        return channelSelection;
    }

    public boolean isTransferCleanupEnabled() {
        return transferCleanupEnabled;
    }

    public boolean isCoreCleanupEnabled() {
        return coreCleanupEnabled;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * @return the overall wait limit or {@link Duration#ZERO} if the run may wait indefinitely for its channels
     */
    public Duration getMaxWait() {
        return maxWait;
    }

    public boolean hasMaxWait() {
        return !maxWait.isZero();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("margin", margin)
                .append("maskValue", maskValue)
                .append("maxPyramidLevels", maxPyramidLevels)
                .append("downscale", downscale)
                .append("channelSelection", channelSelection)
                .append("transferCleanupEnabled", transferCleanupEnabled)
                .append("coreCleanupEnabled", coreCleanupEnabled)
                .append("pollInterval", pollInterval)
                .append("maxWait", maxWait)
                .toString();
    }
}
