package org.janelia.coreprep.channels;

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Include, exclude and use lists applied when selecting channels.
 * Include and exclude hold round qualified names (e.g. 004_CD3), use holds output channel names.
 */
public class ChannelSelectionCriteria {

    public static final int DEFAULT_PROCESSING_PASS = 4;

    private final Set<String> includeChannels;
    private final Set<String> excludeChannels;
    private final Set<String> useChannels;
    private final int processingPass;

    public static ChannelSelectionCriteria all() {
        return new ChannelSelectionCriteria(ImmutableSet.of(), ImmutableSet.of(), ImmutableSet.of(), DEFAULT_PROCESSING_PASS);
    }

    public ChannelSelectionCriteria(Collection<String> includeChannels,
                                    Collection<String> excludeChannels,
                                    Collection<String> useChannels,
                                    int processingPass) {
        this.includeChannels = ImmutableSet.copyOf(includeChannels);
        this.excludeChannels = ImmutableSet.copyOf(excludeChannels);
        this.useChannels = ImmutableSet.copyOf(useChannels);
        this.processingPass = processingPass;
        Set<String> conflicts = Sets.intersection(this.includeChannels, this.excludeChannels);
        if (!conflicts.isEmpty()) {
            throw new IllegalArgumentException("Channels " + conflicts + " are both included and excluded");
        }
        if (processingPass < 0) {
            throw new IllegalArgumentException("Invalid processing pass " + processingPass);
        }
    }

    public Set<String> getIncludeChannels() {
        return includeChannels;
    }

    public Set<String> getExcludeChannels() {
        return excludeChannels;
    }

    public Set<String> getUseChannels() {
        return useChannels;
    }

    public int getProcessingPass() {
        return processingPass;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("include", includeChannels)
                .append("exclude", excludeChannels)
                .append("use", useChannels)
                .append("pass", processingPass)
                .toString();
    }
}
