package org.janelia.coreprep.orchestration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.janelia.coreprep.cores.CoreSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one preparation run: the channels to cut, the cores to assemble and how far each of them got.
 * A core whose metadata lists no channels requires every channel of the run.
 */
public class PreparationRun {

    private static final Logger LOG = LoggerFactory.getLogger(PreparationRun.class);

    private final Map<String, Path> channelPaths;
    private final Map<String, CoreSpec> cores;
    private final Map<String, Set<String>> requiredChannels;
    private final Map<String, ChannelState> channelStates = new LinkedHashMap<>();
    private final Map<String, CoreState> coreStates = new LinkedHashMap<>();
    private final Map<String, Set<String>> coreReadiness = new LinkedHashMap<>();
    private final Set<String> completedChannels = new HashSet<>();
    private final Map<String, String> failedChannels = new LinkedHashMap<>();
    private final Map<String, String> failedCores = new LinkedHashMap<>();
    private final Map<String, Path> assembledCores = new LinkedHashMap<>();

    /**
     * @param channelPaths channel to the local path the channel image is read from
     * @param coreSpecs cores to prepare
     */
    public PreparationRun(Map<String, Path> channelPaths, List<CoreSpec> coreSpecs) {
        this.channelPaths = ImmutableMap.copyOf(channelPaths);
        Map<String, CoreSpec> coresById = new LinkedHashMap<>();
        Map<String, Set<String>> requiredChannelsById = new LinkedHashMap<>();
        for (CoreSpec core : coreSpecs) {
            if (coresById.put(core.getCoreId(), core) != null) {
                throw new IllegalArgumentException("Duplicate core " + core.getCoreId());
            }
            Set<String> coreChannels;
            if (core.hasExplicitChannels()) {
                Set<String> unknownChannels = Sets.difference(core.getRequiredChannels(), this.channelPaths.keySet());
                if (!unknownChannels.isEmpty()) {
                    throw new IllegalArgumentException("Core " + core.getCoreId() + " requires channels " + unknownChannels
                            + " which are not among the selected channels " + this.channelPaths.keySet());
                }
                coreChannels = core.getRequiredChannels();
            } else {
                coreChannels = this.channelPaths.keySet();
            }
            requiredChannelsById.put(core.getCoreId(), ImmutableSet.copyOf(coreChannels));
            coreStates.put(core.getCoreId(), CoreState.WAITING);
        }
        this.cores = ImmutableMap.copyOf(coresById);
        this.requiredChannels = ImmutableMap.copyOf(requiredChannelsById);
        this.channelPaths.keySet().forEach(channel -> channelStates.put(channel, ChannelState.DISCOVERED));
    }

    public List<String> getChannels() {
        return ImmutableList.copyOf(channelPaths.keySet());
    }

    public Path getChannelPath(String channel) {
        return channelPaths.get(channel);
    }

    public ChannelState getChannelState(String channel) {
        return channelStates.get(channel);
    }

    public CoreState getCoreState(String coreId) {
        return coreStates.get(coreId);
    }

    public Set<String> getRequiredChannels(String coreId) {
        return requiredChannels.get(coreId);
    }

    public Set<String> getCompletedChannels() {
        return ImmutableSet.copyOf(completedChannels);
    }

    /**
     * @return channels that have contributed a fragment to the core and the core is not yet assembled
     */
    public Set<String> getCoreReadiness(String coreId) {
        Set<String> readiness = coreReadiness.get(coreId);
        return readiness == null ? ImmutableSet.of() : ImmutableSet.copyOf(readiness);
    }

    /**
     * @return cores that still need a fragment from the channel
     */
    public List<CoreSpec> getCoresAwaiting(String channel) {
        return cores.values().stream()
                .filter(core -> coreStates.get(core.getCoreId()) == CoreState.WAITING)
                .filter(core -> requiredChannels.get(core.getCoreId()).contains(channel))
                .collect(Collectors.toList());
    }

    void updateChannelState(String channel, ChannelState newState) {
        ChannelState currentState = channelStates.get(channel);
        if (currentState == ChannelState.FAILED || currentState == ChannelState.CLEANED) {
            throw new IllegalStateException("Channel " + channel + " is already " + currentState);
        }
        if (newState == ChannelState.CUT && currentState == ChannelState.CUT) {
            throw new IllegalStateException("Channel " + channel + " has already been cut");
        }
        channelStates.put(channel, newState);
        if (newState == ChannelState.CUT) {
            completedChannels.add(channel);
        }
    }

    void recordFragment(String coreId, String channel) {
        coreReadiness.computeIfAbsent(coreId, id -> new HashSet<>()).add(channel);
        if (coreReadiness.get(coreId).containsAll(requiredChannels.get(coreId)) && coreStates.get(coreId) == CoreState.WAITING) {
            coreStates.put(coreId, CoreState.READY);
        }
    }

    List<String> getWaitingCores() {
        return coreStates.entrySet().stream()
                .filter(e -> e.getValue() == CoreState.WAITING)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    List<String> getReadyCores() {
        return coreStates.entrySet().stream()
                .filter(e -> e.getValue() == CoreState.READY)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    void markAssembled(String coreId, Path artifactPath) {
        if (coreStates.get(coreId) != CoreState.READY) {
            throw new IllegalStateException("Core " + coreId + " is " + coreStates.get(coreId) + " and cannot be assembled");
        }
        coreStates.put(coreId, CoreState.ASSEMBLED);
        coreReadiness.remove(coreId);
        assembledCores.put(coreId, artifactPath);
    }

    void failCore(String coreId, String reason) {
        if (coreStates.get(coreId).isDone()) {
            return;
        }
        LOG.error("Core {} failed: {}", coreId, reason);
        coreStates.put(coreId, CoreState.FAILED);
        coreReadiness.remove(coreId);
        failedCores.put(coreId, reason);
    }

    /**
     * Marks the channel as failed together with every unfinished core that requires it.
     */
    void failChannel(String channel, String reason) {
        if (channelStates.get(channel) == ChannelState.FAILED) {
            return;
        }
        LOG.error("Channel {} failed: {}", channel, reason);
        channelStates.put(channel, ChannelState.FAILED);
        failedChannels.put(channel, reason);
        List<String> dependentCores = new ArrayList<>();
        requiredChannels.forEach((coreId, coreChannels) -> {
            if (coreChannels.contains(channel) && !coreStates.get(coreId).isDone()) {
                dependentCores.add(coreId);
            }
        });
        dependentCores.forEach(coreId -> failCore(coreId, "required channel " + channel + " failed: " + reason));
    }

    List<String> getUnsettledChannels() {
        return channelStates.entrySet().stream()
                .filter(e -> !e.getValue().isSettled())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public boolean isComplete() {
        return getUnsettledChannels().isEmpty() && coreStates.values().stream().allMatch(CoreState::isDone);
    }

    public PreparationSummary toSummary() {
        return new PreparationSummary(assembledCores, failedCores, failedChannels);
    }
}
