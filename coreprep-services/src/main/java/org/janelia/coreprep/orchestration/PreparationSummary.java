package org.janelia.coreprep.orchestration;

import java.nio.file.Path;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Outcome of a preparation run.
 */
public class PreparationSummary {

    private final Map<String, Path> assembledCores;
    private final Map<String, String> failedCores;
    private final Map<String, String> failedChannels;

    public PreparationSummary(Map<String, Path> assembledCores, Map<String, String> failedCores, Map<String, String> failedChannels) {
        this.assembledCores = ImmutableMap.copyOf(assembledCores);
        this.failedCores = ImmutableMap.copyOf(failedCores);
        this.failedChannels = ImmutableMap.copyOf(failedChannels);
    }

    /**
     * @return core id to artifact location
     */
    public Map<String, Path> getAssembledCores() {
        return assembledCores;
    }

    /**
     * @return core id to failure reason
     */
    public Map<String, String> getFailedCores() {
        return failedCores;
    }

    /**
     * @return channel to failure reason
     */
    public Map<String, String> getFailedChannels() {
        return failedChannels;
    }

    public boolean hasFailures() {
        return !failedCores.isEmpty() || !failedChannels.isEmpty();
    }

    @Override
    public String toString() {
        return "PreparationSummary{" +
                "assembled=" + assembledCores.keySet() +
                ", failedCores=" + failedCores.keySet() +
                ", failedChannels=" + failedChannels.keySet() +
                '}';
    }
}
