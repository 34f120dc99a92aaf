package org.janelia.coreprep.channels;

import java.util.Objects;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * A channel image discovered from a file listing.
 */
public class ChannelDescriptor {

    public static final String DAPI = "DAPI";

    private final String logicalName;
    private final String sourcePath;
    private final int roundNumber;
    private final String baseMarker;

    public ChannelDescriptor(String sourcePath, int roundNumber, String baseMarker) {
        this.logicalName = String.format("%03d_%s", roundNumber, baseMarker);
        this.sourcePath = sourcePath;
        this.roundNumber = roundNumber;
        this.baseMarker = baseMarker;
    }

    /**
     * @return the round qualified name, e.g. 004_CD3
     */
    public String getLogicalName() {
        return logicalName;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public String getBaseMarker() {
        return baseMarker;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChannelDescriptor that = (ChannelDescriptor) o;
        return roundNumber == that.roundNumber &&
                logicalName.equals(that.logicalName) &&
                sourcePath.equals(that.sourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logicalName, sourcePath, roundNumber);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("logicalName", logicalName)
                .append("sourcePath", sourcePath)
                .toString();
    }
}
