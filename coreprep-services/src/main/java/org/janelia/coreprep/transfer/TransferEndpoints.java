package org.janelia.coreprep.transfer;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

public class TransferEndpoints {

    private final String sourceEndpoint;
    private final String destinationEndpoint;

    public TransferEndpoints(String sourceEndpoint, String destinationEndpoint) {
        Preconditions.checkArgument(StringUtils.isNotBlank(sourceEndpoint), "Source endpoint is required");
        Preconditions.checkArgument(StringUtils.isNotBlank(destinationEndpoint), "Destination endpoint is required");
        this.sourceEndpoint = sourceEndpoint;
        this.destinationEndpoint = destinationEndpoint;
    }

    public String getSourceEndpoint() {
        return sourceEndpoint;
    }

    public String getDestinationEndpoint() {
        return destinationEndpoint;
    }

    @Override
    public String toString() {
        return sourceEndpoint + " -> " + destinationEndpoint;
    }
}
