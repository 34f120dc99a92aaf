package org.janelia.coreprep.assembly;

import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

public class CoreArtifact {

    private final String coreId;
    private final int downscale;
    private final List<MultiscaleChannel> channels;

    public CoreArtifact(String coreId, int downscale, List<MultiscaleChannel> channels) {
        this.coreId = coreId;
        this.downscale = downscale;
        this.channels = ImmutableList.copyOf(channels);
    }

    public String getCoreId() {
        return coreId;
    }

    public int getDownscale() {
        return downscale;
    }

    public List<MultiscaleChannel> getChannels() {
        return channels;
    }

    public List<String> getChannelNames() {
        return channels.stream().map(MultiscaleChannel::getName).collect(Collectors.toList());
    }
}
