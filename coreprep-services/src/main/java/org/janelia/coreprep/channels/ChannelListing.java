package org.janelia.coreprep.channels;

import java.util.List;

/**
 * Source of candidate channel image paths.
 */
public interface ChannelListing {
    List<String> listFiles();
}
