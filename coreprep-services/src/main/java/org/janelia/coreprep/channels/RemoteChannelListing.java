package org.janelia.coreprep.channels;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.transfer.TransferClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the channel images of a directory on a remote transfer endpoint.
 */
public class RemoteChannelListing implements ChannelListing {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteChannelListing.class);

    private final TransferClient transferClient;
    private final String endpointId;
    private final String remoteDir;

    public RemoteChannelListing(TransferClient transferClient, String endpointId, String remoteDir) {
        this.transferClient = transferClient;
        this.endpointId = endpointId;
        this.remoteDir = remoteDir;
    }

    @Override
    public List<String> listFiles() {
        String dirPrefix = StringUtils.appendIfMissing(StringUtils.replaceChars(remoteDir, '\\', '/'), "/");
        List<String> files = transferClient.listDirectory(endpointId, remoteDir).stream()
                .filter(name -> StringUtils.endsWithAny(name, ".ome.tif", ".ome.tiff"))
                .map(name -> dirPrefix + name)
                .sorted()
                .collect(Collectors.toList());
        LOG.info("Found {} channel images in {} on {}", files.size(), remoteDir, endpointId);
        return files;
    }
}
