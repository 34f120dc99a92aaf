package org.janelia.coreprep.transfer;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;

public class TransferMapBuilder {

    private final EndpointPathConverter pathConverter;

    public TransferMapBuilder(EndpointPathConverter pathConverter) {
        this.pathConverter = pathConverter;
    }

    /**
     * Places every remote file, under its own name, in the local cache directory.
     *
     * @param remotePaths channel to remote path
     * @return channel to transfer location, in the order of the given channels
     */
    public Map<String, TransferLocation> build(Map<String, String> remotePaths, Path localCacheDir) {
        Path localDir = localCacheDir.toAbsolutePath().normalize();
        Map<String, TransferLocation> transferMap = new LinkedHashMap<>();
        remotePaths.forEach((channel, remotePath) -> {
            Path localPath = localDir.resolve(remoteFileName(remotePath));
            transferMap.put(channel, new TransferLocation(remotePath, pathConverter.toEndpointPath(localPath.toString()), localPath));
        });
        return transferMap;
    }

    private String remoteFileName(String remotePath) {
        List<String> components = Splitter.on('/').omitEmptyStrings().splitToList(remotePath);
        if (components.isEmpty()) {
            throw new IllegalArgumentException("Invalid remote path " + remotePath);
        }
        return components.get(components.size() - 1);
    }
}
