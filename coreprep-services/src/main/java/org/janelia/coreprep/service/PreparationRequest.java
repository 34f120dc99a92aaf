package org.janelia.coreprep.service;

import java.nio.file.Path;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Inputs of a core preparation run. The image directory is a path on the source endpoint
 * for remote runs and a local directory otherwise.
 */
public class PreparationRequest {

    private final Path coreInfoFile;
    private final String imageDir;
    private final Path tempDir;
    private final Path outputDir;
    private final boolean remote;
    private final Path transferCacheDir;

    public PreparationRequest(Path coreInfoFile, String imageDir, Path tempDir, Path outputDir, boolean remote, Path transferCacheDir) {
        Preconditions.checkArgument(coreInfoFile != null, "Core info file is required");
        Preconditions.checkArgument(StringUtils.isNotBlank(imageDir), "Image directory is required");
        Preconditions.checkArgument(tempDir != null, "Temporary directory is required");
        Preconditions.checkArgument(outputDir != null, "Output directory is required");
        Preconditions.checkArgument(!remote || transferCacheDir != null, "A transfer cache directory is required for remote images");
        this.coreInfoFile = coreInfoFile;
        this.imageDir = imageDir;
        this.tempDir = tempDir;
        this.outputDir = outputDir;
        this.remote = remote;
        this.transferCacheDir = transferCacheDir;
    }

    public Path getCoreInfoFile() {
        return coreInfoFile;
    }

    public String getImageDir() {
        return imageDir;
    }

    public Path getTempDir() {
        return tempDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isRemote() {
        return remote;
    }

    public Path getTransferCacheDir() {
        return transferCacheDir;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("coreInfoFile", coreInfoFile)
                .append("imageDir", imageDir)
                .append("tempDir", tempDir)
                .append("outputDir", outputDir)
                .append("remote", remote)
                .append("transferCacheDir", transferCacheDir)
                .toString();
    }
}
