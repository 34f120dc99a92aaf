package org.janelia.coreprep.assembly;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.janelia.coreprep.imaging.ImagePlane;
import org.janelia.coreprep.imaging.ImagePlaneIO;
import org.janelia.coreprep.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every core as a directory &lt;outputDir&gt;/&lt;coreId&gt;.pyramid containing &lt;channel&gt;/&lt;level&gt;.tiff
 * for each channel level and a multiscales.json descriptor. The directory is built next to its final location and
 * then moved in place.
 */
public class FileSystemPyramidStore implements OutputStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemPyramidStore.class);

    static final String ARTIFACT_EXT = ".pyramid";
    static final String DESCRIPTOR_NAME = "multiscales.json";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public FileSystemPyramidStore(Path outputDir, ObjectMapper objectMapper) {
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
    }

    public Path getArtifactPath(String coreId) {
        return outputDir.resolve(coreId + ARTIFACT_EXT);
    }

    @Override
    public boolean exists(String coreId) {
        return Files.isDirectory(getArtifactPath(coreId));
    }

    @Override
    public Path write(String coreId, CoreArtifact artifact) throws IOException {
        Path artifactPath = getArtifactPath(coreId);
        Path stagingPath = outputDir.resolve("." + coreId + ARTIFACT_EXT + ".staging");
        FileUtils.deletePath(stagingPath);
        Files.createDirectories(stagingPath);
        try {
            for (MultiscaleChannel channel : artifact.getChannels()) {
                Path channelDir = Files.createDirectories(stagingPath.resolve(channel.getName()));
                List<ImagePlane> levels = channel.getLevels();
                for (int level = 0; level < levels.size(); level++) {
                    ImagePlaneIO.writeTiff(levels.get(level), channelDir.resolve(level + ".tiff"));
                }
            }
            objectMapper.writeValue(stagingPath.resolve(DESCRIPTOR_NAME).toFile(), createDescriptor(artifact));
            if (Files.exists(artifactPath)) {
                LOG.info("Overwrite existing artifact {}", artifactPath);
                FileUtils.deletePath(artifactPath);
            }
            moveInPlace(stagingPath, artifactPath);
        } catch (IOException | RuntimeException e) {
            try {
                FileUtils.deletePath(stagingPath);
            } catch (IOException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            throw e;
        }
        return artifactPath;
    }

    private void moveInPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
    }

    private ObjectNode createDescriptor(CoreArtifact artifact) {
        ObjectNode descriptor = objectMapper.createObjectNode()
                .put("core", artifact.getCoreId())
                .put("downscale", artifact.getDownscale());
        ArrayNode channelsNode = descriptor.putArray("channels");
        for (MultiscaleChannel channel : artifact.getChannels()) {
            ObjectNode channelNode = channelsNode.addObject().put("name", channel.getName());
            ArrayNode levelsNode = channelNode.putArray("levels");
            List<ImagePlane> levels = channel.getLevels();
            for (int level = 0; level < levels.size(); level++) {
                ImagePlane plane = levels.get(level);
                levelsNode.addObject()
                        .put("path", channel.getName() + "/" + level + ".tiff")
                        .put("pixelType", plane.getPixelType().name())
                        .putPOJO("shape", new int[] {plane.getHeight(), plane.getWidth()});
            }
        }
        return descriptor;
    }
}
