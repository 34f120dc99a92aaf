package org.janelia.coreprep.fragments;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.imaging.ImagePlane;
import org.janelia.coreprep.imaging.ImagePlaneIO;
import org.janelia.coreprep.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scratch area holding one TIFF per (core, channel) at &lt;tempDir&gt;/&lt;coreId&gt;/&lt;channel&gt;.tiff.
 * A fragment is written to a hidden part file first and then moved in place, so a visible fragment is always complete.
 */
public class FragmentStore {

    private static final Logger LOG = LoggerFactory.getLogger(FragmentStore.class);

    public static final String FRAGMENT_EXT = ".tiff";
    private static final String PART_EXT = ".part";

    private final Path tempDir;
    private final Set<String> writtenFragments = new HashSet<>();

    public FragmentStore(Path tempDir) {
        this.tempDir = tempDir;
    }

    public Path getTempDir() {
        return tempDir;
    }

    public Path getCoreDir(String coreId) {
        return tempDir.resolve(coreId);
    }

    public Path getFragmentPath(String coreId, String channel) {
        return getCoreDir(coreId).resolve(channel + FRAGMENT_EXT);
    }

    public Path write(String coreId, String channel, ImagePlane plane) {
        String fragmentKey = coreId + "/" + channel;
        if (writtenFragments.contains(fragmentKey)) {
            throw new IllegalStateException("Fragment " + fragmentKey + " has already been written");
        }
        Path coreDir = FileUtils.createDirs(getCoreDir(coreId));
        Path fragmentPath = getFragmentPath(coreId, channel);
        Path partPath = coreDir.resolve("." + channel + FRAGMENT_EXT + PART_EXT);
        try {
            ImagePlaneIO.writeTiff(plane, partPath);
            moveInPlace(partPath, fragmentPath);
        } catch (IOException e) {
            deleteQuietly(partPath);
            throw new UncheckedIOException("Error writing fragment " + fragmentPath, e);
        }
        writtenFragments.add(fragmentKey);
        LOG.debug("Wrote {} fragment {}", plane, fragmentPath);
        return fragmentPath;
    }

    private void moveInPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * @return the core's fragment files sorted by name
     */
    public List<Path> listFragments(String coreId) {
        Path coreDir = getCoreDir(coreId);
        if (!Files.isDirectory(coreDir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(coreDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> StringUtils.endsWithAny(p.getFileName().toString().toLowerCase(), ".tif", ".tiff"))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Error listing fragments of " + coreId, e);
        }
    }

    public static String getChannelName(Path fragmentPath) {
        return FileUtils.getFileNameOnly(fragmentPath);
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Error deleting {}", path, e);
        }
    }
}
