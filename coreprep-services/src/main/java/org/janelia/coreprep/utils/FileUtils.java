package org.janelia.coreprep.utils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;

public class FileUtils {

    /**
     * Finds the files under dir whose path matches the given pattern. The pattern defaults to a glob
     * if it has no explicit "glob:" or "regex:" syntax prefix.
     */
    public static Stream<Path> lookupFiles(Path dir, int maxDepth, String pattern) {
        try {
            String fileLookupPattern;
            if (StringUtils.isBlank(pattern)) {
                fileLookupPattern = "glob:**/*";
            } else if (!pattern.startsWith("glob:") && !pattern.startsWith("regex:")) {
                fileLookupPattern = "glob:" + pattern;
            } else {
                fileLookupPattern = pattern;
            }
            PathMatcher inputFileMatcher = FileSystems.getDefault().getPathMatcher(fileLookupPattern);
            return Files.find(dir, maxDepth, (p, a) -> a.isRegularFile() && inputFileMatcher.matches(p.getFileName()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path createDirs(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }

    /**
     * Deletes the given path even if it is a non empty directory.
     */
    public static void deletePath(Path dir) throws IOException {
        if (dir == null || Files.notExists(dir)) {
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    public static String getFileName(Path fp) {
        return fp == null || fp.getFileName() == null ? "" : fp.getFileName().toString();
    }

    public static String getFileNameOnly(Path fp) {
        return getFileNameOnly(getFileName(fp));
    }

    public static String getFileNameOnly(String fn) {
        return StringUtils.isBlank(fn) ? "" : com.google.common.io.Files.getNameWithoutExtension(fn);
    }
}
