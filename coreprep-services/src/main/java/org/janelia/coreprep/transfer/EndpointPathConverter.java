package org.janelia.coreprep.transfer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts host paths into the path namespace of a transfer endpoint.
 */
public class EndpointPathConverter {

    private static final Pattern DRIVE_PATTERN = Pattern.compile("^([A-Za-z]):(.*)$");
    private static final Splitter PATH_SPLITTER = Splitter.onPattern("[\\\\/]").omitEmptyStrings();
    private static final Joiner PATH_JOINER = Joiner.on('/');

    private final EndpointLayout layout;
    private final List<String> sharedRootComponents;

    public EndpointPathConverter(EndpointLayout layout, String sharedRoot) {
        this.layout = layout;
        if (layout == EndpointLayout.SUBFOLDER_ROOT) {
            if (StringUtils.isBlank(sharedRoot)) {
                throw new IllegalArgumentException("A shared root is required for the " + layout.getLayoutName() + " endpoint layout");
            }
            this.sharedRootComponents = PATH_SPLITTER.splitToList(sharedRoot);
        } else {
            this.sharedRootComponents = null;
        }
    }

    public String toEndpointPath(String hostPath) {
        Matcher driveMatcher = DRIVE_PATTERN.matcher(hostPath);
        String drive = null;
        String pathAfterDrive = hostPath;
        if (driveMatcher.matches()) {
            drive = driveMatcher.group(1).toUpperCase();
            pathAfterDrive = driveMatcher.group(2);
        }
        switch (layout) {
            case POSIX:
                return StringUtils.replaceChars(hostPath, '\\', '/');
            case MULTI_DRIVE:
                if (drive == null) {
                    throw new IllegalArgumentException("Path " + hostPath + " must include a drive (e.g., C:) for the multi_drive layout");
                }
                return "/" + drive + toPosix(PATH_SPLITTER.splitToList(pathAfterDrive));
            case SINGLE_DRIVE:
                return StringUtils.defaultIfEmpty(toPosix(PATH_SPLITTER.splitToList(pathAfterDrive)), "/");
            case SUBFOLDER_ROOT:
                List<String> pathComponents = PATH_SPLITTER.splitToList(hostPath);
                if (!startsWithIgnoreCase(pathComponents, sharedRootComponents)) {
                    throw new IllegalArgumentException("Path " + hostPath + " is outside the shared root " + PATH_JOINER.join(sharedRootComponents));
                }
                return StringUtils.defaultIfEmpty(toPosix(pathComponents.subList(sharedRootComponents.size(), pathComponents.size())), "/");
            default:
                throw new IllegalArgumentException("Unsupported endpoint layout: " + layout);
        }
    }

    private String toPosix(List<String> components) {
        return components.isEmpty() ? "" : "/" + PATH_JOINER.join(components);
    }

    private boolean startsWithIgnoreCase(List<String> components, List<String> prefix) {
        if (components.size() < prefix.size()) {
            return false;
        }
        for (int i = 0; i < prefix.size(); i++) {
            if (!components.get(i).equalsIgnoreCase(prefix.get(i))) {
                return false;
            }
        }
        return true;
    }
}
