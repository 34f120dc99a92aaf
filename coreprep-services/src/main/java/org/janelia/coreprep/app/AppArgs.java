package org.janelia.coreprep.app;

import java.util.HashMap;
import java.util.Map;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;

public class AppArgs {
    @Parameter(names = "-coreInfo", description = "CSV file with the core definitions", required = true)
    String coreInfo;
    @Parameter(names = "-imageDir", description = "Directory containing the channel images; a path on the source endpoint if -remote is set", required = true)
    String imageDir;
    @Parameter(names = "-tempDir", description = "Scratch directory for the core fragments", required = true)
    String tempDir;
    @Parameter(names = "-outputDir", description = "Directory for the assembled cores", required = true)
    String outputDir;
    @Parameter(names = "-remote", description = "Fetch the channel images from the transfer source endpoint", arity = 0)
    boolean remote = false;
    @Parameter(names = "-transferCacheDir", description = "Local directory receiving the fetched channel images")
    String transferCacheDir;
    @Parameter(names = "-h", description = "Display help", arity = 0, help = true)
    boolean displayUsage = false;
    @DynamicParameter(names = "-D", description = "Dynamic application parameters that could override application properties")
    Map<String, String> appDynamicConfig = new HashMap<>();
}
