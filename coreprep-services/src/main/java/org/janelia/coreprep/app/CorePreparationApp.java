package org.janelia.coreprep.app;

import java.nio.file.Paths;

import jakarta.enterprise.inject.se.SeContainer;
import jakarta.enterprise.inject.se.SeContainerInitializer;

import com.beust.jcommander.JCommander;
import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.cdi.ApplicationConfigProvider;
import org.janelia.coreprep.orchestration.PreparationSummary;
import org.janelia.coreprep.service.CorePreparationService;
import org.janelia.coreprep.service.PreparationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point for preparing cores.
 */
public class CorePreparationApp {

    private static final Logger LOG = LoggerFactory.getLogger(CorePreparationApp.class);

    public static void main(String[] args) {
        int exitCode;
        try {
            AppArgs appArgs = parseAppArgs(args, new AppArgs());
            if (appArgs.displayUsage) {
                displayAppUsage(appArgs);
                return;
            }
            exitCode = run(appArgs);
        } catch (Throwable e) {
            LOG.error("Error running core preparation", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(AppArgs appArgs) {
        PreparationRequest request = new PreparationRequest(
                Paths.get(appArgs.coreInfo),
                appArgs.imageDir,
                Paths.get(appArgs.tempDir),
                Paths.get(appArgs.outputDir),
                appArgs.remote,
                StringUtils.isBlank(appArgs.transferCacheDir) ? null : Paths.get(appArgs.transferCacheDir));
        SeContainerInitializer containerInit = SeContainerInitializer.newInstance();
        try (SeContainer container = containerInit.initialize()) {
            CorePreparationService preparationService = container.select(CorePreparationService.class).get();
            PreparationSummary summary = preparationService.prepare(request);
            return summary.hasFailures() ? 2 : 0;
        }
    }

    static <A extends AppArgs> A parseAppArgs(String[] args, A appArgs) {
        JCommander cmdline = new JCommander(appArgs);
        cmdline.parse(args);
        // update the dynamic config
        ApplicationConfigProvider.setAppDynamicArgs(appArgs.appDynamicConfig);
        return appArgs;
    }

    static <A extends AppArgs> void displayAppUsage(A appArgs) {
        StringBuilder output = new StringBuilder();
        JCommander cmdline = new JCommander(appArgs);
        cmdline.getUsageFormatter().usage(output);
        System.out.println(output);
    }
}
