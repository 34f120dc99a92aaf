package org.janelia.coreprep.service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.Dependent;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ticker;
import org.apache.commons.lang3.StringUtils;
import org.janelia.coreprep.assembly.CoreAssembler;
import org.janelia.coreprep.assembly.FileSystemPyramidStore;
import org.janelia.coreprep.assembly.PyramidBuilder;
import org.janelia.coreprep.cdi.qualifier.PropertyValue;
import org.janelia.coreprep.channels.ChannelCatalog;
import org.janelia.coreprep.channels.ChannelDescriptor;
import org.janelia.coreprep.channels.ChannelListing;
import org.janelia.coreprep.channels.LocalChannelListing;
import org.janelia.coreprep.channels.RemoteChannelListing;
import org.janelia.coreprep.config.PreparationSettings;
import org.janelia.coreprep.cores.CoreMetadataReader;
import org.janelia.coreprep.cores.CoreSpec;
import org.janelia.coreprep.cores.RegionExtractor;
import org.janelia.coreprep.fragments.FragmentStore;
import org.janelia.coreprep.imaging.TiffChannelImage;
import org.janelia.coreprep.orchestration.PreparationOrchestrator;
import org.janelia.coreprep.orchestration.PreparationRun;
import org.janelia.coreprep.orchestration.PreparationSummary;
import org.janelia.coreprep.transfer.EndpointLayout;
import org.janelia.coreprep.transfer.EndpointPathConverter;
import org.janelia.coreprep.transfer.FileAvailability;
import org.janelia.coreprep.transfer.LocalAvailability;
import org.janelia.coreprep.transfer.RemoteAvailability;
import org.janelia.coreprep.transfer.RetryPolicy;
import org.janelia.coreprep.transfer.TransferClient;
import org.janelia.coreprep.transfer.TransferEndpoints;
import org.janelia.coreprep.transfer.TransferLocation;
import org.janelia.coreprep.transfer.TransferMapBuilder;
import org.janelia.coreprep.utils.FileUtils;
import org.janelia.coreprep.utils.Sleeper;
import org.slf4j.Logger;

/**
 * Wires the components of a preparation run from the application settings and runs it.
 */
@Dependent
public class CorePreparationService {

    private final Logger logger;
    private final PreparationSettings settings;
    private final ObjectMapper objectMapper;
    private final Instance<TransferClient> transferClientSource;
    private final Instance<RetryPolicy> retryPolicySource;
    private final String sourceEndpoint;
    private final String destinationEndpoint;
    private final String endpointLayout;
    private final String endpointSharedRoot;

    @Inject
    public CorePreparationService(Logger logger,
                                  PreparationSettings settings,
                                  ObjectMapper objectMapper,
                                  Instance<TransferClient> transferClientSource,
                                  Instance<RetryPolicy> retryPolicySource,
                                  @PropertyValue(name = "Transfer.SourceEndpoint") String sourceEndpoint,
                                  @PropertyValue(name = "Transfer.DestinationEndpoint") String destinationEndpoint,
                                  @PropertyValue(name = "Transfer.EndpointLayout") String endpointLayout,
                                  @PropertyValue(name = "Transfer.EndpointSharedRoot") String endpointSharedRoot) {
        this.logger = logger;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.transferClientSource = transferClientSource;
        this.retryPolicySource = retryPolicySource;
        this.sourceEndpoint = sourceEndpoint;
        this.destinationEndpoint = destinationEndpoint;
        this.endpointLayout = endpointLayout;
        this.endpointSharedRoot = endpointSharedRoot;
    }

    public PreparationSummary prepare(PreparationRequest request) {
        logger.info("Prepare cores for {} with {}", request, settings);
        List<CoreSpec> cores = new CoreMetadataReader(objectMapper).read(request.getCoreInfoFile());
        ChannelCatalog channelCatalog = new ChannelCatalog(settings.getChannelSelection());

        FileAvailability fileAvailability;
        Map<String, Path> channelPaths = new LinkedHashMap<>();
        if (request.isRemote()) {
            TransferClient transferClient = transferClientSource.get();
            TransferEndpoints endpoints = new TransferEndpoints(sourceEndpoint, destinationEndpoint);
            ChannelListing channelListing = new RemoteChannelListing(transferClient, endpoints.getSourceEndpoint(), request.getImageDir());
            Map<String, ChannelDescriptor> channels = channelCatalog.discover(channelListing.listFiles());
            FileUtils.createDirs(request.getTransferCacheDir());
            EndpointPathConverter pathConverter = new EndpointPathConverter(
                    EndpointLayout.fromLayoutName(StringUtils.defaultIfBlank(endpointLayout, EndpointLayout.POSIX.getLayoutName())),
                    endpointSharedRoot);
            Map<String, TransferLocation> transferMap = new TransferMapBuilder(pathConverter)
                    .build(ChannelCatalog.toPathMap(channels), request.getTransferCacheDir());
            transferMap.forEach((channel, location) -> channelPaths.put(channel, location.getLocalPath()));
            fileAvailability = new RemoteAvailability(transferClient, transferMap, endpoints, retryPolicySource.get(), settings.isTransferCleanupEnabled());
        } else {
            ChannelListing channelListing = new LocalChannelListing(Paths.get(request.getImageDir()));
            Map<String, ChannelDescriptor> channels = channelCatalog.discover(channelListing.listFiles());
            channels.forEach((channel, descriptor) -> channelPaths.put(channel, Paths.get(descriptor.getSourcePath())));
            fileAvailability = new LocalAvailability();
        }

        FileUtils.createDirs(request.getTempDir());
        FileUtils.createDirs(request.getOutputDir());
        FragmentStore fragmentStore = new FragmentStore(request.getTempDir());
        CoreAssembler coreAssembler = new CoreAssembler(
                fragmentStore,
                new FileSystemPyramidStore(request.getOutputDir(), objectMapper),
                new PyramidBuilder(settings.getMaxPyramidLevels(), settings.getDownscale()),
                channelPaths.keySet(),
                settings.isCoreCleanupEnabled());
        PreparationOrchestrator orchestrator = new PreparationOrchestrator(
                fileAvailability,
                new RegionExtractor(settings.getMargin(), settings.getMaskValue()),
                fragmentStore,
                coreAssembler,
                TiffChannelImage::open,
                settings.getPollInterval(),
                settings.getMaxWait(),
                Sleeper.SYSTEM,
                Ticker.systemTicker());
        return orchestrator.run(new PreparationRun(channelPaths, cores));
    }
}
