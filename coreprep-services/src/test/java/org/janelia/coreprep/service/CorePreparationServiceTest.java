package org.janelia.coreprep.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import jakarta.enterprise.inject.Instance;
import org.janelia.coreprep.cdi.ObjectMapperFactory;
import org.janelia.coreprep.config.PreparationSettings;
import org.janelia.coreprep.imaging.ImagePlane;
import org.janelia.coreprep.imaging.ImagePlaneIO;
import org.janelia.coreprep.imaging.PixelType;
import org.janelia.coreprep.orchestration.PreparationSummary;
import org.janelia.coreprep.transfer.RetryPolicy;
import org.janelia.coreprep.transfer.TransferClient;
import org.janelia.coreprep.transfer.TransferRequest;
import org.janelia.coreprep.transfer.TransferTaskInfo;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.slf4j.Logger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CorePreparationServiceTest {

    private static final List<String> CHANNEL_FILES = ImmutableList.of(
            "S1_1.0.4_R000_DAPI_DAPI_FINAL.ome.tif",
            "S1_2.0.4_R000_DAPI_DAPI_FINAL.ome.tif",
            "S1_1.0.4_R000_Cy3_CD3-AF555_FINAL.ome.tif",
            "S1_4.0.4_R000_Cy3_CD3-AF555_FINAL.ome.tif",
            "S1_2.0.4_R000_Cy5_CD20-AF647_FINAL.ome.tif",
            "S1_3.0.3_R000_Cy5_CD45-AF647_FINAL.ome.tif");

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private Path imageDir;
    private Path coreInfoFile;
    private Path tempDir;
    private Path outputDir;
    private TransferClient transferClient;
    private Instance<TransferClient> transferClientSource;
    private Instance<RetryPolicy> retryPolicySource;

    @SuppressWarnings("unchecked")
    @Before
    public void setUp() throws IOException {
        imageDir = testFolder.newFolder("images").toPath();
        for (int i = 0; i < CHANNEL_FILES.size(); i++) {
            ImagePlane plane = new ImagePlane(64, 64, PixelType.UINT16);
            plane.fill(1000 * (i + 1));
            ImagePlaneIO.writeTiff(plane, imageDir.resolve(CHANNEL_FILES.get(i)));
        }
        coreInfoFile = testFolder.newFile("cores.csv").toPath();
        Files.write(coreInfoFile, String.join("\n",
                "core_name,row_start,row_stop,column_start,column_stop,poly_type,polygon_vertices,channels",
                "A-1,10,20,10,20,rectangle,,",
                "A-2,30,50,30,50,polygon,\"[[30, 30], [50, 30], [30, 50]]\",",
                "A-3,0,8,0,8,rectangle,,DAPI").getBytes(StandardCharsets.UTF_8));
        tempDir = testFolder.getRoot().toPath().resolve("fragments");
        outputDir = testFolder.getRoot().toPath().resolve("output");
        transferClient = mock(TransferClient.class);
        transferClientSource = mock(Instance.class);
        when(transferClientSource.get()).thenReturn(transferClient);
        retryPolicySource = mock(Instance.class);
        when(retryPolicySource.get()).thenReturn(new RetryPolicy(3, 1, 10, new Random(), millis -> {}));
    }

    @Test
    public void prepareCoresFromLocalImages() throws IOException {
        CorePreparationService preparationService = createService(PreparationSettings.builder()
                .margin(2)
                .maxPyramidLevels(2)
                .pollInterval(Duration.ZERO)
                .build());

        PreparationSummary summary = preparationService.prepare(
                new PreparationRequest(coreInfoFile, imageDir.toString(), tempDir, outputDir, false, null));

        assertThat(summary.hasFailures(), equalTo(false));
        assertThat(summary.getAssembledCores().keySet(), equalTo(ImmutableSet.of("A-1", "A-2", "A-3")));
        Path a1 = outputDir.resolve("A-1.pyramid");
        assertThat(listNames(a1), contains("CD20", "CD3", "DAPI", "multiscales.json"));
        assertThat(listNames(outputDir.resolve("A-3.pyramid")), contains("DAPI", "multiscales.json"));

        ImagePlane a1Dapi = ImagePlaneIO.readTiff(a1.resolve("DAPI").resolve("0.tiff"));
        assertThat(a1Dapi.getHeight(), equalTo(14));
        assertThat(a1Dapi.getWidth(), equalTo(14));
        assertThat(a1Dapi.get(0, 0), equalTo(1000));
        ImagePlane a1Cd3 = ImagePlaneIO.readTiff(a1.resolve("CD3").resolve("0.tiff"));
        // round 4 wins over round 1
        assertThat(a1Cd3.get(5, 5), equalTo(4000));
        assertThat(listNames(a1.resolve("CD3")), contains("0.tiff", "1.tiff"));

        // fragments are removed after assembly, source images are kept
        assertThat(listNames(tempDir.resolve("A-1")), hasSize(0));
        assertThat(Files.exists(imageDir.resolve(CHANNEL_FILES.get(0))), equalTo(true));
        verify(transferClientSource, never()).get();
    }

    @Test
    public void prepareCoresFromRemoteImages() throws IOException {
        Path cacheDir = testFolder.getRoot().toPath().resolve("cache");
        when(transferClient.listDirectory("src-endpoint", "/remote/scans")).thenReturn(CHANNEL_FILES);
        when(transferClient.submitTransfer(any(TransferRequest.class))).thenAnswer(invocation -> {
            TransferRequest request = invocation.getArgument(0);
            return "task:" + request.getSourcePath();
        });
        when(transferClient.getTaskStatus(anyString())).thenAnswer(invocation -> {
            String taskId = invocation.getArgument(0);
            String fileName = taskId.substring(taskId.lastIndexOf('/') + 1);
            // the transfer service delivers the file before it reports success
            Files.copy(imageDir.resolve(fileName), cacheDir.resolve(fileName));
            return new TransferTaskInfo(taskId, "SUCCEEDED", "OK");
        });
        CorePreparationService preparationService = createService(PreparationSettings.builder()
                .useChannels(ImmutableList.of("DAPI", "CD3"))
                .pollInterval(Duration.ZERO)
                .build());

        PreparationSummary summary = preparationService.prepare(
                new PreparationRequest(coreInfoFile, "/remote/scans", tempDir, outputDir, true, cacheDir));

        assertThat(summary.hasFailures(), equalTo(false));
        assertThat(listNames(outputDir.resolve("A-1.pyramid")), contains("CD3", "DAPI", "multiscales.json"));
        // transferred images are deleted once cut
        assertThat(listNames(cacheDir), hasSize(0));
        verify(transferClient, times(2)).submitTransfer(any(TransferRequest.class));
    }

    @Test
    public void coreRequiringAnUnselectedChannelIsRejected() {
        CorePreparationService preparationService = createService(PreparationSettings.builder()
                .useChannels(ImmutableList.of("CD3"))
                .build());
        assertThrows(IllegalArgumentException.class, () -> preparationService.prepare(
                new PreparationRequest(coreInfoFile, imageDir.toString(), tempDir, outputDir, false, null)));
    }

    @Test
    public void remoteRunRequiresACacheDir() {
        assertThrows(IllegalArgumentException.class,
                () -> new PreparationRequest(coreInfoFile, "/remote/scans", tempDir, outputDir, true, null));
    }

    private CorePreparationService createService(PreparationSettings settings) {
        return new CorePreparationService(mock(Logger.class),
                settings,
                ObjectMapperFactory.instance().newObjectMapper(),
                transferClientSource,
                retryPolicySource,
                "src-endpoint",
                "dst-endpoint",
                "posix",
                null);
    }

    private List<String> listNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }
}
