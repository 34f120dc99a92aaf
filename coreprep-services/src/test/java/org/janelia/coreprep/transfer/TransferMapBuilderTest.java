package org.janelia.coreprep.transfer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThrows;

public class TransferMapBuilderTest {

    @Test
    public void everyChannelLandsInTheCacheDir() {
        TransferMapBuilder transferMapBuilder = new TransferMapBuilder(new EndpointPathConverter(EndpointLayout.POSIX, null));
        Path cacheDir = Paths.get("/tmp/coreprep-cache");
        Map<String, TransferLocation> transferMap = transferMapBuilder.build(ImmutableMap.of(
                "DAPI", "/remote/scans/S1_1.0.4_R000_DAPI_DAPI_FINAL.ome.tif",
                "CD3", "/remote/scans/S1_4.0.4_R000_Cy3_CD3-AF555_FINAL.ome.tif"), cacheDir);

        assertThat(transferMap.keySet(), contains("DAPI", "CD3"));
        TransferLocation dapi = transferMap.get("DAPI");
        assertThat(dapi.getRemotePath(), equalTo("/remote/scans/S1_1.0.4_R000_DAPI_DAPI_FINAL.ome.tif"));
        assertThat(dapi.getLocalPath(), equalTo(cacheDir.resolve("S1_1.0.4_R000_DAPI_DAPI_FINAL.ome.tif")));
        assertThat(dapi.getTransferPath(), equalTo("/tmp/coreprep-cache/S1_1.0.4_R000_DAPI_DAPI_FINAL.ome.tif"));
    }

    @Test
    public void invalidRemotePath() {
        TransferMapBuilder transferMapBuilder = new TransferMapBuilder(new EndpointPathConverter(EndpointLayout.POSIX, null));
        assertThrows(IllegalArgumentException.class,
                () -> transferMapBuilder.build(ImmutableMap.of("DAPI", "/"), Paths.get("/tmp/coreprep-cache")));
    }
}
