package org.janelia.coreprep.transfer;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThrows;

public class EndpointPathConverterTest {

    @Test
    public void convertHostPaths() {
        class TestData {
            final EndpointLayout layout;
            final String sharedRoot;
            final String hostPath;
            final String expectedPath;

            TestData(EndpointLayout layout, String sharedRoot, String hostPath, String expectedPath) {
                this.layout = layout;
                this.sharedRoot = sharedRoot;
                this.hostPath = hostPath;
                this.expectedPath = expectedPath;
            }
        }
        TestData[] testData = {
                new TestData(EndpointLayout.POSIX, null, "/data/cache/a.ome.tif", "/data/cache/a.ome.tif"),
                new TestData(EndpointLayout.MULTI_DRIVE, null, "C:\\data\\cache\\a.ome.tif", "/C/data/cache/a.ome.tif"),
                new TestData(EndpointLayout.MULTI_DRIVE, null, "d:/cache/a.ome.tif", "/D/cache/a.ome.tif"),
                new TestData(EndpointLayout.SINGLE_DRIVE, null, "R:\\data\\a.ome.tif", "/data/a.ome.tif"),
                new TestData(EndpointLayout.SINGLE_DRIVE, null, "R:\\", "/"),
                new TestData(EndpointLayout.SINGLE_DRIVE, null, "/mnt/data/a.ome.tif", "/mnt/data/a.ome.tif"),
                new TestData(EndpointLayout.SUBFOLDER_ROOT, "C:\\shared", "C:\\shared\\cache\\a.ome.tif", "/cache/a.ome.tif"),
                new TestData(EndpointLayout.SUBFOLDER_ROOT, "C:\\Shared\\", "c:\\SHARED\\cache\\a.ome.tif", "/cache/a.ome.tif"),
                new TestData(EndpointLayout.SUBFOLDER_ROOT, "/groups/lab", "/groups/lab", "/")
        };
        for (TestData td : testData) {
            EndpointPathConverter converter = new EndpointPathConverter(td.layout, td.sharedRoot);
            assertThat(td.layout + " " + td.hostPath, converter.toEndpointPath(td.hostPath), equalTo(td.expectedPath));
        }
    }

    @Test
    public void multiDriveRequiresADrive() {
        EndpointPathConverter converter = new EndpointPathConverter(EndpointLayout.MULTI_DRIVE, null);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> converter.toEndpointPath("/data/a.ome.tif"));
        assertThat(e.getMessage(), containsString("must include a drive"));
    }

    @Test
    public void subfolderRootRejectsPathsOutsideTheRoot() {
        EndpointPathConverter converter = new EndpointPathConverter(EndpointLayout.SUBFOLDER_ROOT, "C:\\shared");
        assertThrows(IllegalArgumentException.class, () -> converter.toEndpointPath("C:\\other\\a.ome.tif"));
        // a name prefix is not a folder prefix
        assertThrows(IllegalArgumentException.class, () -> converter.toEndpointPath("C:\\shared2\\a.ome.tif"));
    }

    @Test
    public void subfolderRootRequiresTheSharedRoot() {
        assertThrows(IllegalArgumentException.class, () -> new EndpointPathConverter(EndpointLayout.SUBFOLDER_ROOT, " "));
    }

    @Test
    public void layoutNames() {
        assertThat(EndpointLayout.fromLayoutName("multi_drive"), equalTo(EndpointLayout.MULTI_DRIVE));
        assertThat(EndpointLayout.fromLayoutName("SUBFOLDER_ROOT"), equalTo(EndpointLayout.SUBFOLDER_ROOT));
        assertThrows(IllegalArgumentException.class, () -> EndpointLayout.fromLayoutName("network_share"));
    }
}
