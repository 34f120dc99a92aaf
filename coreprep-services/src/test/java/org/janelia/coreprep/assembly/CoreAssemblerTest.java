package org.janelia.coreprep.assembly;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.common.collect.ImmutableSet;
import org.janelia.coreprep.exceptions.CoreAssemblyException;
import org.janelia.coreprep.exceptions.MissingDataException;
import org.janelia.coreprep.fragments.FragmentStore;
import org.janelia.coreprep.imaging.ImagePlane;
import org.janelia.coreprep.imaging.PixelType;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.ArgumentCaptor;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class CoreAssemblerTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private FragmentStore fragmentStore;
    private OutputStore outputStore;
    private PyramidBuilder pyramidBuilder;

    @Before
    public void setUp() throws IOException {
        fragmentStore = new FragmentStore(testFolder.newFolder("fragments").toPath());
        outputStore = mock(OutputStore.class);
        pyramidBuilder = new PyramidBuilder(3, 2);
        when(outputStore.write(anyString(), any(CoreArtifact.class))).thenReturn(Paths.get("/output/A-1.pyramid"));
    }

    @Test
    public void assembleAllFragments() throws IOException {
        writeFragments("A-1", "DAPI", "CD3", "CD20");
        CoreAssembler coreAssembler = new CoreAssembler(fragmentStore, outputStore, pyramidBuilder, ImmutableSet.of(), false);

        Path artifactPath = coreAssembler.assemble("A-1");

        assertThat(artifactPath, equalTo(Paths.get("/output/A-1.pyramid")));
        ArgumentCaptor<CoreArtifact> artifactCaptor = ArgumentCaptor.forClass(CoreArtifact.class);
        verify(outputStore).write(eq("A-1"), artifactCaptor.capture());
        CoreArtifact artifact = artifactCaptor.getValue();
        assertThat(artifact.getCoreId(), equalTo("A-1"));
        assertThat(artifact.getDownscale(), equalTo(2));
        assertThat(artifact.getChannelNames(), contains("CD20", "CD3", "DAPI"));
        assertThat(artifact.getChannels().get(0).getLevels(), hasSize(3));
        // fragments are kept when cleanup is off
        assertThat(fragmentStore.listFragments("A-1"), hasSize(3));
    }

    @Test
    public void onlyAllowedChannelsAreAssembled() throws IOException {
        writeFragments("A-1", "DAPI", "CD3", "CD20");
        CoreAssembler coreAssembler = new CoreAssembler(fragmentStore, outputStore, pyramidBuilder, ImmutableSet.of("DAPI", "CD3"), false);

        coreAssembler.assemble("A-1");

        ArgumentCaptor<CoreArtifact> artifactCaptor = ArgumentCaptor.forClass(CoreArtifact.class);
        verify(outputStore).write(eq("A-1"), artifactCaptor.capture());
        assertThat(artifactCaptor.getValue().getChannelNames(), contains("CD3", "DAPI"));
    }

    @Test
    public void staleFragmentOfAChannelTheCoreDoesNotNeedIsIgnored() throws IOException {
        writeFragments("A-1", "DAPI", "CD3");
        CoreAssembler coreAssembler = new CoreAssembler(fragmentStore, outputStore, pyramidBuilder, ImmutableSet.of("DAPI", "CD3"), true);

        coreAssembler.assemble("A-1", ImmutableSet.of("DAPI"));

        ArgumentCaptor<CoreArtifact> artifactCaptor = ArgumentCaptor.forClass(CoreArtifact.class);
        verify(outputStore).write(eq("A-1"), artifactCaptor.capture());
        assertThat(artifactCaptor.getValue().getChannelNames(), contains("DAPI"));
        // only the consumed fragment is cleaned up
        assertThat(fragmentStore.listFragments("A-1"), contains(fragmentStore.getCoreDir("A-1").resolve("CD3.tiff")));
    }

    @Test
    public void fragmentsAreDeletedAfterAssemblyWhenCleanupIsOn() throws IOException {
        writeFragments("A-1", "DAPI", "CD3");
        CoreAssembler coreAssembler = new CoreAssembler(fragmentStore, outputStore, pyramidBuilder, ImmutableSet.of(), true);

        coreAssembler.assemble("A-1");

        assertThat(fragmentStore.listFragments("A-1"), hasSize(0));
    }

    @Test
    public void missingFragments() throws IOException {
        CoreAssembler coreAssembler = new CoreAssembler(fragmentStore, outputStore, pyramidBuilder, ImmutableSet.of("DAPI"), false);
        MissingDataException noFolder = assertThrows(MissingDataException.class, () -> coreAssembler.assemble("A-1"));
        assertThat(noFolder.getMessage(), containsString("No fragment folder"));

        writeFragments("A-2", "CD3");
        MissingDataException noAllowedFragments = assertThrows(MissingDataException.class, () -> coreAssembler.assemble("A-2"));
        assertThat(noAllowedFragments.getMessage(), containsString("No fragments found"));

        Files.createDirectories(fragmentStore.getCoreDir("A-3"));
        assertThrows(MissingDataException.class, () -> coreAssembler.assemble("A-3"));
        verify(outputStore, never()).write(anyString(), any(CoreArtifact.class));
    }

    @Test
    public void outputErrorKeepsTheFragments() throws IOException {
        writeFragments("A-1", "DAPI");
        when(outputStore.write(anyString(), any(CoreArtifact.class))).thenThrow(new IOException("disk full"));
        CoreAssembler coreAssembler = new CoreAssembler(fragmentStore, outputStore, pyramidBuilder, ImmutableSet.of(), true);

        CoreAssemblyException e = assertThrows(CoreAssemblyException.class, () -> coreAssembler.assemble("A-1"));

        assertThat(e.getCoreId(), equalTo("A-1"));
        assertThat(e.getMessage(), containsString("disk full"));
        assertThat(fragmentStore.listFragments("A-1"), hasSize(1));
    }

    private void writeFragments(String coreId, String... channels) {
        for (String channel : channels) {
            ImagePlane plane = new ImagePlane(6, 6, PixelType.UINT8);
            plane.fill(channel.length());
            fragmentStore.write(coreId, channel, plane);
        }
    }
}
