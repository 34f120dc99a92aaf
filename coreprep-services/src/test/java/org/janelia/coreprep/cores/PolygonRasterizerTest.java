package org.janelia.coreprep.cores;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

public class PolygonRasterizerTest {

    private PolygonRasterizer rasterizer;

    @Before
    public void setUp() {
        rasterizer = new PolygonRasterizer();
    }

    @Test
    public void squareIncludesItsBoundary() {
        List<PolygonVertex> square = ImmutableList.of(
                new PolygonVertex(1, 1),
                new PolygonVertex(1, 3),
                new PolygonVertex(3, 3),
                new PolygonVertex(3, 1));
        boolean[] mask = rasterizer.rasterize(square, 5, 5);
        String[] expected = {
                ".....",
                ".###.",
                ".###.",
                ".###.",
                ".....",
        };
        assertThat(render(mask, 5, 5), equalTo(String.join("\n", expected)));
    }

    @Test
    public void rightTriangle() {
        List<PolygonVertex> triangle = ImmutableList.of(
                new PolygonVertex(0, 0),
                new PolygonVertex(4, 0),
                new PolygonVertex(0, 4));
        boolean[] mask = rasterizer.rasterize(triangle, 5, 5);
        String[] expected = {
                "#####",
                "####.",
                "###..",
                "##...",
                "#....",
        };
        assertThat(render(mask, 5, 5), equalTo(String.join("\n", expected)));
    }

    @Test
    public void concavePolygon() {
        // U shape open at the top
        List<PolygonVertex> uShape = ImmutableList.of(
                new PolygonVertex(0, 0),
                new PolygonVertex(4, 0),
                new PolygonVertex(4, 6),
                new PolygonVertex(0, 6),
                new PolygonVertex(0, 4),
                new PolygonVertex(2, 4),
                new PolygonVertex(2, 2),
                new PolygonVertex(0, 2));
        boolean[] mask = rasterizer.rasterize(uShape, 5, 7);
        String[] expected = {
                "###.###",
                "###.###",
                "#######",
                "#######",
                "#######",
        };
        assertThat(render(mask, 5, 7), equalTo(String.join("\n", expected)));
    }

    @Test
    public void verticesOutsideThePlaneAreClipped() {
        List<PolygonVertex> triangle = ImmutableList.of(
                new PolygonVertex(-10, -10),
                new PolygonVertex(12, -10),
                new PolygonVertex(-10, 12));
        boolean[] mask = rasterizer.rasterize(triangle, 3, 3);
        assertThat(render(mask, 3, 3), equalTo("###\n##.\n#.."));
    }

    private String render(boolean[] mask, int height, int width) {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < height; row++) {
            if (row > 0) {
                sb.append('\n');
            }
            for (int col = 0; col < width; col++) {
                sb.append(mask[row * width + col] ? '#' : '.');
            }
        }
        return sb.toString();
    }
}
