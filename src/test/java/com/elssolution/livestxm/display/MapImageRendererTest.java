package com.elssolution.livestxm.display;

import com.elssolution.livestxm.domain.GridPosition;
import com.elssolution.livestxm.domain.ScanMap;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class MapImageRendererTest {

    private static int gray(BufferedImage img, int x, int y) {
        return img.getRaster().getSample(x, y, 0);
    }

    @Test
    void row_zero_is_drawn_at_the_bottom_and_unwritten_cells_are_black() {
        MapImageRenderer renderer = new MapImageRenderer();
        renderer.setPixelsPerCell(2);
        ScanMap map = new ScanMap(2, 3);
        map.put(new GridPosition(0, 0), 10.0);   // y-min, x-min
        map.put(new GridPosition(1, 2), 20.0);   // y-max, x-max

        BufferedImage img = renderer.render(map.snapshot("s", 1));

        assertThat(img.getWidth()).isEqualTo(6);
        assertThat(img.getHeight()).isEqualTo(4);
        assertThat(gray(img, 0, 3)).isZero();        // bottom-left: lowest written value
        assertThat(gray(img, 1, 2)).isZero();
        assertThat(gray(img, 5, 0)).isEqualTo(255);  // top-right: highest
        assertThat(gray(img, 2, 0)).isZero();        // unwritten
    }

    @Test
    void levels_ignore_unwritten_cells() {
        MapImageRenderer renderer = new MapImageRenderer();
        renderer.setPixelsPerCell(1);
        ScanMap map = new ScanMap(1, 3);
        map.put(new GridPosition(0, 0), 100.0);
        map.put(new GridPosition(0, 1), 200.0);

        BufferedImage img = renderer.render(map.snapshot("s", 1));

        assertThat(gray(img, 0, 0)).isZero();
        assertThat(gray(img, 1, 0)).isEqualTo(255);
        assertThat(gray(img, 2, 0)).isZero();
    }

    @Test
    void large_grids_shrink_cells_to_keep_the_image_bounded() {
        MapImageRenderer renderer = new MapImageRenderer();   // 16 px per cell
        assertThat(renderer.scaleFor(4000, 4000)).isEqualTo(1);
        assertThat(renderer.scaleFor(300, 300)).isEqualTo(13);
        assertThat(renderer.scaleFor(10, 10)).isEqualTo(16);
        assertThat(renderer.scaleFor(10_000, 1)).isEqualTo(1);

        ScanMap map = new ScanMap(4000, 2);
        map.put(new GridPosition(0, 0), 1.0);
        map.put(new GridPosition(3999, 1), 2.0);

        BufferedImage img = renderer.render(map.snapshot("s", 1));

        assertThat(img.getHeight()).isEqualTo(4000);
        assertThat(img.getWidth()).isEqualTo(2);
        assertThat(gray(img, 0, 3999)).isZero();
        assertThat(gray(img, 1, 0)).isEqualTo(255);
    }

    @Test
    void flat_map_renders_written_cells_white() {
        assertThat(MapImageRenderer.level(5.0, 5.0, 0.0)).isEqualTo(255);
        assertThat(MapImageRenderer.level(7.5, 5.0, 5.0)).isEqualTo(128);
    }
}
