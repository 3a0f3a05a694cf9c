package com.elssolution.livestxm.domain;

import lombok.Value;

/** Display-resolution copy of a frame, row-major float32. */
@Value
public class DownsampledImage {
    int height;
    int width;
    float[] pixels;

    public DownsampledImage(int height, int width, float[] pixels) {
        if (pixels.length != height * width) {
            throw new IllegalArgumentException("pixels length " + pixels.length + " != " + height + "x" + width);
        }
        this.height = height;
        this.width = width;
        this.pixels = pixels;
    }

    public float get(int row, int col) {
        return pixels[row * width + col];
    }
}
