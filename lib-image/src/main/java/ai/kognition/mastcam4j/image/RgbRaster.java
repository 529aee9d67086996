/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.mastcam4j.image;

import java.util.Arrays;

/**
 * <p>
 * Three channel floating point raster. Channel planes are stored separately and indexed
 * by {@code ColorChannel.index}: 0 is red, 1 is green and 2 is blue. Values are in the
 * units of the source samples and are unbounded until the final contrast stretch.
 * </p>
 *
 * <p>
 * Each pipeline stage hands a new {@link RgbRaster} to the next one. Outside of this
 * package the channel data is only handed out as a copy ({@link #copyPlane(int)}) so a
 * raster can't be changed behind the back of the stage that produced it.
 * </p>
 */
public final class RgbRaster {
    public static final int CHANNELS = 3;

    public final int rows;
    public final int cols;

    private final double[][] planes;

    public RgbRaster(final int rows, final int cols) {
        if(rows <= 0 || cols <= 0)
            throw new InvalidDimensionsException("A raster must have positive dimensions but was " + rows + "x" + cols);
        this.rows = rows;
        this.cols = cols;
        this.planes = new double[CHANNELS][rows * cols];
    }

    private RgbRaster(final int rows, final int cols, final double[][] planes) {
        this.rows = rows;
        this.cols = cols;
        this.planes = planes;
    }

    /**
     * Apply the given function to every channel value of every pixel, producing a new raster.
     */
    @FunctionalInterface
    public static interface ChannelOp {
        public double apply(int channel, double value);
    }

    public double get(final int row, final int col, final int channel) {
        return planes[channel][(row * cols) + col];
    }

    public void set(final int row, final int col, final int channel, final double value) {
        planes[channel][(row * cols) + col] = value;
    }

    /**
     * Get the pixel at the row/col position as {@code double[] {r, g, b}}.
     */
    public double[] get(final int row, final int col) {
        final int pos = (row * cols) + col;
        return new double[] {planes[0][pos],planes[1][pos],planes[2][pos]};
    }

    public void set(final int row, final int col, final double r, final double g, final double b) {
        final int pos = (row * cols) + col;
        planes[0][pos] = r;
        planes[1][pos] = g;
        planes[2][pos] = b;
    }

    /**
     * The live, row-major backing array of one channel. Only code in this package writes
     * through it.
     */
    double[] plane(final int channel) {
        return planes[channel];
    }

    /**
     * A row-major copy of one channel.
     */
    public double[] copyPlane(final int channel) {
        return Arrays.copyOf(planes[channel], planes[channel].length);
    }

    public int pixelCount() {
        return rows * cols;
    }

    public RgbRaster map(final ChannelOp op) {
        final RgbRaster ret = new RgbRaster(rows, cols);
        for(int ch = 0; ch < CHANNELS; ch++) {
            final double[] src = planes[ch];
            final double[] dst = ret.planes[ch];
            for(int i = 0; i < src.length; i++)
                dst[i] = op.apply(ch, src[i]);
        }
        return ret;
    }

    public RgbRaster copy() {
        final double[][] copy = new double[CHANNELS][];
        for(int ch = 0; ch < CHANNELS; ch++)
            copy[ch] = Arrays.copyOf(planes[ch], planes[ch].length);
        return new RgbRaster(rows, cols, copy);
    }

    public boolean sameDimensions(final RgbRaster other) {
        return rows == other.rows && cols == other.cols;
    }

    @Override
    public String toString() {
        return "RgbRaster [rows=" + rows + ", cols=" + cols + "]";
    }
}
