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
 * A single channel Bayer mosaic capture. One unsigned sample per sensor pixel stored
 * row-major. {@link MosaicFrame}s are immutable; the array passed in is copied.
 * </p>
 *
 * <p>
 * The {@code bitDepth} is the width of the source samples (8 for the usual Mastcam EDR,
 * 16 for wider products). Every sample must be in {@code [0, 2^bitDepth - 1]}.
 * </p>
 */
public final class MosaicFrame {
    public final int rows;
    public final int cols;
    public final int bitDepth;

    private final int[] samples;

    public MosaicFrame(final int rows, final int cols, final int bitDepth, final int[] samples) {
        if(rows <= 0 || cols <= 0)
            throw new InvalidDimensionsException("A mosaic frame must have positive dimensions but was " + rows + "x" + cols);
        if(bitDepth < 1 || bitDepth > 16)
            throw new IllegalArgumentException("Unsupported sample bit depth " + bitDepth + ". It must be from 1 to 16.");
        if(samples == null)
            throw new NullPointerException("Mosaic samples cannot be null");
        if((long)rows * cols != samples.length)
            throw new InvalidDimensionsException("A " + rows + "x" + cols + " mosaic frame needs " + ((long)rows * cols) + " samples but " + samples.length
                + " were supplied");

        final int max = (1 << bitDepth) - 1;
        for(int i = 0; i < samples.length; i++) {
            final int s = samples[i];
            if(s < 0 || s > max)
                throw new IllegalArgumentException(
                    "Sample " + s + " at (" + (i / cols) + ", " + (i % cols) + ") is out of range for a " + bitDepth + " bit frame");
        }

        this.rows = rows;
        this.cols = cols;
        this.bitDepth = bitDepth;
        this.samples = Arrays.copyOf(samples, samples.length);
    }

    /**
     * Wrap unsigned 8-bit data, row-major.
     */
    public static MosaicFrame fromUnsignedBytes(final int rows, final int cols, final byte[] data) {
        if(data == null)
            throw new NullPointerException("Mosaic data cannot be null");
        final int[] samples = new int[data.length];
        for(int i = 0; i < data.length; i++)
            samples[i] = data[i] & 0xff;
        return new MosaicFrame(rows, cols, 8, samples);
    }

    public int get(final int row, final int col) {
        return samples[(row * cols) + col];
    }

    /**
     * The largest value a sample of this frame's bit depth can hold.
     */
    public int maxValue() {
        return (1 << bitDepth) - 1;
    }

    public int size() {
        return samples.length;
    }

    /**
     * A copy of the samples, row-major.
     */
    public int[] copySamples() {
        return Arrays.copyOf(samples, samples.length);
    }

    @Override
    public String toString() {
        return "MosaicFrame [rows=" + rows + ", cols=" + cols + ", bitDepth=" + bitDepth + "]";
    }
}
