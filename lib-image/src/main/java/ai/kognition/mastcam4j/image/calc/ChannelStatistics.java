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

package ai.kognition.mastcam4j.image.calc;

import java.util.Arrays;

import org.apache.commons.lang3.tuple.Pair;

import ai.kognition.mastcam4j.image.RgbRaster;

/**
 * Per-raster aggregates used by the colour stages: channel means and percentiles.
 * Percentiles are linearly interpolated between order statistics at rank
 * {@code p / 100 * (n - 1)}, which is what numpy's default percentile does.
 */
public final class ChannelStatistics {

    private ChannelStatistics() {}

    public static double mean(final double[] values) {
        if(values.length == 0)
            throw new IllegalArgumentException("Cannot take the mean of no values");
        double sum = 0.0;
        for(final double v: values)
            sum += v;
        return sum / values.length;
    }

    /**
     * @return the means of the red, green and blue planes, in that order.
     */
    public static double[] channelMeans(final RgbRaster raster) {
        final double[] ret = new double[RgbRaster.CHANNELS];
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
            ret[ch] = mean(raster.copyPlane(ch));
        return ret;
    }

    /**
     * The given percentile of values that are already sorted ascending.
     */
    public static double percentileOfSorted(final double[] sorted, final double percentile) {
        checkPercentile(percentile);
        if(sorted.length == 0)
            throw new IllegalArgumentException("Cannot take a percentile of no values");

        final double rank = (percentile * (sorted.length - 1)) / 100.0;
        final int below = (int)Math.floor(rank);
        final int above = (int)Math.ceil(rank);
        if(below == above)
            return sorted[below];
        return sorted[below] + ((sorted[above] - sorted[below]) * (rank - below));
    }

    /**
     * The low and high percentiles of the values. The values aren't modified.
     */
    public static Pair<Double, Double> percentileRange(final double[] values, final double low, final double high) {
        final double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return Pair.of(percentileOfSorted(sorted, low), percentileOfSorted(sorted, high));
    }

    /**
     * The low and high percentiles of one channel of the raster.
     */
    public static Pair<Double, Double> percentileRange(final RgbRaster raster, final int channel, final double low, final double high) {
        final double[] sorted = raster.copyPlane(channel);
        Arrays.sort(sorted);
        return Pair.of(percentileOfSorted(sorted, low), percentileOfSorted(sorted, high));
    }

    /**
     * The low and high percentiles of every channel value of the raster taken together.
     */
    public static Pair<Double, Double> globalPercentileRange(final RgbRaster raster, final double low, final double high) {
        final int n = raster.pixelCount();
        final double[] all = new double[n * RgbRaster.CHANNELS];
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
            System.arraycopy(raster.copyPlane(ch), 0, all, ch * n, n);
        Arrays.sort(all);
        return Pair.of(percentileOfSorted(all, low), percentileOfSorted(all, high));
    }

    private static void checkPercentile(final double percentile) {
        if(!(percentile >= 0.0 && percentile <= 100.0))
            throw new IllegalArgumentException("A percentile must be from 0 to 100 but was " + percentile);
    }
}
