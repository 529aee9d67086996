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

package ai.kognition.mastcam4j.image.color;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.ColorChannel;
import ai.kognition.mastcam4j.image.calc.ChannelStatistics;

/**
 * <p>
 * Maps the {@code low} percentile of a channel to 0 and the {@code high} percentile to 255,
 * linearly, then clamps and rounds (half up) to whole numbers. This is the last stage of the
 * pipeline and the only one that clamps.
 * </p>
 *
 * <p>
 * If the two percentiles are equal the channel has nothing to stretch and every value becomes
 * {@link #DEGENERATE_VALUE}.
 * </p>
 */
public class PercentileContrastStretcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(PercentileContrastStretcher.class);

    public static final double DEFAULT_LOW_PERCENTILE = 0.5;
    public static final double DEFAULT_HIGH_PERCENTILE = 99.5;

    public static final double OUTPUT_MAX = 255.0;
    public static final double DEGENERATE_VALUE = Math.round(OUTPUT_MAX / 2.0);

    private final StretchMode mode;

    public PercentileContrastStretcher() {
        this(StretchMode.PER_CHANNEL);
    }

    public PercentileContrastStretcher(final StretchMode mode) {
        if(mode == null)
            throw new NullPointerException("The stretch mode cannot be null");
        this.mode = mode;
    }

    public RgbRaster stretch(final RgbRaster raster) {
        return stretch(raster, DEFAULT_LOW_PERCENTILE, DEFAULT_HIGH_PERCENTILE);
    }

    /**
     * @throws IllegalArgumentException unless {@code 0 <= low <= high <= 100}.
     */
    public RgbRaster stretch(final RgbRaster raster, final double low, final double high) {
        validateBounds(low, high);

        final double[] lows = new double[RgbRaster.CHANNELS];
        final double[] highs = new double[RgbRaster.CHANNELS];

        if(mode == StretchMode.GLOBAL) {
            final Pair<Double, Double> range = ChannelStatistics.globalPercentileRange(raster, low, high);
            for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
                lows[ch] = range.getLeft();
                highs[ch] = range.getRight();
            }
        } else {
            for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
                final Pair<Double, Double> range = ChannelStatistics.percentileRange(raster, ch, low, high);
                lows[ch] = range.getLeft();
                highs[ch] = range.getRight();
            }
        }

        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
            if(highs[ch] <= lows[ch])
                LOGGER.debug("The {} channel has no spread between the {} and {} percentiles ({}). It will be set to {}.",
                    ColorChannel.fromIndex(ch), low, high, lows[ch], DEGENERATE_VALUE);
        }

        return raster.map((ch, v) -> stretchValue(v, lows[ch], highs[ch]));
    }

    public static void validateBounds(final double low, final double high) {
        if(!(low >= 0.0 && low <= high && high <= 100.0))
            throw new IllegalArgumentException("The stretch percentiles must satisfy 0 <= low <= high <= 100 but were low=" + low + ", high=" + high);
    }

    static double stretchValue(final double v, final double lowValue, final double highValue) {
        if(highValue <= lowValue)
            return DEGENERATE_VALUE;
        final double scaled = ((v - lowValue) / (highValue - lowValue)) * OUTPUT_MAX;
        final double clamped = Math.max(0.0, Math.min(OUTPUT_MAX, scaled));
        return Math.floor(clamped + 0.5);
    }

    public StretchMode mode() {
        return mode;
    }
}
