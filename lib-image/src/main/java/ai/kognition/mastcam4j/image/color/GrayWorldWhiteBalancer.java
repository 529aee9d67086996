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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.ColorChannel;
import ai.kognition.mastcam4j.image.calc.ChannelStatistics;

/**
 * <p>
 * Gray-world white balance. The scene is assumed to average out to gray so each channel
 * is scaled until its mean equals the target (see {@link WhiteBalanceTarget}).
 * </p>
 *
 * <p>
 * A channel whose mean isn't positive can't be scaled to anything and is passed through
 * with a gain of 1. Nothing is clamped.
 * </p>
 */
public class GrayWorldWhiteBalancer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GrayWorldWhiteBalancer.class);

    private final WhiteBalanceTarget target;

    public GrayWorldWhiteBalancer() {
        this(WhiteBalanceTarget.AVERAGE);
    }

    public GrayWorldWhiteBalancer(final WhiteBalanceTarget target) {
        if(target == null)
            throw new NullPointerException("The white balance target cannot be null");
        this.target = target;
    }

    public RgbRaster whiteBalance(final RgbRaster raster) {
        final double[] gains = gains(ChannelStatistics.channelMeans(raster));
        return raster.map((ch, v) -> v * gains[ch]);
    }

    /**
     * The per-channel gains for the given channel means.
     */
    double[] gains(final double[] means) {
        final double targetValue = target == WhiteBalanceTarget.GREEN ? means[ColorChannel.GREEN.index]
            : (means[0] + means[1] + means[2]) / RgbRaster.CHANNELS;

        final double[] ret = new double[RgbRaster.CHANNELS];
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
            if(means[ch] <= 0.0) {
                LOGGER.debug("The {} channel has a mean of {} so it's left unbalanced", ColorChannel.fromIndex(ch), means[ch]);
                ret[ch] = 1.0;
            } else
                ret[ch] = targetValue / means[ch];
        }

        if(LOGGER.isTraceEnabled())
            LOGGER.trace("Channel means {} balanced to {} with gains {}", Arrays.toString(means), targetValue, Arrays.toString(ret));
        return ret;
    }

    public WhiteBalanceTarget target() {
        return target;
    }
}
