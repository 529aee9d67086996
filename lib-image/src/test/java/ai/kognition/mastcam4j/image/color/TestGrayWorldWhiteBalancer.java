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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import ai.kognition.mastcam4j.image.MosaicFixtures;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.calc.ChannelStatistics;

public class TestGrayWorldWhiteBalancer {

    private static RgbRaster tinted() {
        final RgbRaster ret = new RgbRaster(4, 5);
        for(int r = 0; r < 4; r++)
            for(int c = 0; c < 5; c++)
                ret.set(r, c, 10.0 + r + c, 40.0 + (2 * r), 100.0 + (3 * c));
        return ret;
    }

    @Test
    public void testChannelMeansAreEqualized() {
        final RgbRaster in = tinted();
        final double[] before = ChannelStatistics.channelMeans(in);
        final double target = (before[0] + before[1] + before[2]) / 3.0;

        final double[] after = ChannelStatistics.channelMeans(new GrayWorldWhiteBalancer().whiteBalance(in));
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
            assertEquals(target, after[ch], 1E-9);
    }

    @Test
    public void testGreenTarget() {
        final RgbRaster in = tinted();
        final double green = ChannelStatistics.channelMeans(in)[1];
        final RgbRaster out = new GrayWorldWhiteBalancer(WhiteBalanceTarget.GREEN).whiteBalance(in);

        final double[] after = ChannelStatistics.channelMeans(out);
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
            assertEquals(green, after[ch], 1E-9);
        assertEquals(in.get(2, 3, 1), out.get(2, 3, 1), 1E-12);
    }

    @Test
    public void testEmptyChannelIsLeftAlone() {
        final RgbRaster in = MosaicFixtures.raster(3, 3, 0.0, 60.0, 30.0);
        final RgbRaster out = new GrayWorldWhiteBalancer().whiteBalance(in);
        // the target is (0 + 60 + 30) / 3 = 30
        assertEquals(0.0, out.get(1, 1, 0), 0.0);
        assertEquals(30.0, out.get(1, 1, 1), 1E-12);
        assertEquals(30.0, out.get(1, 1, 2), 1E-12);
    }

    @Test
    public void testNothingIsClamped() {
        final RgbRaster in = MosaicFixtures.raster(2, 2, 1000.0, 10.0, 10.0);
        final RgbRaster out = new GrayWorldWhiteBalancer().whiteBalance(in);
        assertEquals(340.0, out.get(0, 0, 1), 1E-9);
        assertEquals(340.0, out.get(0, 0, 0), 1E-9);
    }

    @Test
    public void testInputIsUntouched() {
        final RgbRaster in = tinted();
        final double v = in.get(3, 4, 2);
        new GrayWorldWhiteBalancer().whiteBalance(in);
        assertEquals(v, in.get(3, 4, 2), 0.0);
    }
}
