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

package ai.kognition.mastcam4j.image.pipeline;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import ai.kognition.mastcam4j.image.InvalidDimensionsException;
import ai.kognition.mastcam4j.image.MosaicFixtures;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.color.ChannelGains;

public class TestColorPipeline {

    @Test
    public void testUniformGrayStaysGray() {
        final PipelineConfig config = PipelineConfig.defaults().withPattern(BayerPattern.GRBG).withGains(ChannelGains.IDENTITY)
            .withPercentiles(0.0, 100.0);
        final MosaicFrame frame = MosaicFixtures.mosaic(6, 6, 8, (r, c) -> 128);

        final RgbRaster out = new ColorPipeline(config).process(frame);
        assertEquals(6, out.rows);
        assertEquals(6, out.cols);
        for(int r = 0; r < 6; r++)
            for(int c = 0; c < 6; c++)
                for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                    assertEquals(128.0, out.get(r, c, ch), 0.0);
    }

    @Test
    public void testDefaultsProduceDisplayValues() {
        final ColorPipeline pipeline = new ColorPipeline(PipelineConfig.defaults());
        final RgbRaster out = pipeline.process(MosaicFixtures.random(16, 20, 8, 7L));
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for(final double v: out.copyPlane(ch)) {
                assertEquals(Math.rint(v), v, 0.0);
                assertTrue(v >= 0.0 && v <= 255.0);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            assertEquals(0.0, min, 0.0);
            assertEquals(255.0, max, 0.0);
        }
    }

    @Test
    public void testSharedAcrossThreads() throws Exception {
        final ColorPipeline pipeline = new ColorPipeline(PipelineConfig.defaults());
        final MosaicFrame frame = MosaicFixtures.random(12, 12, 8, 3L);
        final RgbRaster expected = pipeline.process(frame);

        final RgbRaster[] results = new RgbRaster[4];
        final Thread[] threads = new Thread[results.length];
        for(int i = 0; i < threads.length; i++) {
            final int index = i;
            threads[i] = new Thread(() -> results[index] = pipeline.process(frame));
            threads[i].start();
        }
        for(final Thread t: threads)
            t.join();

        for(final RgbRaster r: results)
            for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                assertTrue(Arrays.equals(expected.copyPlane(ch), r.copyPlane(ch)));
    }

    @Test
    public void testFailuresPropagate() {
        final ColorPipeline pipeline = new ColorPipeline(PipelineConfig.defaults());
        assertThrows(InvalidDimensionsException.class, () -> pipeline.process(MosaicFixtures.random(3, 3, 8, 1L)));
    }
}
