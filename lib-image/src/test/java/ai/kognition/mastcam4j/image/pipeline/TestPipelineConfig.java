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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

import ai.kognition.mastcam4j.image.InvalidPatternException;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.color.ChannelGains;
import ai.kognition.mastcam4j.image.color.StretchMode;
import ai.kognition.mastcam4j.image.color.WhiteBalanceTarget;
import ai.kognition.mastcam4j.image.demosaic.DemosaicMethod;

public class TestPipelineConfig {

    private static Properties props(final String... kvs) {
        final Properties ret = new Properties();
        for(int i = 0; i < kvs.length; i += 2)
            ret.setProperty(kvs[i], kvs[i + 1]);
        return ret;
    }

    private static void assertMastcamSettings(final PipelineConfig config) {
        assertSame(BayerPattern.GRBG, config.pattern);
        assertSame(DemosaicMethod.VNG, config.demosaicMethod);
        assertSame(WhiteBalanceTarget.AVERAGE, config.whiteBalanceTarget);
        assertEquals(ChannelGains.MASTCAM_DEFAULT, config.gains);
        assertEquals(0.5, config.lowPercentile, 0.0);
        assertEquals(99.5, config.highPercentile, 0.0);
        assertSame(StretchMode.PER_CHANNEL, config.stretchMode);
    }

    @Test
    public void testClasspathDefaults() {
        assertMastcamSettings(PipelineConfig.defaults());
        assertEquals("output_png", PipelineConfig.loadDefaultProperties().getProperty("batch.outputDirName"));
    }

    @Test
    public void testUnsetKeysTakeTheBuiltInValues() {
        assertMastcamSettings(PipelineConfig.fromProperties(new Properties()));
    }

    @Test
    public void testOverrides() {
        final PipelineConfig config = PipelineConfig.fromProperties(props(
            "pipeline.bayer", "RGGB",
            "pipeline.demosaic", "bilinear",
            "pipeline.whiteBalance.target", "green",
            "pipeline.gains", "1, 1, 1",
            "pipeline.stretch.low", "2",
            "pipeline.stretch.high", "98",
            "pipeline.stretch.mode", "global",
            "batch.threads", "4"));

        assertSame(BayerPattern.RGGB, config.pattern);
        assertSame(DemosaicMethod.BILINEAR, config.demosaicMethod);
        assertSame(WhiteBalanceTarget.GREEN, config.whiteBalanceTarget);
        assertEquals(ChannelGains.IDENTITY, config.gains);
        assertEquals(2.0, config.lowPercentile, 0.0);
        assertEquals(98.0, config.highPercentile, 0.0);
        assertSame(StretchMode.GLOBAL, config.stretchMode);
    }

    @Test
    public void testErrorsNameTheKey() {
        final InvalidPatternException ipe = assertThrows(InvalidPatternException.class,
            () -> PipelineConfig.fromProperties(props("pipeline.bayer", "rgbg")));
        assertTrue(ipe.getMessage().contains("pipeline.bayer"));

        IllegalArgumentException iae = assertThrows(IllegalArgumentException.class,
            () -> PipelineConfig.fromProperties(props("pipeline.stretch.low", "abc")));
        assertTrue(iae.getMessage().contains("pipeline.stretch.low"));

        iae = assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(props("pipeline.gains", "1,2")));
        assertTrue(iae.getMessage().contains("pipeline.gains"));

        iae = assertThrows(IllegalArgumentException.class, () -> PipelineConfig.fromProperties(props("pipeline.demosaic", "ahd")));
        assertTrue(iae.getMessage().contains("pipeline.demosaic"));

        iae = assertThrows(IllegalArgumentException.class,
            () -> PipelineConfig.fromProperties(props("pipeline.stretch.low", "60", "pipeline.stretch.high", "40")));
        assertTrue(iae.getMessage().contains("pipeline.stretch.low"));
    }

    @Test
    public void testWithers() {
        final PipelineConfig base = PipelineConfig.defaults();
        final PipelineConfig changed = base.withPattern(BayerPattern.BGGR).withStretchMode(StretchMode.GLOBAL).withPercentiles(1.0, 99.0)
            .withGains(ChannelGains.IDENTITY).withDemosaicMethod(DemosaicMethod.BILINEAR).withWhiteBalanceTarget(WhiteBalanceTarget.GREEN);

        assertMastcamSettings(base);
        assertSame(BayerPattern.BGGR, changed.pattern);
        assertSame(StretchMode.GLOBAL, changed.stretchMode);
        assertEquals(1.0, changed.lowPercentile, 0.0);
        assertSame(DemosaicMethod.BILINEAR, changed.demosaicMethod);
        assertThrows(IllegalArgumentException.class, () -> base.withPercentiles(50.0, 10.0));
    }
}
