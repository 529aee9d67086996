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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;
import ai.kognition.mastcam4j.image.bayer.PatternNormalizer;
import ai.kognition.mastcam4j.image.color.ColorCastCorrector;
import ai.kognition.mastcam4j.image.color.GrayWorldWhiteBalancer;
import ai.kognition.mastcam4j.image.color.PercentileContrastStretcher;
import ai.kognition.mastcam4j.image.demosaic.Demosaicer;
import ai.kognition.mastcam4j.util.Timer;

/**
 * <p>
 * Turns a Bayer mosaic into a display ready colour raster:
 * </p>
 *
 * <ol>
 * <li>demosaic with the configured engine</li>
 * <li>gray-world white balance</li>
 * <li>fixed colour cast correction</li>
 * <li>percentile contrast stretch to [0, 255]</li>
 * </ol>
 *
 * <p>
 * A {@link ColorPipeline} holds no per-image state so a single instance can be shared by any
 * number of threads. Either the whole chain succeeds or the first failure is thrown.
 * </p>
 */
public class ColorPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(ColorPipeline.class);

    private final PipelineConfig config;
    private final CanonicalCfa cfa;
    private final Demosaicer demosaicer;
    private final GrayWorldWhiteBalancer whiteBalancer;
    private final ColorCastCorrector castCorrector = new ColorCastCorrector();
    private final PercentileContrastStretcher stretcher;

    public ColorPipeline(final PipelineConfig config) {
        this.config = config;
        this.cfa = PatternNormalizer.normalize(config.pattern);
        this.demosaicer = config.demosaicMethod.create();
        this.whiteBalancer = new GrayWorldWhiteBalancer(config.whiteBalanceTarget);
        this.stretcher = new PercentileContrastStretcher(config.stretchMode);
    }

    public RgbRaster process(final MosaicFrame frame) {
        final Timer timer = new Timer();

        timer.start();
        final RgbRaster demosaiced = demosaicer.demosaic(frame, cfa);
        LOGGER.debug("Demosaiced {} ({}, {}) in {} seconds", frame, config.demosaicMethod, cfa, timer.stop());

        timer.start();
        final RgbRaster balanced = whiteBalancer.whiteBalance(demosaiced);
        LOGGER.debug("White balanced to the {} mean in {} seconds", config.whiteBalanceTarget, timer.stop());

        timer.start();
        final RgbRaster corrected = castCorrector.correctCast(balanced, config.gains);
        LOGGER.debug("Applied {} in {} seconds", config.gains, timer.stop());

        timer.start();
        final RgbRaster stretched = stretcher.stretch(corrected, config.lowPercentile, config.highPercentile);
        LOGGER.debug("Stretched {} between the {} and {} percentiles in {} seconds", config.stretchMode, config.lowPercentile,
            config.highPercentile, timer.stop());

        return stretched;
    }

    public PipelineConfig config() {
        return config;
    }
}
