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

import java.io.IOException;
import java.util.Properties;

import ai.kognition.mastcam4j.image.ColorPipelineException;
import ai.kognition.mastcam4j.image.InvalidPatternException;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.color.ChannelGains;
import ai.kognition.mastcam4j.image.color.PercentileContrastStretcher;
import ai.kognition.mastcam4j.image.color.StretchMode;
import ai.kognition.mastcam4j.image.color.WhiteBalanceTarget;
import ai.kognition.mastcam4j.image.demosaic.DemosaicMethod;
import ai.kognition.mastcam4j.util.PropertiesUtils;

/**
 * <p>
 * Immutable settings for a {@link ColorPipeline}. The defaults come from the classpath
 * resource {@value #DEFAULTS_RESOURCE}. Settings are read from the {@code pipeline} section
 * of a {@link Properties}:
 * </p>
 *
 * <pre>
 * pipeline.bayer=grbg
 * pipeline.demosaic=vng
 * pipeline.whiteBalance.target=average
 * pipeline.gains=1.10,1.00,0.85
 * pipeline.stretch.low=0.5
 * pipeline.stretch.high=99.5
 * pipeline.stretch.mode=per-channel
 * </pre>
 *
 * <p>
 * Use the {@code with...} methods to derive a config with one setting changed.
 * </p>
 */
public final class PipelineConfig {
    public static final String DEFAULTS_RESOURCE = "mastcam4j-defaults.properties";

    public static final String SECTION = "pipeline";
    public static final String BAYER = "bayer";
    public static final String DEMOSAIC = "demosaic";
    public static final String WHITE_BALANCE_TARGET = "whiteBalance.target";
    public static final String GAINS = "gains";
    public static final String STRETCH_LOW = "stretch.low";
    public static final String STRETCH_HIGH = "stretch.high";
    public static final String STRETCH_MODE = "stretch.mode";

    public final BayerPattern pattern;
    public final DemosaicMethod demosaicMethod;
    public final WhiteBalanceTarget whiteBalanceTarget;
    public final ChannelGains gains;
    public final double lowPercentile;
    public final double highPercentile;
    public final StretchMode stretchMode;

    public PipelineConfig(final BayerPattern pattern, final DemosaicMethod demosaicMethod, final WhiteBalanceTarget whiteBalanceTarget,
        final ChannelGains gains, final double lowPercentile, final double highPercentile, final StretchMode stretchMode) {
        if(pattern == null || demosaicMethod == null || whiteBalanceTarget == null || gains == null || stretchMode == null)
            throw new NullPointerException("No pipeline setting can be null");
        PercentileContrastStretcher.validateBounds(lowPercentile, highPercentile);

        this.pattern = pattern;
        this.demosaicMethod = demosaicMethod;
        this.whiteBalanceTarget = whiteBalanceTarget;
        this.gains = gains;
        this.lowPercentile = lowPercentile;
        this.highPercentile = highPercentile;
        this.stretchMode = stretchMode;
    }

    /**
     * The settings in the classpath defaults.
     */
    public static PipelineConfig defaults() {
        return fromProperties(loadDefaultProperties());
    }

    public static Properties loadDefaultProperties() {
        try {
            return PropertiesUtils.loadFromClasspath(DEFAULTS_RESOURCE);
        } catch(final IOException e) {
            throw new ColorPipelineException("Couldn't load the default pipeline settings from " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Read the {@code pipeline} section of the properties. Keys that aren't set take the
     * built in values (the Mastcam settings).
     *
     * @throws IllegalArgumentException naming the key of any value that can't be parsed.
     * @throws InvalidPatternException if the Bayer pattern isn't one of the four layouts.
     */
    public static PipelineConfig fromProperties(final Properties props) {
        final Properties p = PropertiesUtils.getSection(props, SECTION, true);

        final BayerPattern pattern;
        try {
            pattern = BayerPattern.fromName(PropertiesUtils.getString(p, BAYER, BayerPattern.GRBG.name()));
        } catch(final InvalidPatternException ipe) {
            throw new InvalidPatternException("The property \"" + key(BAYER) + "\" is invalid. " + ipe.getMessage());
        }

        final DemosaicMethod demosaic = parse(DEMOSAIC, () -> DemosaicMethod.fromName(PropertiesUtils.getString(p, DEMOSAIC, DemosaicMethod.VNG.configName)));
        final WhiteBalanceTarget target = parse(WHITE_BALANCE_TARGET,
            () -> WhiteBalanceTarget.fromName(PropertiesUtils.getString(p, WHITE_BALANCE_TARGET, WhiteBalanceTarget.AVERAGE.name())));
        final StretchMode mode = parse(STRETCH_MODE, () -> StretchMode.fromName(PropertiesUtils.getString(p, STRETCH_MODE, StretchMode.PER_CHANNEL.name())));
        final ChannelGains gains = parse(GAINS, () -> {
            final double[] vals = PropertiesUtils.getDoubles(p, GAINS);
            return vals == null ? ChannelGains.MASTCAM_DEFAULT : ChannelGains.of(vals);
        });
        final double low = parse(STRETCH_LOW, () -> PropertiesUtils.getDouble(p, STRETCH_LOW, PercentileContrastStretcher.DEFAULT_LOW_PERCENTILE));
        final double high = parse(STRETCH_HIGH, () -> PropertiesUtils.getDouble(p, STRETCH_HIGH, PercentileContrastStretcher.DEFAULT_HIGH_PERCENTILE));

        try {
            return new PipelineConfig(pattern, demosaic, target, gains, low, high, mode);
        } catch(final IllegalArgumentException iae) {
            throw new IllegalArgumentException("The properties \"" + key(STRETCH_LOW) + "\" and \"" + key(STRETCH_HIGH) + "\" are invalid. "
                + iae.getMessage(), iae);
        }
    }

    public PipelineConfig withPattern(final BayerPattern newPattern) {
        return new PipelineConfig(newPattern, demosaicMethod, whiteBalanceTarget, gains, lowPercentile, highPercentile, stretchMode);
    }

    public PipelineConfig withDemosaicMethod(final DemosaicMethod newMethod) {
        return new PipelineConfig(pattern, newMethod, whiteBalanceTarget, gains, lowPercentile, highPercentile, stretchMode);
    }

    public PipelineConfig withWhiteBalanceTarget(final WhiteBalanceTarget newTarget) {
        return new PipelineConfig(pattern, demosaicMethod, newTarget, gains, lowPercentile, highPercentile, stretchMode);
    }

    public PipelineConfig withGains(final ChannelGains newGains) {
        return new PipelineConfig(pattern, demosaicMethod, whiteBalanceTarget, newGains, lowPercentile, highPercentile, stretchMode);
    }

    public PipelineConfig withPercentiles(final double low, final double high) {
        return new PipelineConfig(pattern, demosaicMethod, whiteBalanceTarget, gains, low, high, stretchMode);
    }

    public PipelineConfig withStretchMode(final StretchMode newMode) {
        return new PipelineConfig(pattern, demosaicMethod, whiteBalanceTarget, gains, lowPercentile, highPercentile, newMode);
    }

    private static String key(final String name) {
        return SECTION + PropertiesUtils.separator + name;
    }

    @FunctionalInterface
    private static interface Parser<T> {
        public T parse();
    }

    private static <T> T parse(final String name, final Parser<T> parser) {
        try {
            return parser.parse();
        } catch(final IllegalArgumentException iae) {
            throw new IllegalArgumentException("The property \"" + key(name) + "\" is invalid. " + iae.getMessage(), iae);
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig [pattern=" + pattern + ", demosaicMethod=" + demosaicMethod + ", whiteBalanceTarget=" + whiteBalanceTarget + ", gains="
            + gains + ", lowPercentile=" + lowPercentile + ", highPercentile=" + highPercentile + ", stretchMode=" + stretchMode + "]";
    }
}
