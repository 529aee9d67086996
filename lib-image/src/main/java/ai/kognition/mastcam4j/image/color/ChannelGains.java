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

import ai.kognition.mastcam4j.image.RgbRaster;

/**
 * Immutable per-channel multipliers applied by the {@link ColorCastCorrector}.
 */
public final class ChannelGains {
    /**
     * Warms the Mastcam's blue cast: red up ten percent, blue down fifteen.
     */
    public static final ChannelGains MASTCAM_DEFAULT = new ChannelGains(1.10, 1.00, 0.85);

    public static final ChannelGains IDENTITY = new ChannelGains(1.0, 1.0, 1.0);

    public final double red;
    public final double green;
    public final double blue;

    public ChannelGains(final double red, final double green, final double blue) {
        check("red", red);
        check("green", green);
        check("blue", blue);
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    /**
     * @param rgb exactly three gains, red first.
     */
    public static ChannelGains of(final double[] rgb) {
        if(rgb == null || rgb.length != RgbRaster.CHANNELS)
            throw new IllegalArgumentException("Exactly three channel gains (red, green, blue) are required");
        return new ChannelGains(rgb[0], rgb[1], rgb[2]);
    }

    public double get(final int channel) {
        switch(channel) {
            case 0:
                return red;
            case 1:
                return green;
            case 2:
                return blue;
            default:
                throw new IndexOutOfBoundsException("There's no channel " + channel);
        }
    }

    private static void check(final String name, final double gain) {
        if(!Double.isFinite(gain) || gain < 0.0)
            throw new IllegalArgumentException("The " + name + " gain must be a finite, non-negative number but was " + gain);
    }

    @Override
    public boolean equals(final Object o) {
        if(this == o)
            return true;
        if(!(o instanceof ChannelGains))
            return false;
        final ChannelGains other = (ChannelGains)o;
        return Double.compare(red, other.red) == 0 && Double.compare(green, other.green) == 0 && Double.compare(blue, other.blue) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(red);
        result = 31 * result + Double.hashCode(green);
        return 31 * result + Double.hashCode(blue);
    }

    @Override
    public String toString() {
        return "ChannelGains [red=" + red + ", green=" + green + ", blue=" + blue + "]";
    }
}
