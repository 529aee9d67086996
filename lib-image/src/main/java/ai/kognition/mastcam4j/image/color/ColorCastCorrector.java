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
 * Removes a known, fixed colour cast by multiplying each channel by its gain.
 */
public class ColorCastCorrector {

    public RgbRaster correctCast(final RgbRaster raster, final ChannelGains gains) {
        if(gains == null)
            throw new NullPointerException("The channel gains cannot be null");
        if(ChannelGains.IDENTITY.equals(gains))
            return raster.copy();
        return raster.map((ch, v) -> v * gains.get(ch));
    }
}
