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

package ai.kognition.mastcam4j.image.bayer;

import org.apache.commons.lang3.EnumUtils;

import ai.kognition.mastcam4j.image.InvalidPatternException;

/**
 * <p>
 * The four possible layouts of a Bayer 2x2 unit cell. The name reads the filter colours
 * left to right, top to bottom, starting with the top-left sample of the frame. So
 * {@link #GRBG} (the Mastcam KAI-2020 layout) means:
 * </p>
 *
 * <pre>
 *   row 0:  G R G R ...
 *   row 1:  B G B G ...
 * </pre>
 *
 * <p>
 * Tools that name patterns from the second row and column (OpenCV for example) must be
 * translated before they get here. See {@link OpenCvBayerCodes}.
 * </p>
 */
public enum BayerPattern {
    RGGB, GBRG, GRBG, BGGR;

    /**
     * The colour at {@code (row & 1, col & 1)} of the unit cell.
     */
    public ColorChannel channelAt(final int cellRow, final int cellCol) {
        return ColorChannel.fromLetter(name().charAt((cellRow * 2) + cellCol));
    }

    /**
     * Parse a pattern name, ignoring case and surrounding white space.
     *
     * @throws InvalidPatternException if the name isn't one of the four layouts.
     */
    public static BayerPattern fromName(final String name) {
        final BayerPattern ret = name == null ? null : EnumUtils.getEnumIgnoreCase(BayerPattern.class, name.trim());
        if(ret == null)
            throw new InvalidPatternException("\"" + name + "\" isn't a Bayer pattern. It must be one of rggb, gbrg, grbg or bggr.");
        return ret;
    }
}
