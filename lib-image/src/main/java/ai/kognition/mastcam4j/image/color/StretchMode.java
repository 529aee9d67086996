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

import org.apache.commons.lang3.EnumUtils;

/**
 * How the contrast stretch measures its percentiles.
 */
public enum StretchMode {
    /**
     * Each channel is stretched by its own percentiles.
     */
    PER_CHANNEL,
    /**
     * One pair of percentiles is taken over all channels together and applied to each.
     * This keeps the balance between channels.
     */
    GLOBAL;

    /**
     * Parse {@code per-channel} or {@code global}. Case is ignored and dashes and
     * underscores are interchangeable.
     */
    public static StretchMode fromName(final String name) {
        final StretchMode ret = name == null ? null : EnumUtils.getEnumIgnoreCase(StretchMode.class, name.trim().replace('-', '_'));
        if(ret == null)
            throw new IllegalArgumentException("\"" + name + "\" isn't a stretch mode. It must be per-channel or global.");
        return ret;
    }
}
