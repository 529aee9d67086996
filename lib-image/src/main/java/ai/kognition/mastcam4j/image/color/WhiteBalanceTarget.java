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
 * What the gray-world balancer scales every channel mean to.
 */
public enum WhiteBalanceTarget {
    /**
     * The mean of the three channel means.
     */
    AVERAGE,
    /**
     * The green mean. Red and blue are scaled to it and green is left alone.
     */
    GREEN;

    public static WhiteBalanceTarget fromName(final String name) {
        final WhiteBalanceTarget ret = name == null ? null : EnumUtils.getEnumIgnoreCase(WhiteBalanceTarget.class, name.trim());
        if(ret == null)
            throw new IllegalArgumentException("\"" + name + "\" isn't a white balance target. It must be average or green.");
        return ret;
    }
}
