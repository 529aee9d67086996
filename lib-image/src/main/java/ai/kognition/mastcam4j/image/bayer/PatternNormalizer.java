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

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a {@link BayerPattern} to its {@link CanonicalCfa}. The tables are immutable so
 * one instance per pattern is built up front and shared.
 */
public final class PatternNormalizer {
    private static final Map<BayerPattern, CanonicalCfa> cfas = new EnumMap<>(BayerPattern.class);

    static {
        for(final BayerPattern p: BayerPattern.values())
            cfas.put(p, new CanonicalCfa(p));
    }

    private PatternNormalizer() {}

    public static CanonicalCfa normalize(final BayerPattern pattern) {
        if(pattern == null)
            throw new NullPointerException("Cannot normalize a null Bayer pattern");
        return cfas.get(pattern);
    }
}
