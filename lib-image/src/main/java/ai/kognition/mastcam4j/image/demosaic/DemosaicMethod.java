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

package ai.kognition.mastcam4j.image.demosaic;

import java.util.function.Supplier;

/**
 * The demosaicing algorithms that can be selected by name from configuration or the
 * command line.
 */
public enum DemosaicMethod {
    VNG("vng", VngDemosaicer::new),
    BILINEAR("bilinear", BilinearDemosaicer::new),
    OPENCV_VNG("opencv-vng", () -> new OpenCvDemosaicer(OpenCvDemosaicer.Algorithm.VNG)),
    OPENCV_EA("opencv-ea", () -> new OpenCvDemosaicer(OpenCvDemosaicer.Algorithm.EDGE_AWARE)),
    OPENCV_BILINEAR("opencv-bilinear", () -> new OpenCvDemosaicer(OpenCvDemosaicer.Algorithm.BILINEAR));

    public final String configName;
    private final Supplier<Demosaicer> factory;

    private DemosaicMethod(final String configName, final Supplier<Demosaicer> factory) {
        this.configName = configName;
        this.factory = factory;
    }

    public Demosaicer create() {
        return factory.get();
    }

    /**
     * Parse a method from its configuration name ({@code vng}, {@code bilinear},
     * {@code opencv-vng}, {@code opencv-ea} or {@code opencv-bilinear}). Case is ignored and
     * underscores are accepted in place of dashes.
     */
    public static DemosaicMethod fromName(final String name) {
        if(name != null) {
            final String normalized = name.trim().toLowerCase().replace('_', '-');
            for(final DemosaicMethod m: values()) {
                if(m.configName.equals(normalized))
                    return m;
            }
        }
        throw new IllegalArgumentException("\"" + name + "\" isn't a demosaicing method. It must be one of vng, bilinear, opencv-vng, opencv-ea or opencv-bilinear.");
    }
}
