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

import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;

/**
 * Reconstructs a full colour raster from a Bayer mosaic. Implementations are stateless
 * and may be shared between threads. The frame is never modified.
 */
@FunctionalInterface
public interface Demosaicer {

    /**
     * @return a new raster with the same dimensions as the frame, in the frame's sample units.
     * @throws ai.kognition.mastcam4j.image.InvalidDimensionsException if the frame is too small
     *     for the implementation's neighbourhood.
     */
    public RgbRaster demosaic(MosaicFrame frame, CanonicalCfa cfa);
}
