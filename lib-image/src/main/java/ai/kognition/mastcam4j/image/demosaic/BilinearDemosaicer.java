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

import ai.kognition.mastcam4j.image.InvalidDimensionsException;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;

/**
 * Each missing colour is the mean of that colour's samples in the surrounding 3x3
 * neighbourhood (clipped at the frame edges). The sampled colour is kept as is. Fast but
 * leaves zipper artifacts along edges.
 */
public class BilinearDemosaicer implements Demosaicer {

    @Override
    public RgbRaster demosaic(final MosaicFrame frame, final CanonicalCfa cfa) {
        if(frame.rows < 2 || frame.cols < 2)
            throw new InvalidDimensionsException("Bilinear demosaicing needs at least a 2x2 frame but was given " + frame.rows + "x" + frame.cols);

        final RgbRaster ret = new RgbRaster(frame.rows, frame.cols);
        for(int r = 0; r < frame.rows; r++) {
            for(int c = 0; c < frame.cols; c++) {
                final int own = cfa.channelIndexAt(r, c);
                for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                    ret.set(r, c, ch, ch == own ? frame.get(r, c) : neighbourhoodMean(frame, cfa, r, c, ch, 1));
            }
        }
        return ret;
    }

    /**
     * Mean of the samples of colour {@code channel} within {@code radius} of (row, col),
     * or NaN if there are none.
     */
    static double neighbourhoodMean(final MosaicFrame frame, final CanonicalCfa cfa, final int row, final int col, final int channel,
        final int radius) {
        double sum = 0.0;
        int count = 0;
        for(int r = Math.max(0, row - radius); r <= Math.min(frame.rows - 1, row + radius); r++) {
            for(int c = Math.max(0, col - radius); c <= Math.min(frame.cols - 1, col + radius); c++) {
                if(cfa.channelIndexAt(r, c) == channel) {
                    sum += frame.get(r, c);
                    count++;
                }
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }
}
