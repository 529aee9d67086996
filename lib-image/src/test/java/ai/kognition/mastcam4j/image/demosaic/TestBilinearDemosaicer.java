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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

import ai.kognition.mastcam4j.image.InvalidDimensionsException;
import ai.kognition.mastcam4j.image.MosaicFixtures;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;
import ai.kognition.mastcam4j.image.bayer.PatternNormalizer;

public class TestBilinearDemosaicer {
    private final BilinearDemosaicer underTest = new BilinearDemosaicer();

    @Test
    public void testFlatColor() {
        for(final BayerPattern p: BayerPattern.values()) {
            final CanonicalCfa cfa = PatternNormalizer.normalize(p);
            final RgbRaster rgb = underTest.demosaic(MosaicFixtures.flatColor(4, 5, cfa, 30, 60, 90), cfa);
            for(int r = 0; r < 4; r++) {
                for(int c = 0; c < 5; c++) {
                    assertEquals(30.0, rgb.get(r, c, 0), 1E-9);
                    assertEquals(60.0, rgb.get(r, c, 1), 1E-9);
                    assertEquals(90.0, rgb.get(r, c, 2), 1E-9);
                }
            }
        }
    }

    @Test
    public void testNeighbourAverage() {
        final CanonicalCfa cfa = PatternNormalizer.normalize(BayerPattern.RGGB);
        final MosaicFrame frame = MosaicFixtures.mosaic(3, 3, 8, (r, c) -> (r * 3) + c);
        final RgbRaster rgb = underTest.demosaic(frame, cfa);
        // centre is blue; the greens are 1, 3, 5 and 7 and the reds 0, 2, 6 and 8
        assertEquals(4.0, rgb.get(1, 1, 2), 0.0);
        assertEquals(4.0, rgb.get(1, 1, 1), 1E-9);
        assertEquals(4.0, rgb.get(1, 1, 0), 1E-9);
        // the corner is red; its only blue neighbour is the centre
        assertEquals(4.0, rgb.get(0, 0, 2), 1E-9);
        assertEquals(2.0, rgb.get(0, 0, 1), 1E-9);
    }

    @Test
    public void testTooSmall() {
        final CanonicalCfa cfa = PatternNormalizer.normalize(BayerPattern.GRBG);
        assertThrows(InvalidDimensionsException.class, () -> underTest.demosaic(MosaicFixtures.flatColor(1, 5, cfa, 1, 1, 1), cfa));
    }
}
