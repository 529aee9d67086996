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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import java.util.function.IntBinaryOperator;
import java.util.stream.Collectors;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import ai.kognition.mastcam4j.image.InvalidDimensionsException;
import ai.kognition.mastcam4j.image.MosaicFixtures;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;
import ai.kognition.mastcam4j.image.bayer.PatternNormalizer;

@RunWith(Parameterized.class)
public class TestVngDemosaicer {
    private static final double EPSILON = 1E-9;
    private static final int EDGE_SIZE = 12;

    private final CanonicalCfa cfa;
    private final VngDemosaicer underTest = new VngDemosaicer();

    public TestVngDemosaicer(final BayerPattern pattern) {
        this.cfa = PatternNormalizer.normalize(pattern);
    }

    @Parameterized.Parameters(name = "{0}")
    public static Collection<Object[]> parameters() {
        return Arrays.stream(BayerPattern.values()).map(p -> new Object[] {p}).collect(Collectors.toList());
    }

    @Test
    public void testFlatColorIsReproducedEverywhere() {
        final MosaicFrame frame = MosaicFixtures.flatColor(8, 10, cfa, 200, 100, 50);
        final RgbRaster rgb = underTest.demosaic(frame, cfa);

        assertEquals(8, rgb.rows);
        assertEquals(10, rgb.cols);
        for(int r = 0; r < rgb.rows; r++) {
            for(int c = 0; c < rgb.cols; c++) {
                assertEquals("red at " + r + "," + c, 200.0, rgb.get(r, c, 0), EPSILON);
                assertEquals("green at " + r + "," + c, 100.0, rgb.get(r, c, 1), EPSILON);
                assertEquals("blue at " + r + "," + c, 50.0, rgb.get(r, c, 2), EPSILON);
            }
        }
    }

    @Test
    public void testSampledChannelIsPreserved() {
        final MosaicFrame frame = MosaicFixtures.random(9, 11, 12, 4242L);
        final RgbRaster rgb = underTest.demosaic(frame, cfa);
        for(int r = 0; r < frame.rows; r++)
            for(int c = 0; c < frame.cols; c++)
                assertEquals(frame.get(r, c), rgb.get(r, c, cfa.channelIndexAt(r, c)), 0.0);
    }

    @Test
    public void testEveryOutputIsFinite() {
        final MosaicFrame frame = MosaicFixtures.random(5, 7, 8, 17L);
        final RgbRaster rgb = underTest.demosaic(frame, cfa);
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
            for(final double v: rgb.copyPlane(ch))
                assertFalse(Double.isNaN(v) || Double.isInfinite(v));
    }

    @Test
    public void testGrayRampIsGrayInTheInterior() {
        // every colour of the scene is 20 * row + 5 so the interior should come out gray
        final MosaicFrame rows = MosaicFixtures.mosaic(10, 10, 8, (r, c) -> (20 * r) + 5);
        final RgbRaster rgb = underTest.demosaic(rows, cfa);
        for(int r = 2; r < 8; r++) {
            for(int c = 2; c < 8; c++) {
                for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                    assertEquals((20 * r) + 5, rgb.get(r, c, ch), EPSILON);
            }
        }

        final MosaicFrame cols = MosaicFixtures.mosaic(10, 10, 8, (r, c) -> (20 * c) + 5);
        final RgbRaster rgb2 = underTest.demosaic(cols, cfa);
        for(int r = 2; r < 8; r++) {
            for(int c = 2; c < 8; c++) {
                for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                    assertEquals((20 * c) + 5, rgb2.get(r, c, ch), EPSILON);
            }
        }
    }

    @Test
    public void testInputIsNotModified() {
        final MosaicFrame frame = MosaicFixtures.random(6, 6, 8, 99L);
        final int[] before = frame.copySamples();
        underTest.demosaic(frame, cfa);
        assertEquals(Arrays.toString(before), Arrays.toString(frame.copySamples()));
    }

    @Test
    public void testTooSmallIsRejected() {
        assertThrows(InvalidDimensionsException.class, () -> underTest.demosaic(MosaicFixtures.flatColor(3, 3, cfa, 1, 2, 3), cfa));
        assertThrows(InvalidDimensionsException.class, () -> underTest.demosaic(MosaicFixtures.flatColor(4, 10, cfa, 1, 2, 3), cfa));
        assertThrows(InvalidDimensionsException.class, () -> underTest.demosaic(MosaicFixtures.flatColor(10, 4, cfa, 1, 2, 3), cfa));
    }

    @Test
    public void testStepEdgeStaysSharp() {
        // gray scenes that step at the middle. Only the two lines touching the step may blend.
        final int half = EDGE_SIZE / 2;
        for(final int bright: new int[] {60,220,255}) {
            final IntBinaryOperator vertical = (r, c) -> c < half ? 20 : bright;
            final IntBinaryOperator horizontal = (r, c) -> r < half ? 20 : bright;

            final RgbRaster v = underTest.demosaic(MosaicFixtures.mosaic(EDGE_SIZE, EDGE_SIZE, 8, vertical), cfa);
            final RgbRaster h = underTest.demosaic(MosaicFixtures.mosaic(EDGE_SIZE, EDGE_SIZE, 8, horizontal), cfa);
            for(int r = 2; r < EDGE_SIZE - 2; r++) {
                for(int c = 2; c < EDGE_SIZE - 2; c++) {
                    for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
                        if(c != half - 1 && c != half)
                            assertEquals("vertical step to " + bright + " at " + r + "," + c, vertical.applyAsInt(r, c), v.get(r, c, ch), EPSILON);
                        if(r != half - 1 && r != half)
                            assertEquals("horizontal step to " + bright + " at " + r + "," + c, horizontal.applyAsInt(r, c), h.get(r, c, ch), EPSILON);
                    }
                }
            }
        }
    }

    @Test
    public void testEdgesAreCloserThanBilinear() {
        final int last = EDGE_SIZE - 1;
        final IntBinaryOperator[] scenes = {
            (r, c) -> c < EDGE_SIZE / 2 ? 20 : 220,
            (r, c) -> r + c < last ? 20 : 220,
            (r, c) -> c < r ? 20 : 220
        };
        final BilinearDemosaicer bilinear = new BilinearDemosaicer();
        for(int i = 0; i < scenes.length; i++) {
            final MosaicFrame frame = MosaicFixtures.mosaic(EDGE_SIZE, EDGE_SIZE, 8, scenes[i]);
            final double vngError = meanInteriorError(underTest.demosaic(frame, cfa), scenes[i]);
            final double bilinearError = meanInteriorError(bilinear.demosaic(frame, cfa), scenes[i]);
            assertTrue("scene " + i + ": VNG error " + vngError + " vs bilinear " + bilinearError, vngError < 0.9 * bilinearError);
        }
    }

    @Test
    public void testDirectionAboveThresholdIsIgnored() {
        // a single bright sample two to the east only shows up in the east gradient. That
        // direction is over the threshold so the pixel must come out as the flat field.
        final MosaicFrame frame = MosaicFixtures.mosaic(EDGE_SIZE, EDGE_SIZE, 8, (r, c) -> (r == 6 && c == 7) ? 255 : 100);
        final RgbRaster rgb = underTest.demosaic(frame, cfa);
        for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
            assertEquals(100.0, rgb.get(6, 5, ch), EPSILON);
    }

    private static double meanInteriorError(final RgbRaster rgb, final IntBinaryOperator scene) {
        double sum = 0.0;
        int count = 0;
        for(int r = 2; r < rgb.rows - 2; r++) {
            for(int c = 2; c < rgb.cols - 2; c++) {
                for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
                    sum += Math.abs(rgb.get(r, c, ch) - scene.applyAsInt(r, c));
                    count++;
                }
            }
        }
        return sum / count;
    }
}
