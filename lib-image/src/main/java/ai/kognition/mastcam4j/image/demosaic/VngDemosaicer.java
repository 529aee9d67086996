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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.InvalidDimensionsException;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;

/**
 * <p>
 * Variable Number of Gradients demosaicing (after Chang, Cheung and Pang, 1999).
 * </p>
 *
 * <p>
 * For every pixel a gradient is measured in each of eight directions over a 5x5 window.
 * Each gradient sums the absolute differences of same-colour sample pairs that lie along
 * the direction. The directions whose gradient is no more than
 * {@code 1.5 * min + 0.5 * (max - min)} take part in the interpolation; the others are
 * assumed to cross an edge. Each participating direction supplies an estimate of every
 * colour (the mean of that colour's nearest samples in the direction) and is weighted by
 * {@code 1 / (gradient + 1)}. A missing colour {@code c} at a pixel sampled in colour
 * {@code o} is then
 * </p>
 *
 * <pre>
 *   P + sum(w * (estimate[c] - estimate[o])) / sum(w)
 * </pre>
 *
 * <p>
 * which keeps the sampled value {@code P} untouched. Near the edges of the frame only the
 * terms and samples that are inside the frame are used and a direction that can't estimate
 * every colour is dropped. Gradients are normalized by the weight of the terms actually
 * used so directions with fewer terms remain comparable.
 * </p>
 *
 * <p>
 * No clamping is done. The output is in the frame's sample units.
 * </p>
 */
public class VngDemosaicer implements Demosaicer {
    private static final Logger LOGGER = LoggerFactory.getLogger(VngDemosaicer.class);

    public static final int WINDOW = 5;

    static final double THRESHOLD_MIN_FACTOR = 1.5;
    static final double THRESHOLD_RANGE_FACTOR = 0.5;
    static final double GRADIENT_EPSILON = 1.0;

    private static final Direction[] DIRECTIONS = {
        new Direction("N", -1, 0),
        new Direction("NE", -1, 1),
        new Direction("E", 0, 1),
        new Direction("SE", 1, 1),
        new Direction("S", 1, 0),
        new Direction("SW", 1, -1),
        new Direction("W", 0, -1),
        new Direction("NW", -1, -1)
    };

    @Override
    public RgbRaster demosaic(final MosaicFrame frame, final CanonicalCfa cfa) {
        if(frame.rows < WINDOW || frame.cols < WINDOW)
            throw new InvalidDimensionsException(
                "VNG demosaicing needs at least a " + WINDOW + "x" + WINDOW + " frame but was given " + frame.rows + "x" + frame.cols);

        final RgbRaster ret = new RgbRaster(frame.rows, frame.cols);
        final PixelInterpolator interp = new PixelInterpolator(frame, cfa);
        final double[] pixel = new double[RgbRaster.CHANNELS];

        for(int r = 0; r < frame.rows; r++) {
            for(int c = 0; c < frame.cols; c++) {
                interp.interpolate(r, c, pixel);
                ret.set(r, c, pixel[0], pixel[1], pixel[2]);
            }
        }

        if(LOGGER.isDebugEnabled())
            LOGGER.debug("VNG demosaiced {} using {}. {} pixels fell back to the neighbourhood mean.", frame, cfa, interp.fallbacks);
        return ret;
    }

    /**
     * A pair of same-colour samples whose absolute difference contributes to a gradient.
     */
    private static class Term {
        final int dy1, dx1, dy2, dx2;
        final double weight;

        Term(final int[] a, final int[] b, final double weight) {
            this.dy1 = a[0];
            this.dx1 = a[1];
            this.dy2 = b[0];
            this.dx2 = b[1];
            this.weight = weight;
        }
    }

    private static class Direction {
        final String name;
        final int[] d;
        final int[] twoD;

        // gradient terms when the centre is sampled as green, and when it's red or blue
        final Term[] greenCentreTerms;
        final Term[] otherCentreTerms;

        // where a colour other than the centre's is estimated from, nearest first
        final int[][][] tiers;

        Direction(final String name, final int dy, final int dx) {
            this.name = name;
            this.d = off(dy, dx);
            this.twoD = off(2 * dy, 2 * dx);
            final int[] minusD = off(-dy, -dx);
            final int[] zero = off(0, 0);

            if(dy == 0 || dx == 0) {
                final int[] q = off(dx, dy);
                final int[] minusQ = off(-dx, -dy);
                final Term[] terms = {
                    new Term(minusD, d, 1.0),
                    new Term(zero, twoD, 1.0),
                    new Term(add(q, minusD), add(q, d), 0.5),
                    new Term(add(minusQ, minusD), add(minusQ, d), 0.5),
                    new Term(q, add(q, twoD), 0.5),
                    new Term(minusQ, add(minusQ, twoD), 0.5)
                };
                greenCentreTerms = terms;
                otherCentreTerms = terms;
                tiers = new int[][][] {
                    {d},
                    {add(d, q),add(d, minusQ)},
                    {q,minusQ,add(twoD, q),add(twoD, minusQ)}
                };
            } else {
                final int[] a1 = off(dy, 0);
                final int[] a2 = off(0, dx);
                // a1 and a2 are green around a red or blue centre, so the single diagonal
                // steps through them compare greens. Around a green centre they aren't,
                // so the pair two steps apart is used instead.
                otherCentreTerms = new Term[] {
                    new Term(minusD, d, 1.0),
                    new Term(zero, twoD, 1.0),
                    new Term(add(a1, d), a1, 0.5),
                    new Term(a1, add(a1, minusD), 0.5),
                    new Term(add(a2, d), a2, 0.5),
                    new Term(a2, add(a2, minusD), 0.5)
                };
                greenCentreTerms = new Term[] {
                    new Term(minusD, d, 1.0),
                    new Term(zero, twoD, 1.0),
                    new Term(add(a1, d), add(a1, minusD), 1.0),
                    new Term(add(a2, d), add(a2, minusD), 1.0)
                };
                tiers = new int[][][] {
                    {d},
                    {a1,a2,add(a1, d),add(a2, d)}
                };
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static int[] off(final int dy, final int dx) {
        return new int[] {dy,dx};
    }

    private static int[] add(final int[] a, final int[] b) {
        return new int[] {a[0] + b[0],a[1] + b[1]};
    }

    /**
     * Per-frame working state. Not thread safe; one is created per demosaic call.
     */
    private static class PixelInterpolator {
        final MosaicFrame frame;
        final CanonicalCfa cfa;
        final int rows;
        final int cols;

        final double[] gradients = new double[DIRECTIONS.length];
        final boolean[] usable = new boolean[DIRECTIONS.length];
        final double[][] estimates = new double[DIRECTIONS.length][RgbRaster.CHANNELS];
        final double[] diff = new double[RgbRaster.CHANNELS];

        long fallbacks = 0;

        PixelInterpolator(final MosaicFrame frame, final CanonicalCfa cfa) {
            this.frame = frame;
            this.cfa = cfa;
            this.rows = frame.rows;
            this.cols = frame.cols;
        }

        boolean inside(final int r, final int c) {
            return r >= 0 && r < rows && c >= 0 && c < cols;
        }

        void interpolate(final int r, final int c, final double[] out) {
            final int own = cfa.channelIndexAt(r, c);
            final double p = frame.get(r, c);
            final boolean greenCentre = cfa.isGreen(r, c);

            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            int numUsable = 0;
            for(int i = 0; i < DIRECTIONS.length; i++) {
                final Direction dir = DIRECTIONS[i];
                final double g = gradient(r, c, greenCentre ? dir.greenCentreTerms : dir.otherCentreTerms);
                usable[i] = !Double.isNaN(g) && estimate(r, c, own, dir, estimates[i]);
                if(usable[i]) {
                    gradients[i] = g;
                    numUsable++;
                    if(g < min)
                        min = g;
                    if(g > max)
                        max = g;
                }
            }

            if(numUsable == 0) {
                fallback(r, c, own, p, out);
                return;
            }

            final double threshold = (THRESHOLD_MIN_FACTOR * min) + (THRESHOLD_RANGE_FACTOR * (max - min));

            double sumW = 0.0;
            diff[0] = diff[1] = diff[2] = 0.0;
            for(int i = 0; i < DIRECTIONS.length; i++) {
                if(!usable[i] || gradients[i] > threshold)
                    continue;
                final double w = 1.0 / (gradients[i] + GRADIENT_EPSILON);
                sumW += w;
                final double[] est = estimates[i];
                for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                    diff[ch] += w * (est[ch] - est[own]);
            }

            for(int ch = 0; ch < RgbRaster.CHANNELS; ch++)
                out[ch] = (ch == own) ? p : p + (diff[ch] / sumW);
        }

        /**
         * Weighted mean absolute difference over the terms that fit in the frame, or NaN
         * if none of them do.
         */
        double gradient(final int r, final int c, final Term[] terms) {
            double sum = 0.0;
            double weight = 0.0;
            for(final Term t: terms) {
                final int r1 = r + t.dy1, c1 = c + t.dx1, r2 = r + t.dy2, c2 = c + t.dx2;
                if(!inside(r1, c1) || !inside(r2, c2))
                    continue;
                sum += t.weight * Math.abs(frame.get(r1, c1) - frame.get(r2, c2));
                weight += t.weight;
            }
            return weight == 0.0 ? Double.NaN : sum / weight;
        }

        /**
         * Fill in the per-colour estimate for the direction. Returns false if some colour
         * has no sample in the direction's neighbourhood.
         */
        boolean estimate(final int r, final int c, final int own, final Direction dir, final double[] est) {
            double ownSum = frame.get(r, c);
            int ownCount = 1;
            if(inside(r + dir.twoD[0], c + dir.twoD[1])) {
                ownSum += frame.get(r + dir.twoD[0], c + dir.twoD[1]);
                ownCount++;
            }
            est[own] = ownSum / ownCount;

            for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
                if(ch == own)
                    continue;
                boolean found = false;
                for(final int[][] tier: dir.tiers) {
                    double sum = 0.0;
                    int count = 0;
                    for(final int[] o: tier) {
                        final int rr = r + o[0], cc = c + o[1];
                        if(inside(rr, cc) && cfa.channelIndexAt(rr, cc) == ch) {
                            sum += frame.get(rr, cc);
                            count++;
                        }
                    }
                    if(count > 0) {
                        est[ch] = sum / count;
                        found = true;
                        break;
                    }
                }
                if(!found)
                    return false;
            }
            return true;
        }

        void fallback(final int r, final int c, final int own, final double p, final double[] out) {
            fallbacks++;
            for(int ch = 0; ch < RgbRaster.CHANNELS; ch++) {
                if(ch == own) {
                    out[ch] = p;
                    continue;
                }
                out[ch] = p;
                for(int radius = 1; radius <= WINDOW / 2; radius++) {
                    final double mean = BilinearDemosaicer.neighbourhoodMean(frame, cfa, r, c, ch, radius);
                    if(!Double.isNaN(mean)) {
                        out[ch] = mean;
                        break;
                    }
                }
            }
        }
    }
}
