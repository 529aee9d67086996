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

/**
 * Immutable lookup from lattice parity {@code (row & 1, col & 1)} to the colour sampled
 * at that position. Obtain one from {@link PatternNormalizer#normalize(BayerPattern)}.
 */
public final class CanonicalCfa {
    private final BayerPattern pattern;
    private final ColorChannel[][] lookup = new ColorChannel[2][2];

    CanonicalCfa(final BayerPattern pattern) {
        this.pattern = pattern;
        for(int r = 0; r < 2; r++)
            for(int c = 0; c < 2; c++)
                lookup[r][c] = pattern.channelAt(r, c);

        // greens on one diagonal, red and blue on the other
        final boolean greensOnMain = lookup[0][0] == ColorChannel.GREEN && lookup[1][1] == ColorChannel.GREEN;
        final boolean greensOnAnti = lookup[0][1] == ColorChannel.GREEN && lookup[1][0] == ColorChannel.GREEN;
        final ColorChannel[] others = greensOnMain ? new ColorChannel[] {lookup[0][1],lookup[1][0]}
            : new ColorChannel[] {lookup[0][0],lookup[1][1]};
        if(greensOnMain == greensOnAnti || others[0] == others[1] || others[0] == ColorChannel.GREEN || others[1] == ColorChannel.GREEN)
            throw new IllegalStateException("The pattern " + pattern + " doesn't describe a Bayer unit cell");
    }

    public BayerPattern pattern() {
        return pattern;
    }

    /**
     * The colour sampled at the given frame position.
     */
    public ColorChannel channelAt(final int row, final int col) {
        return lookup[row & 1][col & 1];
    }

    public int channelIndexAt(final int row, final int col) {
        return lookup[row & 1][col & 1].index;
    }

    public boolean isGreen(final int row, final int col) {
        return lookup[row & 1][col & 1] == ColorChannel.GREEN;
    }

    @Override
    public String toString() {
        return "CanonicalCfa [" + lookup[0][0].letter + lookup[0][1].letter + "/" + lookup[1][0].letter + lookup[1][1].letter + "]";
    }
}
