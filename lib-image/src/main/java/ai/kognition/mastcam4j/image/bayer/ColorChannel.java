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
 * The three colour channels of a Bayer sensor. The {@code index} is the channel's
 * plane in an {@code RgbRaster}.
 */
public enum ColorChannel {
    RED(0, 'R'), GREEN(1, 'G'), BLUE(2, 'B');

    public final int index;
    public final char letter;

    private ColorChannel(final int index, final char letter) {
        this.index = index;
        this.letter = letter;
    }

    private static final ColorChannel[] byIndex = {RED,GREEN,BLUE};

    public static ColorChannel fromIndex(final int index) {
        if(index < 0 || index >= byIndex.length)
            throw new IllegalArgumentException("There's no colour channel with the index " + index);
        return byIndex[index];
    }

    public static ColorChannel fromLetter(final char letter) {
        switch(Character.toUpperCase(letter)) {
            case 'R':
                return RED;
            case 'G':
                return GREEN;
            case 'B':
                return BLUE;
            default:
                throw new IllegalArgumentException("There's no colour channel for the letter '" + letter + "'");
        }
    }
}
