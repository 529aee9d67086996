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

import org.opencv.imgproc.Imgproc;

/**
 * <p>
 * OpenCV names its Bayer conversions from the second row and second column of the
 * colour filter array rather than from the top-left sample. Every layout is therefore
 * shifted one row and one column:
 * </p>
 *
 * <pre>
 *   top-left layout   OpenCV name
 *   RGGB              BayerBG
 *   GRBG              BayerGB
 *   GBRG              BayerGR
 *   BGGR              BayerRG
 * </pre>
 *
 * <p>
 * See https://github.com/opencv/opencv/issues/19629
 * </p>
 */
public final class OpenCvBayerCodes {

    private OpenCvBayerCodes() {}

    /**
     * The two letter name OpenCV uses for the given layout.
     */
    public static String openCvName(final BayerPattern pattern) {
        switch(pattern) {
            case RGGB:
                return "BG";
            case GRBG:
                return "GB";
            case GBRG:
                return "GR";
            case BGGR:
                return "RG";
            default:
                throw new IllegalArgumentException("Unhandled Bayer pattern " + pattern);
        }
    }

    /**
     * The {@code cvtColor} code for Variable Number of Gradients demosaicing to BGR.
     */
    public static int vngCode(final BayerPattern pattern) {
        switch(pattern) {
            case RGGB:
                return Imgproc.COLOR_BayerBG2BGR_VNG;
            case GRBG:
                return Imgproc.COLOR_BayerGB2BGR_VNG;
            case GBRG:
                return Imgproc.COLOR_BayerGR2BGR_VNG;
            case BGGR:
                return Imgproc.COLOR_BayerRG2BGR_VNG;
            default:
                throw new IllegalArgumentException("Unhandled Bayer pattern " + pattern);
        }
    }

    /**
     * The {@code cvtColor} code for edge-aware demosaicing to BGR.
     */
    public static int edgeAwareCode(final BayerPattern pattern) {
        switch(pattern) {
            case RGGB:
                return Imgproc.COLOR_BayerBG2BGR_EA;
            case GRBG:
                return Imgproc.COLOR_BayerGB2BGR_EA;
            case GBRG:
                return Imgproc.COLOR_BayerGR2BGR_EA;
            case BGGR:
                return Imgproc.COLOR_BayerRG2BGR_EA;
            default:
                throw new IllegalArgumentException("Unhandled Bayer pattern " + pattern);
        }
    }

    /**
     * The {@code cvtColor} code for bilinear demosaicing to BGR.
     */
    public static int bilinearCode(final BayerPattern pattern) {
        switch(pattern) {
            case RGGB:
                return Imgproc.COLOR_BayerBG2BGR;
            case GRBG:
                return Imgproc.COLOR_BayerGB2BGR;
            case GBRG:
                return Imgproc.COLOR_BayerGR2BGR;
            case BGGR:
                return Imgproc.COLOR_BayerRG2BGR;
            default:
                throw new IllegalArgumentException("Unhandled Bayer pattern " + pattern);
        }
    }
}
