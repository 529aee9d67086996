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

import java.util.function.ToIntFunction;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.Closer;
import ai.kognition.mastcam4j.image.InvalidDimensionsException;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.OpenCvSupport;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.bayer.CanonicalCfa;
import ai.kognition.mastcam4j.image.bayer.OpenCvBayerCodes;

/**
 * Demosaicing through one of OpenCV's {@code cvtColor} Bayer conversions. Only 8-bit frames
 * are accepted and every algorithm needs at least a 5x5 frame. The pattern name is translated
 * with {@link OpenCvBayerCodes}.
 */
public class OpenCvDemosaicer implements Demosaicer {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenCvDemosaicer.class);

    public static enum Algorithm {
        VNG(OpenCvBayerCodes::vngCode),
        EDGE_AWARE(OpenCvBayerCodes::edgeAwareCode),
        BILINEAR(OpenCvBayerCodes::bilinearCode);

        private final ToIntFunction<BayerPattern> code;

        private Algorithm(final ToIntFunction<BayerPattern> code) {
            this.code = code;
        }

        public int conversionCode(final BayerPattern pattern) {
            return code.applyAsInt(pattern);
        }
    }

    private final Algorithm algorithm;

    public OpenCvDemosaicer(final Algorithm algorithm) {
        if(algorithm == null)
            throw new NullPointerException("Cannot create an OpenCV demosaicer without an algorithm");
        this.algorithm = algorithm;
    }

    public OpenCvDemosaicer() {
        this(Algorithm.VNG);
    }

    public Algorithm algorithm() {
        return algorithm;
    }

    @Override
    public RgbRaster demosaic(final MosaicFrame frame, final CanonicalCfa cfa) {
        if(frame.bitDepth > 8)
            throw new IllegalArgumentException("OpenCV " + algorithm + " demosaicing only supports 8-bit frames but was given a " + frame.bitDepth
                + " bit frame");
        if(frame.rows < VngDemosaicer.WINDOW || frame.cols < VngDemosaicer.WINDOW)
            throw new InvalidDimensionsException("OpenCV " + algorithm + " demosaicing needs at least a " + VngDemosaicer.WINDOW + "x"
                + VngDemosaicer.WINDOW + " frame but was given " + frame.rows + "x" + frame.cols);

        OpenCvSupport.initOpenCv();

        final byte[] mosaic = new byte[frame.size()];
        for(int r = 0; r < frame.rows; r++)
            for(int c = 0; c < frame.cols; c++)
                mosaic[(r * frame.cols) + c] = (byte)frame.get(r, c);

        final BayerPattern pattern = cfa.pattern();
        if(LOGGER.isDebugEnabled())
            LOGGER.debug("OpenCV {} demosaicing {} as Bayer{} for a {} layout", algorithm, frame, OpenCvBayerCodes.openCvName(pattern), pattern);

        final byte[] bgr = new byte[frame.size() * 3];
        try(Closer closer = new Closer()) {
            final Mat src = closer.addMat(new Mat(frame.rows, frame.cols, CvType.CV_8UC1));
            src.put(0, 0, mosaic);
            final Mat dst = closer.addMat(new Mat());
            Imgproc.cvtColor(src, dst, algorithm.conversionCode(pattern));
            dst.get(0, 0, bgr);
        }

        final RgbRaster ret = new RgbRaster(frame.rows, frame.cols);
        for(int r = 0; r < frame.rows; r++) {
            for(int c = 0; c < frame.cols; c++) {
                final int pos = ((r * frame.cols) + c) * 3;
                ret.set(r, c, bgr[pos + 2] & 0xff, bgr[pos + 1] & 0xff, bgr[pos] & 0xff);
            }
        }
        return ret;
    }
}
