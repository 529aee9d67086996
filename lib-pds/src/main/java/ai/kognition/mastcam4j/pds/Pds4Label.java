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

package ai.kognition.mastcam4j.pds;

import java.nio.file.Path;

import org.apache.commons.io.FilenameUtils;

import ai.kognition.mastcam4j.image.bayer.BayerPattern;

/**
 * What a PDS4 label says about the raw frame it describes.
 */
public final class Pds4Label {
    public final Path labelFile;
    public final String fileName;
    public final long offset;
    public final int rows;
    public final int cols;
    public final SampleType sampleType;

    /**
     * The layout given in the label's {@code color_filter_array_type}, or null if the label
     * doesn't name one.
     */
    public final BayerPattern bayerPattern;

    public Pds4Label(final Path labelFile, final String fileName, final long offset, final int rows, final int cols, final SampleType sampleType,
        final BayerPattern bayerPattern) {
        this.labelFile = labelFile;
        this.fileName = fileName;
        this.offset = offset;
        this.rows = rows;
        this.cols = cols;
        this.sampleType = sampleType;
        this.bayerPattern = bayerPattern;
    }

    /**
     * The data file, which PDS4 places next to its label.
     */
    public Path dataFile() {
        final Path dir = labelFile.toAbsolutePath().getParent();
        return dir == null ? labelFile.resolveSibling(fileName) : dir.resolve(fileName);
    }

    /**
     * The data file name without its directory or extension.
     */
    public String imageBaseName() {
        return FilenameUtils.getBaseName(fileName);
    }

    public long imageBytes() {
        return (long)rows * cols * sampleType.bytesPerSample;
    }

    @Override
    public String toString() {
        return "Pds4Label [fileName=" + fileName + ", offset=" + offset + ", size=" + cols + "x" + rows + ", sampleType=" + sampleType
            + ", bayerPattern=" + bayerPattern + "]";
    }
}
