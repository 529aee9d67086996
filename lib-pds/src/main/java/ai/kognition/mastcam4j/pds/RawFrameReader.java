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

import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.MosaicFrame;

/**
 * Reads the raw mosaic a {@link Pds4Label} describes out of its data file.
 */
public class RawFrameReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(RawFrameReader.class);

    public MosaicFrame read(final Pds4Label label) throws IOException {
        return read(label.dataFile(), label);
    }

    /**
     * Read exactly {@code rows * cols * bytesPerSample} bytes starting at the label's offset.
     *
     * @throws IOException if the file is missing or holds fewer bytes than the label
     *     describes.
     */
    public MosaicFrame read(final Path dataFile, final Pds4Label label) throws IOException {
        if(!Files.isRegularFile(dataFile))
            throw new FileNotFoundException("IMG file not found: " + dataFile);

        final long expected = label.imageBytes();
        if(expected > Integer.MAX_VALUE)
            throw new IOException("The image in " + dataFile + " is too large to read (" + expected + " bytes)");

        final byte[] raw = new byte[(int)expected];
        final int read;
        try(InputStream is = Files.newInputStream(dataFile)) {
            try {
                IOUtils.skipFully(is, label.offset);
            } catch(final EOFException eof) {
                throw new IOException("Expected " + expected + " bytes but read 0 from " + dataFile + " at offset " + label.offset, eof);
            }
            read = IOUtils.read(is, raw);
        }
        if(read < expected)
            throw new IOException("Expected " + expected + " bytes but read " + read + " from " + dataFile + " at offset " + label.offset);

        LOGGER.trace("Read {} bytes of {} samples from {}", read, label.sampleType, dataFile);
        return decode(raw, label);
    }

    static MosaicFrame decode(final byte[] raw, final Pds4Label label) {
        final SampleType type = label.sampleType;
        if(type.bytesPerSample == 1)
            return MosaicFrame.fromUnsignedBytes(label.rows, label.cols, raw);

        final ByteBuffer bb = ByteBuffer.wrap(raw).order(type.byteOrder);
        final int[] samples = new int[label.rows * label.cols];
        for(int i = 0; i < samples.length; i++)
            samples[i] = bb.getShort() & 0xffff;
        return new MosaicFrame(label.rows, label.cols, type.bitDepth(), samples);
    }
}
