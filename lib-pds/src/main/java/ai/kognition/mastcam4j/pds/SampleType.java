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

import java.nio.ByteOrder;

/**
 * The PDS4 {@code Element_Array/data_type} values a Mastcam raw frame can use.
 */
public enum SampleType {
    UNSIGNED_BYTE("UnsignedByte", 1, ByteOrder.BIG_ENDIAN),
    UNSIGNED_MSB2("UnsignedMSB2", 2, ByteOrder.BIG_ENDIAN),
    UNSIGNED_LSB2("UnsignedLSB2", 2, ByteOrder.LITTLE_ENDIAN);

    public final String pdsName;
    public final int bytesPerSample;
    public final ByteOrder byteOrder;

    private SampleType(final String pdsName, final int bytesPerSample, final ByteOrder byteOrder) {
        this.pdsName = pdsName;
        this.bytesPerSample = bytesPerSample;
        this.byteOrder = byteOrder;
    }

    public int bitDepth() {
        return bytesPerSample * 8;
    }

    /**
     * @throws LabelParseException if the data type isn't one of the unsigned integer types
     *     supported.
     */
    public static SampleType fromPdsName(final String name) {
        for(final SampleType t: values()) {
            if(t.pdsName.equalsIgnoreCase(name.trim()))
                return t;
        }
        throw new LabelParseException("Unsupported data_type \"" + name + "\". Only UnsignedByte, UnsignedMSB2 and UnsignedLSB2 can be read.");
    }
}
