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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.apache.commons.io.FileUtils;

/**
 * Writes synthetic PDS4 labels and raw IMG files for the tests.
 */
public class PdsFixtures {

    public static String label(final String prefix, final String fileName, final long offset, final int rows, final int cols,
        final String dataType, final String cfaType) {
        final String p = prefix == null || prefix.isEmpty() ? "" : prefix + ":";
        final String ns = prefix == null || prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix;
        final StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<").append(p).append("Product_Observational ").append(ns).append("=\"http://pds.nasa.gov/pds4/pds/v1\"")
            .append(" xmlns:img=\"http://pds.nasa.gov/pds4/img/v1\">\n");
        if(cfaType != null) {
            sb.append("  <").append(p).append("Observation_Area>\n");
            sb.append("    <img:Imaging><img:color_filter_array_type>").append(cfaType).append("</img:color_filter_array_type></img:Imaging>\n");
            sb.append("  </").append(p).append("Observation_Area>\n");
        }
        sb.append("  <").append(p).append("File_Area_Observational>\n");
        sb.append("    <").append(p).append("File><").append(p).append("file_name>").append(fileName).append("</").append(p).append("file_name></")
            .append(p).append("File>\n");
        sb.append("    <").append(p).append("Array_2D_Image>\n");
        sb.append("      <").append(p).append("offset unit=\"byte\">").append(offset).append("</").append(p).append("offset>\n");
        sb.append("      <").append(p).append("axes>2</").append(p).append("axes>\n");
        if(dataType != null)
            sb.append("      <").append(p).append("Element_Array><").append(p).append("data_type>").append(dataType).append("</").append(p)
                .append("data_type></").append(p).append("Element_Array>\n");
        axis(sb, p, "Line", rows, 1);
        axis(sb, p, "Sample", cols, 2);
        sb.append("    </").append(p).append("Array_2D_Image>\n");
        sb.append("  </").append(p).append("File_Area_Observational>\n");
        sb.append("</").append(p).append("Product_Observational>\n");
        return sb.toString();
    }

    private static void axis(final StringBuilder sb, final String p, final String name, final int elements, final int seq) {
        sb.append("      <").append(p).append("Axis_Array>");
        sb.append("<").append(p).append("axis_name>").append(name).append("</").append(p).append("axis_name>");
        sb.append("<").append(p).append("elements>").append(elements).append("</").append(p).append("elements>");
        sb.append("<").append(p).append("sequence_number>").append(seq).append("</").append(p).append("sequence_number>");
        sb.append("</").append(p).append("Axis_Array>\n");
    }

    public static File writeLabel(final File dir, final String labelName, final String content) throws IOException {
        final File ret = new File(dir, labelName);
        FileUtils.writeStringToFile(ret, content, StandardCharsets.UTF_8);
        return ret;
    }

    /**
     * Write {@code offset} bytes of header followed by the given image bytes.
     */
    public static File writeImg(final File dir, final String name, final int offset, final byte[] image) throws IOException {
        final byte[] all = new byte[offset + image.length];
        for(int i = 0; i < offset; i++)
            all[i] = (byte)0xEE;
        System.arraycopy(image, 0, all, offset, image.length);
        final File ret = new File(dir, name);
        FileUtils.writeByteArrayToFile(ret, all);
        return ret;
    }

    public static byte[] randomBytes(final int count, final long seed) {
        final byte[] ret = new byte[count];
        new Random(seed).nextBytes(ret);
        return ret;
    }

    /**
     * A complete 8-bit product (label and IMG) of random data.
     */
    public static File writeProduct(final File dir, final String base, final int rows, final int cols, final long seed) throws IOException {
        final int offset = 64;
        writeImg(dir, base + ".IMG", offset, randomBytes(rows * cols, seed));
        return writeLabel(dir, base + ".xml", label("pds", base + ".IMG", offset, rows, cols, "UnsignedByte", null));
    }
}
