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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import ai.kognition.mastcam4j.image.InvalidPatternException;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;

/**
 * <p>
 * Reads the parts of a PDS4 product label needed to locate and decode a raw Mastcam frame:
 * </p>
 *
 * <ul>
 * <li>{@code File/file_name}: the data file, relative to the label</li>
 * <li>{@code Array_2D_Image/offset}: the byte offset of the image in the data file</li>
 * <li>{@code Axis_Array} elements whose {@code axis_name} is {@code Line} (rows) and
 * {@code Sample} (columns)</li>
 * <li>{@code Element_Array/data_type}: the sample encoding, {@code UnsignedByte} when absent</li>
 * <li>{@code color_filter_array_type}: optional, e.g. {@code Bayer RGGB}</li>
 * </ul>
 *
 * <p>
 * Elements are matched by their local name so labels with the {@code pds:} namespace and bare
 * labels both work. DOCTYPE declarations (and therefore external entities) are refused.
 * </p>
 */
public class Pds4LabelParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(Pds4LabelParser.class);

    public static final String FILE_NAME = "file_name";
    public static final String ARRAY_2D_IMAGE = "Array_2D_Image";
    public static final String OFFSET = "offset";
    public static final String AXIS_ARRAY = "Axis_Array";
    public static final String AXIS_NAME = "axis_name";
    public static final String ELEMENTS = "elements";
    public static final String ELEMENT_ARRAY = "Element_Array";
    public static final String DATA_TYPE = "data_type";
    public static final String CFA_TYPE = "color_filter_array_type";

    public static final String LINE_AXIS = "Line";
    public static final String SAMPLE_AXIS = "Sample";

    private final DocumentBuilderFactory factory;

    public Pds4LabelParser() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch(final ParserConfigurationException pce) {
            throw new IllegalStateException("The XML parser doesn't support disabling DOCTYPE declarations", pce);
        }
    }

    /**
     * @throws LabelParseException if the label is malformed or doesn't describe a 2D image.
     * @throws IOException if the label can't be read.
     */
    public Pds4Label parse(final Path labelFile) throws IOException {
        final Document doc;
        try(InputStream is = Files.newInputStream(labelFile)) {
            final DocumentBuilder builder = factory.newDocumentBuilder();
            doc = builder.parse(is, labelFile.toUri().toString());
        } catch(final SAXException e) {
            throw new LabelParseException("The label " + labelFile + " isn't well formed XML: " + e.getMessage(), e);
        } catch(final ParserConfigurationException e) {
            throw new IllegalStateException("Couldn't create an XML parser", e);
        }

        final Element root = doc.getDocumentElement();

        final String fileName = text(first(root, FILE_NAME));
        if(fileName == null || fileName.isEmpty())
            throw new LabelParseException("No " + FILE_NAME + " element found in " + labelFile);

        final Element array = first(root, ARRAY_2D_IMAGE);
        if(array == null)
            throw new LabelParseException("No " + ARRAY_2D_IMAGE + " element found in " + labelFile);

        final long offset = parseLong(labelFile, OFFSET, text(first(array, OFFSET)));
        if(offset < 0)
            throw new LabelParseException("The " + OFFSET + " in " + labelFile + " is negative (" + offset + ")");

        final int rows = axisElements(labelFile, array, LINE_AXIS);
        final int cols = axisElements(labelFile, array, SAMPLE_AXIS);

        final Element elementArray = first(array, ELEMENT_ARRAY);
        final String dataType = elementArray == null ? null : text(first(elementArray, DATA_TYPE));
        final SampleType sampleType = dataType == null || dataType.isEmpty() ? SampleType.UNSIGNED_BYTE : SampleType.fromPdsName(dataType);

        final BayerPattern pattern = bayerPattern(labelFile, text(first(root, CFA_TYPE)));

        final Pds4Label ret = new Pds4Label(labelFile, fileName, offset, rows, cols, sampleType, pattern);
        LOGGER.debug("Parsed {}: {}", labelFile, ret);
        return ret;
    }

    private static int axisElements(final Path labelFile, final Element array, final String axisName) {
        for(final Element axis: descendants(array, AXIS_ARRAY)) {
            if(axisName.equals(text(first(axis, AXIS_NAME)))) {
                final long elements = parseLong(labelFile, AXIS_ARRAY + "[" + axisName + "]/" + ELEMENTS, text(first(axis, ELEMENTS)));
                if(elements <= 0 || elements > Integer.MAX_VALUE)
                    throw new LabelParseException("The " + axisName + " axis in " + labelFile + " has an invalid size of " + elements);
                return (int)elements;
            }
        }
        throw new LabelParseException("No " + AXIS_ARRAY + " with " + AXIS_NAME + " " + axisName + " found in " + labelFile);
    }

    /**
     * The pattern is the last word of the value ({@code Bayer RGGB}). Values that don't end
     * in a Bayer layout are ignored.
     */
    static BayerPattern bayerPattern(final Path labelFile, final String cfaType) {
        if(cfaType == null || cfaType.isEmpty())
            return null;
        final String[] words = cfaType.trim().split("\\s+");
        try {
            return BayerPattern.fromName(words[words.length - 1]);
        } catch(final InvalidPatternException ipe) {
            LOGGER.debug("Ignoring the {} \"{}\" in {}", CFA_TYPE, cfaType, labelFile);
            return null;
        }
    }

    private static long parseLong(final Path labelFile, final String what, final String value) {
        if(value == null || value.isEmpty())
            throw new LabelParseException("No " + what + " found in " + labelFile);
        try {
            return Long.parseLong(value);
        } catch(final NumberFormatException nfe) {
            throw new LabelParseException("The " + what + " in " + labelFile + " should be an integer but is \"" + value + "\"", nfe);
        }
    }

    private static String text(final Element e) {
        return e == null ? null : e.getTextContent().trim();
    }

    private static Element first(final Element root, final String localName) {
        final List<Element> found = descendants(root, localName);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Every element below {@code root} with the given local name, in document order.
     */
    private static List<Element> descendants(final Element root, final String localName) {
        final List<Element> ret = new ArrayList<>();
        collect(root, localName, ret);
        return ret;
    }

    private static void collect(final Element parent, final String localName, final List<Element> into) {
        final NodeList children = parent.getChildNodes();
        for(int i = 0; i < children.getLength(); i++) {
            final Node n = children.item(i);
            if(n.getNodeType() != Node.ELEMENT_NODE)
                continue;
            final Element e = (Element)n;
            final String name = e.getLocalName() == null ? e.getNodeName() : e.getLocalName();
            if(localName.equals(name))
                into.add(e);
            collect(e, localName, into);
        }
    }
}
