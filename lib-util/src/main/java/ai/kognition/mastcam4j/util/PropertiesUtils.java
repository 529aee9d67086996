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

package ai.kognition.mastcam4j.util;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Pull out all of the properties whose key starts with {@code sectionName + "."}. If
     * {@code removeSectionName} is true the section prefix is stripped from the keys of
     * the result.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(sectionName + separator)) {
                final String newkey = removeSectionName ? key.substring(sectionName.length() + 1) : key;

                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * Load the properties file into {@code p}. Entries already in {@code p} are overwritten
     * by those in the file.
     */
    public static Properties loadProps(final Properties p, final Path file) throws IOException {
        LOGGER.debug("Loading properties from {}", file);
        try(InputStream is = Files.newInputStream(file)) {
            p.load(is);
        }
        return p;
    }

    /**
     * Load a properties resource from the classpath.
     *
     * @throws FileNotFoundException if the resource isn't on the classpath.
     */
    public static Properties loadFromClasspath(final String resource) throws IOException {
        final Properties ret = new Properties();
        try(InputStream is = PropertiesUtils.class.getClassLoader().getResourceAsStream(resource)) {
            if(is == null)
                throw new FileNotFoundException("Couldn't find the properties resource \"" + resource + "\" on the classpath");
            ret.load(is);
        }
        return ret;
    }

    /**
     * Create a new {@link Properties} with every entry of {@code base} replaced or
     * supplemented by the entries in {@code overrides}. Neither argument is modified.
     */
    public static Properties overlay(final Properties base, final Properties overrides) {
        final Properties ret = new Properties();
        for(final String key: base.stringPropertyNames())
            ret.setProperty(key, base.getProperty(key));
        for(final String key: overrides.stringPropertyNames())
            ret.setProperty(key, overrides.getProperty(key));
        return ret;
    }

    public static String getString(final Properties p, final String key, final String defaultValue) {
        final String val = p.getProperty(key);
        return (val == null || val.trim().isEmpty()) ? defaultValue : val.trim();
    }

    public static double getDouble(final Properties p, final String key, final double defaultValue) {
        final String val = getString(p, key, null);
        if(val == null)
            return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be a number but is \"" + val + "\"", nfe);
        }
    }

    public static int getInt(final Properties p, final String key, final int defaultValue) {
        final String val = getString(p, key, null);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be an integer but is \"" + val + "\"", nfe);
        }
    }

    /**
     * Parse a comma separated list of numbers. Returns null if the key isn't set.
     */
    public static double[] getDoubles(final Properties p, final String key) {
        final String val = getString(p, key, null);
        if(val == null)
            return null;

        final String[] parts = val.split(",");
        final double[] ret = new double[parts.length];
        for(int i = 0; i < parts.length; i++) {
            try {
                ret[i] = Double.parseDouble(parts[i].trim());
            } catch(final NumberFormatException nfe) {
                throw new IllegalArgumentException("The property \"" + key + "\" should be a comma separated list of numbers but is \"" + val + "\"",
                    nfe);
            }
        }
        return ret;
    }
}
