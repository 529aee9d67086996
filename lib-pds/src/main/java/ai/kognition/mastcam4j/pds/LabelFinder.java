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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.apache.commons.io.filefilter.SuffixFileFilter;
import org.apache.commons.io.filefilter.TrueFileFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands command line inputs into the PDS4 labels to process. A file is taken as is if it
 * has an {@code .xml} extension. A directory is searched recursively and its labels are
 * returned sorted. Anything else is skipped with a warning.
 */
public class LabelFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(LabelFinder.class);

    public static final String LABEL_EXTENSION = "xml";

    public List<Path> find(final String input) {
        final File f = new File(input);
        if(f.isFile()) {
            if(LABEL_EXTENSION.equalsIgnoreCase(FilenameUtils.getExtension(f.getName()))) {
                final List<Path> ret = new ArrayList<>();
                ret.add(f.toPath());
                return ret;
            }
            LOGGER.warn("Skipping non-XML file: {}", input);
            return new ArrayList<>();
        } else if(f.isDirectory()) {
            final Collection<File> files = FileUtils.listFiles(f, new SuffixFileFilter("." + LABEL_EXTENSION, IOCase.INSENSITIVE),
                TrueFileFilter.INSTANCE);
            return files.stream().map(File::toPath).sorted().collect(Collectors.toList());
        } else {
            LOGGER.warn("Path not found: {}", input);
            return new ArrayList<>();
        }
    }

    /**
     * The labels for every input, in the order the inputs were given.
     */
    public List<Path> findAll(final List<String> inputs) {
        final List<Path> ret = new ArrayList<>();
        for(final String input: inputs)
            ret.addAll(find(input));
        return ret;
    }

    public List<Path> findAll(final String... inputs) {
        final List<String> asList = new ArrayList<>();
        for(final String in: inputs)
            asList.add(in);
        return findAll(asList);
    }
}
