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

package ai.kognition.mastcam4j.image;

import java.util.LinkedList;
import java.util.List;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manage native OpenCV resources from a single place. Everything added is released in the
 * reverse order it was added when the {@link Closer} is closed.
 */
public class Closer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Closer.class);

    private final List<AutoCloseable> toClose = new LinkedList<>();

    public <T extends AutoCloseable> T add(final T resource) {
        if(resource != null)
            toClose.add(0, resource);
        return resource;
    }

    /**
     * {@link Mat} isn't {@link AutoCloseable} so it's wrapped in one that calls
     * {@link Mat#release()}.
     */
    public <T extends Mat> T addMat(final T mat) {
        if(mat != null)
            toClose.add(0, () -> mat.release());
        return mat;
    }

    @Override
    public void close() {
        RuntimeException first = null;
        for(final AutoCloseable r: toClose) {
            try {
                r.close();
            } catch(final Exception e) {
                LOGGER.warn("Failed to release {}", r, e);
                if(first == null)
                    first = (e instanceof RuntimeException) ? (RuntimeException)e : new ColorPipelineException("Failed to release a resource", e);
            }
        }
        toClose.clear();
        if(first != null)
            throw first;
    }
}
