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

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact. The load is attempted
 * once; the result is remembered.
 */
public final class OpenCvSupport {
    private static final Logger LOGGER = LoggerFactory.getLogger(OpenCvSupport.class);

    private static Boolean available = null;

    private OpenCvSupport() {}

    /**
     * Attempt to load OpenCV if it hasn't been yet.
     *
     * @return whether the native library is usable on this platform.
     */
    public static synchronized boolean isAvailable() {
        if(available == null) {
            try {
                OpenCV.loadLocally();
                LOGGER.debug("Loaded OpenCV {}", Core.VERSION);
                available = Boolean.TRUE;
            } catch(final Throwable th) {
                LOGGER.warn("The OpenCV native library couldn't be loaded. OpenCV backed stages are unavailable.", th);
                available = Boolean.FALSE;
            }
        }
        return available.booleanValue();
    }

    /**
     * @throws IllegalStateException if the native library couldn't be loaded.
     */
    public static void initOpenCv() {
        if(!isAvailable())
            throw new IllegalStateException("The OpenCV native library isn't available on this platform");
    }
}
