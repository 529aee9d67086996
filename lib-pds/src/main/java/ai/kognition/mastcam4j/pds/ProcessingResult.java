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

/**
 * The outcome of processing one label: either the PNG that was written or the reason it
 * wasn't.
 */
public final class ProcessingResult {
    public final Path label;
    public final Path output;
    public final String failure;

    private ProcessingResult(final Path label, final Path output, final String failure) {
        this.label = label;
        this.output = output;
        this.failure = failure;
    }

    public static ProcessingResult success(final Path label, final Path output) {
        return new ProcessingResult(label, output, null);
    }

    public static ProcessingResult failure(final Path label, final String failure) {
        return new ProcessingResult(label, null, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }

    @Override
    public String toString() {
        return succeeded() ? ("ProcessingResult [" + label + " -> " + output + "]") : ("ProcessingResult [" + label + " failed: " + failure + "]");
    }
}
