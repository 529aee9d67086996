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

/**
 * Base class for the failures the colour reconstruction pipeline reports to its caller.
 * A pipeline run that throws one of these has produced no output.
 */
public class ColorPipelineException extends RuntimeException {
    private static final long serialVersionUID = -3061624716236815208L;

    public ColorPipelineException(final String msg) {
        super(msg);
    }

    public ColorPipelineException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
