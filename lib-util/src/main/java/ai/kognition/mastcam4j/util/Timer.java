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

/**
 * Wall clock timer for pipeline stages. Not thread safe; use one per thread.
 */
public final class Timer {
    private long startTime;
    private long endTime;
    private boolean running = false;

    public static final long nanoSecondsPerSecond = 1000000000L;
    public static final double secondsPerNanosecond = 1.0D / nanoSecondsPerSecond;

    public static Timer started() {
        final Timer ret = new Timer();
        ret.start();
        return ret;
    }

    public final void start() {
        startTime = System.nanoTime();
        running = true;
    }

    /**
     * Stop the timer and return the elapsed seconds formatted as a string.
     */
    public final String stop() {
        endTime = System.nanoTime();
        running = false;
        return toString();
    }

    /**
     * Elapsed seconds. If the timer is still running this is the time since it was started.
     */
    public final float getSeconds() {
        final long end = running ? System.nanoTime() : endTime;
        return (float)((end - startTime) * secondsPerNanosecond);
    }

    public final long getMillis() {
        final long end = running ? System.nanoTime() : endTime;
        return (end - startTime) / 1000000L;
    }

    @Override
    public final String toString() {
        return String.format("%.3f", getSeconds());
    }
}
