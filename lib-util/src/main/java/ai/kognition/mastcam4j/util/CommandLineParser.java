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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

/**
 * <p>
 * Builds a map of options from a command line. Anything starting with a dash is
 * an option name (any number of leading dashes are stripped so {@code -o},
 * {@code --output} and {@code -output} all work). If the next argument doesn't
 * start with a dash it's taken as that option's value, otherwise the option is
 * recorded with the value {@code "true"}.
 * </p>
 *
 * <pre>
 * <code>
 *   java ProcessMastcam ./sol_042 label.xml -o ./processed --bayer gbrg -help
 * </code>
 * </pre>
 *
 * results in the option map {@code o=./processed, bayer=gbrg, help=true} and the
 * non-option arguments {@code [./sol_042, label.xml]}.
 */
public class CommandLineParser extends HashMap<String, String> {
    private static final long serialVersionUID = 1599477341664265366L;

    private int argc = 0;

    private final List<String> noargs = new ArrayList<>();

    /**
     * This constructs a CommandLineParser from an argument list. A null argument list
     * results in no options and no non-option arguments.
     */
    public CommandLineParser(final String[] args) {
        parse(args);
    }

    public int getTotalArgCount() {
        return argc;
    }

    public int getOptionCount() {
        return size();
    }

    /**
     * The arguments that weren't options or option values, in the order they were given.
     */
    public List<String> getNonOptionArgs() {
        return Collections.unmodifiableList(noargs);
    }

    /**
     * Look up an option by any of its names. The first name present wins. Returns null
     * if none of them were given.
     */
    public String getProperty(final String... names) {
        for(final String name: names) {
            final String val = get(name);
            if(val != null)
                return val;
        }
        return null;
    }

    public boolean hasOption(final String... names) {
        return getProperty(names) != null;
    }

    /**
     * Fetch an integer option. If none of the names were given the default is returned.
     *
     * @throws IllegalArgumentException if the value isn't an integer.
     */
    public int getInt(final int defaultValue, final String... names) {
        final String val = getProperty(names);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option \"-" + names[0] + "\" requires an integer value but was given \"" + val + "\"", nfe);
        }
    }

    /**
     * Any option names given on the command line that aren't in the {@code known} set.
     */
    public List<String> unknownOptions(final Set<String> known) {
        final List<String> ret = new ArrayList<>();
        for(final String key: keySet()) {
            if(!known.contains(key))
                ret.add(key);
        }
        Collections.sort(ret);
        return ret;
    }

    private static boolean isOption(final String arg) {
        return arg.length() > 1 && arg.charAt(0) == '-';
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        argc = args.length;

        for(int i = 0; i < argc; i++) {
            final String cur = args[i].trim();
            if(cur.isEmpty())
                continue;

            if(isOption(cur)) {
                int start = 0;
                while(start < cur.length() && cur.charAt(start) == '-')
                    start++;
                final String name = cur.substring(start);

                String val = null;
                if(i + 1 < argc && !isOption(args[i + 1].trim())) {
                    val = args[i + 1];
                    i++;
                }

                put(name, val == null ? "true" : val);
            } else
                noargs.add(cur);
        }
    }
}
