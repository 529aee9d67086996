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
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.InvalidPatternException;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.color.StretchMode;
import ai.kognition.mastcam4j.image.demosaic.DemosaicMethod;
import ai.kognition.mastcam4j.image.pipeline.PipelineConfig;
import ai.kognition.mastcam4j.util.CommandLineParser;
import ai.kognition.mastcam4j.util.PropertiesUtils;

/**
 * Batch converts Mastcam PDS4 raw products to colour PNGs.
 *
 * <pre>
 * ProcessMastcam &lt;label-or-dir&gt; [&lt;label-or-dir&gt; ...] [-o dir] [-b rggb|gbrg|grbg|bggr]
 *     [-threads n] [-config file.properties] [-demosaic vng|bilinear|opencv-vng|opencv-ea|opencv-bilinear]
 *     [-stretch per-channel|global] [-help]
 * </pre>
 */
public class ProcessMastcam {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessMastcam.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_LABELS = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_INTERRUPTED = 130;

    public static final String BATCH_SECTION = "batch";
    public static final String THREADS = "threads";
    public static final String OUTPUT_DIR_NAME = "outputDirName";

    private static final Set<String> KNOWN_OPTIONS = new HashSet<>(
        Arrays.asList("o", "output", "b", "bayer", "threads", "config", "demosaic", "stretch", "h", "help"));

    public static void main(final String[] args) {
        System.exit(run(args, System.out));
    }

    public static void usage(final PrintStream out) {
        out.println("usage: ProcessMastcam <label-or-dir> [<label-or-dir> ...] [options]");
        out.println("  Converts MSL Mastcam PDS4 EDR products into colour PNGs. Directories are searched");
        out.println("  recursively for .xml labels.");
        out.println();
        out.println("  -o, -output dir        directory for the PNGs (default: output_png/ next to each label)");
        out.println("  -b, -bayer pattern     rggb, gbrg, grbg or bggr. Overrides the label and the configuration.");
        out.println("  -threads n             worker threads (default: one per processor)");
        out.println("  -config file           properties overlaying the built in defaults");
        out.println("  -demosaic method       vng, bilinear, opencv-vng, opencv-ea or opencv-bilinear");
        out.println("  -stretch mode          per-channel or global");
        out.println("  -help                  print this message");
    }

    /**
     * Run the command.
     *
     * @return the process exit status: 0 when the batch ran (even if some images failed), 1 when
     *     no labels were found, 2 for a usage error and 130 if interrupted.
     */
    public static int run(final String[] args, final PrintStream out) {
        final CommandLineParser cl = new CommandLineParser(args);

        if(cl.hasOption("help", "h")) {
            usage(out);
            return EXIT_OK;
        }

        final List<String> unknown = cl.unknownOptions(KNOWN_OPTIONS);
        if(!unknown.isEmpty()) {
            out.println("Unknown option(s): " + unknown);
            usage(out);
            return EXIT_USAGE;
        }

        final List<String> inputs = cl.getNonOptionArgs();
        if(inputs.isEmpty()) {
            out.println("At least one label or directory is required.");
            usage(out);
            return EXIT_USAGE;
        }

        final BatchProcessor processor;
        try {
            processor = configure(cl);
        } catch(final IllegalArgumentException | InvalidPatternException | IOException e) {
            out.println(e.getMessage());
            usage(out);
            return EXIT_USAGE;
        }

        final List<Path> labels = new LabelFinder().findAll(inputs);
        if(labels.isEmpty()) {
            LOGGER.error("No XML label files found. Check your input paths.");
            return EXIT_NO_LABELS;
        }

        try {
            final List<ProcessingResult> results = processor.process(labels);
            BatchProcessor.logSummary(results);
            final String outputDir = cl.getProperty("o", "output");
            LOGGER.info("Output directory: {}", outputDir != null ? outputDir : "output_png/ (inside each source directory)");
        } catch(final InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while processing the batch");
            return EXIT_INTERRUPTED;
        }
        return EXIT_OK;
    }

    /**
     * Build the batch processor from the defaults, the optional {@code -config} file and the
     * command line, in increasing order of precedence.
     */
    static BatchProcessor configure(final CommandLineParser cl) throws IOException {
        Properties props = PipelineConfig.loadDefaultProperties();
        final String configFile = cl.getProperty("config");
        if(configFile != null)
            props = PropertiesUtils.overlay(props, PropertiesUtils.loadProps(new Properties(), Paths.get(configFile)));

        PipelineConfig config = PipelineConfig.fromProperties(props);

        final String demosaic = cl.getProperty("demosaic");
        if(demosaic != null)
            config = config.withDemosaicMethod(DemosaicMethod.fromName(demosaic));

        final String stretch = cl.getProperty("stretch");
        if(stretch != null)
            config = config.withStretchMode(StretchMode.fromName(stretch));

        final String bayer = cl.getProperty("b", "bayer");
        final BayerPattern override = bayer == null ? null : BayerPattern.fromName(bayer);

        final String output = cl.getProperty("o", "output");
        final Path outputDir = output == null ? null : Paths.get(output);

        final Properties batch = PropertiesUtils.getSection(props, BATCH_SECTION, true);
        final int threads = cl.getInt(PropertiesUtils.getInt(batch, THREADS, 0), "threads");
        if(threads < 0)
            throw new IllegalArgumentException("The number of threads can't be negative but was " + threads);
        final String outputDirName = PropertiesUtils.getString(batch, OUTPUT_DIR_NAME, BatchProcessor.DEFAULT_OUTPUT_DIR_NAME);

        LOGGER.debug("Using {} with pattern override {}, output {} and {} threads", config, override, outputDir, threads);
        return new BatchProcessor(config, override, outputDir, outputDirName, threads);
    }
}
