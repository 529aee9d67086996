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

import java.io.FileNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.mastcam4j.image.ImageFile;
import ai.kognition.mastcam4j.image.MosaicFrame;
import ai.kognition.mastcam4j.image.RgbRaster;
import ai.kognition.mastcam4j.image.bayer.BayerPattern;
import ai.kognition.mastcam4j.image.pipeline.ColorPipeline;
import ai.kognition.mastcam4j.image.pipeline.PipelineConfig;
import ai.kognition.mastcam4j.util.Timer;

/**
 * <p>
 * Processes a list of labels on a fixed size thread pool. Each label is an independent unit
 * of work: a failure is logged, recorded in its {@link ProcessingResult} and the rest of the
 * batch carries on.
 * </p>
 *
 * <p>
 * The Bayer pattern for a label is the override if one was given, else the pattern named in
 * the label, else the configured one. Output goes to {@code outputDir} if given, otherwise to
 * a directory named {@code outputDirName} next to each label, as
 * {@code <image base name>_RGB.png}.
 * </p>
 */
public class BatchProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);

    public static final String OUTPUT_SUFFIX = "_RGB.png";
    public static final String DEFAULT_OUTPUT_DIR_NAME = "output_png";

    private final PipelineConfig config;
    private final BayerPattern patternOverride;
    private final Path outputDir;
    private final String outputDirName;
    private final int threads;

    private final Pds4LabelParser parser = new Pds4LabelParser();
    private final RawFrameReader reader = new RawFrameReader();
    private final Map<BayerPattern, ColorPipeline> pipelines = new ConcurrentHashMap<>();

    /**
     * @param patternOverride the pattern for every label regardless of what the label says.
     *     May be null.
     * @param outputDir the directory for every PNG. If null each PNG goes in
     *     {@code outputDirName} next to its label.
     * @param threads the pool size. Zero or less means one thread per available processor.
     */
    public BatchProcessor(final PipelineConfig config, final BayerPattern patternOverride, final Path outputDir, final String outputDirName,
        final int threads) {
        if(config == null)
            throw new NullPointerException("The pipeline config cannot be null");
        this.config = config;
        this.patternOverride = patternOverride;
        this.outputDir = outputDir;
        this.outputDirName = outputDirName == null || outputDirName.trim().isEmpty() ? DEFAULT_OUTPUT_DIR_NAME : outputDirName.trim();
        this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * @return one result per label, in the order the labels were given.
     */
    public List<ProcessingResult> process(final List<Path> labels) throws InterruptedException {
        final AtomicInteger done = new AtomicInteger(0);
        final int total = labels.size();
        LOGGER.info("Found {} XML label(s) to process using {} thread(s)", total, threads);

        final ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(threads, total)));
        try {
            final List<Future<ProcessingResult>> futures = new ArrayList<>(total);
            for(final Path label: labels)
                futures.add(pool.submit(() -> {
                    final ProcessingResult result = processOne(label);
                    LOGGER.info("[{}/{}] {}", done.incrementAndGet(), total, result);
                    return result;
                }));

            final List<ProcessingResult> ret = new ArrayList<>(total);
            for(int i = 0; i < total; i++) {
                try {
                    ret.add(futures.get(i).get());
                } catch(final ExecutionException ee) {
                    final Throwable cause = ee.getCause() == null ? ee : ee.getCause();
                    LOGGER.error("Failed to process {}", labels.get(i), cause);
                    ret.add(ProcessingResult.failure(labels.get(i), String.valueOf(cause)));
                }
            }
            return ret;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Process a single label. Never throws; any failure is captured in the result.
     */
    public ProcessingResult processOne(final Path labelFile) {
        final Timer timer = Timer.started();
        try {
            final Pds4Label label = parser.parse(labelFile);
            final Path dataFile = label.dataFile();
            if(!Files.isRegularFile(dataFile))
                throw new FileNotFoundException("IMG file not found: " + dataFile);

            final BayerPattern pattern = patternFor(label);
            LOGGER.debug("Processing {} ({}x{} {} at offset {}, {})", label.fileName, label.cols, label.rows, label.sampleType, label.offset,
                pattern);

            final MosaicFrame frame = reader.read(dataFile, label);
            final RgbRaster rgb = pipelineFor(pattern).process(frame);

            final Path out = outputPathFor(label);
            ImageFile.writePng(rgb, out);
            LOGGER.debug("Saved {} in {} seconds", out, timer.stop());
            return ProcessingResult.success(labelFile, out);
        } catch(final Exception e) {
            LOGGER.error("Failed to process {}", labelFile, e);
            final String msg = e.getMessage();
            return ProcessingResult.failure(labelFile, msg == null ? e.getClass().getSimpleName() : msg);
        }
    }

    BayerPattern patternFor(final Pds4Label label) {
        if(patternOverride != null)
            return patternOverride;
        return label.bayerPattern != null ? label.bayerPattern : config.pattern;
    }

    Path outputPathFor(final Pds4Label label) {
        final Path dir = outputDir != null ? outputDir : label.labelFile.toAbsolutePath().getParent().resolve(outputDirName);
        return dir.resolve(label.imageBaseName() + OUTPUT_SUFFIX);
    }

    private ColorPipeline pipelineFor(final BayerPattern pattern) {
        return pipelines.computeIfAbsent(pattern, p -> new ColorPipeline(config.withPattern(p)));
    }

    /**
     * Log the end of batch summary line.
     */
    public static void logSummary(final List<ProcessingResult> results) {
        final long succeeded = results.stream().filter(ProcessingResult::succeeded).count();
        LOGGER.info("Batch complete: {} succeeded, {} failed, {} total.", succeeded, results.size() - succeeded, results.size());
    }

    public int threads() {
        return threads;
    }

    public PipelineConfig config() {
        return config;
    }
}
