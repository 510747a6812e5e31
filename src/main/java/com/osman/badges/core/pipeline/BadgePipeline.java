package com.osman.badges.core.pipeline;

import com.osman.badges.core.fs.OutputPathAllocator;
import com.osman.badges.core.model.BadgeRecord;
import com.osman.badges.core.model.GeneratedArtifact;
import com.osman.badges.core.pdf.AssetNotFoundException;
import com.osman.badges.core.pdf.FontRegistry;
import com.osman.badges.core.pdf.PageComposer;
import com.osman.badges.core.pdf.PageConfig;
import com.osman.badges.core.pdf.UnknownFontException;
import com.osman.badges.core.qr.QrEncoder;
import com.osman.badges.core.rows.RecordMapper;
import com.osman.badges.core.text.TextShaper;
import com.osman.badges.logging.AppLogger;
import com.osman.badges.logging.GenerationFailureLog;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns rows into badges: for every row the display name is shaped, the identifier is encoded as
 * a QR image, and a page combining both is composed.
 * <p>
 * Records are independent and run on a fixed worker pool; only the QR-then-page order within a
 * record is guaranteed. A failing record is logged and counted without stopping the batch.
 * Problems that would fail every record (unknown fonts, a missing background) are reported before
 * any record starts. {@link #requestStop()} lets records already running finish and skips the rest.
 */
public final class BadgePipeline {

    private static final Logger LOGGER = AppLogger.get();

    private final PipelineOptions options;
    private final RecordMapper mapper;
    private final TextShaper shaper;
    private final QrEncoder encoder;
    private final OutputPathAllocator allocator;
    private final PageComposer composer;
    private final FontRegistry fonts;
    private final GenerationFailureLog failureLog;
    private final BooleanSupplier cancelRequested;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public BadgePipeline(PipelineOptions options,
                         RecordMapper mapper,
                         FontRegistry fonts,
                         OutputPathAllocator allocator,
                         BooleanSupplier cancelRequested) {
        this.options = Objects.requireNonNull(options, "options");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.fonts = Objects.requireNonNull(fonts, "fonts");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.cancelRequested = cancelRequested == null ? () -> false : cancelRequested;
        this.shaper = new TextShaper();
        this.encoder = new QrEncoder();
        this.composer = new PageComposer(fonts);
        this.failureLog = options.failureReport() == null ? null : new GenerationFailureLog(options.failureReport());
    }

    public BadgePipeline(PipelineOptions options, RecordMapper mapper, FontRegistry fonts) {
        this(options, mapper, fonts, new OutputPathAllocator(), null);
    }

    /**
     * Asks the pipeline to start no further records. Records already running complete normally.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get() || cancelRequested.getAsBoolean();
    }

    /**
     * Processes every row and returns the batch summary.
     *
     * @param rows data rows in file order; the first row gets row index 1
     * @throws UnknownFontException   if a configured font is not registered
     * @throws AssetNotFoundException if the configured background image does not exist
     */
    public BatchSummary run(List<List<String>> rows) throws UnknownFontException, AssetNotFoundException {
        Objects.requireNonNull(rows, "rows");
        verifySharedAssets();
        if (rows.isEmpty()) {
            LOGGER.info("No rows to process.");
            return BatchSummary.empty();
        }

        LOGGER.info("Generating badges for %d rows with %d worker(s)%s."
            .formatted(rows.size(), options.workers(), options.qrOnly() ? " (QR images only)" : ""));

        AtomicInteger threadCounter = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "BadgePool-Worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.workers(), rows.size()), tf);
        List<Future<RecordResult>> futures = new ArrayList<>(rows.size());
        try {
            for (int i = 0; i < rows.size(); i++) {
                final List<String> row = rows.get(i);
                final int rowIndex = i + 1;
                futures.add(pool.submit(() -> processWhenNotStopped(row, rowIndex)));
            }
            return summarize(futures, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    private void verifySharedAssets() throws UnknownFontException, AssetNotFoundException {
        if (options.qrOnly()) {
            return;
        }
        PageConfig page = options.pageConfig();
        fonts.requireRegistered(page.titleFont());
        fonts.requireRegistered(page.numberFont());
        if (page.background().isPresent() && !Files.isRegularFile(page.background().get())) {
            throw new AssetNotFoundException("Background image", page.background().get());
        }
    }

    private RecordResult processWhenNotStopped(List<String> row, int rowIndex) {
        if (isStopRequested()) {
            return RecordResult.skipped();
        }
        return processRecord(row, rowIndex);
    }

    RecordResult processRecord(List<String> row, int rowIndex) {
        RecordState state = RecordState.PENDING;
        String rawName = mapper.rawName(row);
        Path qrPath = null;
        try {
            BadgeRecord record = mapper.toRecord(row, rowIndex);
            String title = shaper.shape(record.displayName());
            state = RecordState.SHAPED;

            BufferedImage qrImage = encoder.encode(record.identifier(), options.qrConfig());
            qrPath = allocator.allocate(options.qrDirectory(), rowIndex, record.displayName(), "png");
            encoder.writePng(qrImage, qrPath);
            state = RecordState.ENCODED;

            if (options.qrOnly()) {
                LOGGER.info("QR code generated: " + qrPath);
                return RecordResult.success(GeneratedArtifact.qrOnly(rowIndex, qrPath));
            }

            Path pdfPath = allocator.allocate(options.pdfDirectory(), rowIndex, record.displayName(), "pdf");
            composer.compose(pdfPath, title, record.identifier(), qrPath, options.pageConfig());
            state = RecordState.COMPOSED;

            LOGGER.info("PDF generated: " + pdfPath);
            return RecordResult.success(GeneratedArtifact.withPdf(rowIndex, qrPath, pdfPath));
        } catch (Exception ex) {
            LOGGER.log(Level.SEVERE, "Row %d (%s) failed after %s: %s"
                .formatted(rowIndex, rawName, state, ex.getMessage()), ex);
            if (state == RecordState.ENCODED) {
                removeOrphan(qrPath);
            }
            if (failureLog != null) {
                failureLog.logFailure(rowIndex, rawName, state.name(), ex);
            }
            return RecordResult.failure(new RecordFailure(rowIndex, rawName, state, String.valueOf(ex.getMessage())));
        }
    }

    private BatchSummary summarize(List<Future<RecordResult>> futures, ExecutorService pool) {
        List<GeneratedArtifact> artifacts = new ArrayList<>();
        List<RecordFailure> failures = new ArrayList<>();
        int skipped = 0;
        boolean interrupted = false;

        try {
            for (Future<RecordResult> future : futures) {
                RecordResult result = null;
                while (result == null) {
                    try {
                        result = future.get();
                    } catch (InterruptedException ex) {
                        if (!interrupted) {
                            interrupted = true;
                            LOGGER.warning("Interrupted: finishing records in progress, skipping the rest.");
                            requestStop();
                            pool.shutdown();
                        }
                    } catch (ExecutionException ex) {
                        throw new IllegalStateException("Badge worker crashed", ex.getCause());
                    }
                }
                switch (result.state()) {
                    case DONE -> artifacts.add(result.artifact());
                    case FAILED -> failures.add(result.failure());
                    default -> skipped++;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        BatchSummary summary = new BatchSummary(futures.size(), artifacts.size(), failures.size(), skipped,
            artifacts, failures);
        if (summary.failed() == 0 && summary.skipped() == 0) {
            LOGGER.info("All %d badges created successfully!".formatted(summary.succeeded()));
        } else {
            LOGGER.warning("Processed %d of %d rows: %d succeeded, %d failed, %d skipped."
                .formatted(summary.processed(), summary.total(), summary.succeeded(), summary.failed(), summary.skipped()));
        }
        return summary;
    }

    private static void removeOrphan(Path qrPath) {
        if (qrPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(qrPath);
        } catch (IOException ex) {
            LOGGER.warning("Could not remove QR image of failed record " + qrPath + ": " + ex.getMessage());
        }
    }

    record RecordResult(RecordState state, GeneratedArtifact artifact, RecordFailure failure) {

        static RecordResult success(GeneratedArtifact artifact) {
            return new RecordResult(RecordState.DONE, artifact, null);
        }

        static RecordResult failure(RecordFailure failure) {
            return new RecordResult(RecordState.FAILED, null, failure);
        }

        static RecordResult skipped() {
            return new RecordResult(RecordState.PENDING, null, null);
        }
    }
}
