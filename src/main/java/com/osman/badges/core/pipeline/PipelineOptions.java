package com.osman.badges.core.pipeline;

import com.osman.badges.core.InvalidConfigException;
import com.osman.badges.core.pdf.PageConfig;
import com.osman.badges.core.qr.QrConfig;
import com.osman.badges.logging.GenerationFailureLog;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Run-wide settings of a {@link BadgePipeline}.
 *
 * @param qrDirectory   directory receiving {@code {row}-{name}.png}
 * @param pdfDirectory  directory receiving {@code {row}-{name}.pdf}
 * @param workers       number of records processed concurrently; 1 runs sequentially
 * @param qrOnly        stop after the QR image and skip page composition
 * @param failureReport CSV file collecting failed rows, or {@code null} for none
 */
public record PipelineOptions(Path qrDirectory,
                              Path pdfDirectory,
                              QrConfig qrConfig,
                              PageConfig pageConfig,
                              int workers,
                              boolean qrOnly,
                              Path failureReport) {

    public PipelineOptions {
        Objects.requireNonNull(qrDirectory, "qrDirectory");
        Objects.requireNonNull(pdfDirectory, "pdfDirectory");
        Objects.requireNonNull(qrConfig, "qrConfig");
        Objects.requireNonNull(pageConfig, "pageConfig");
        if (workers < 1) {
            throw new InvalidConfigException("Worker count must be at least 1, was " + workers);
        }
    }

    public static PipelineOptions defaults(Path outputRoot) {
        Path pdfDirectory = outputRoot.resolve("PDF_files");
        return new PipelineOptions(
            outputRoot.resolve("QR_codes"),
            pdfDirectory,
            QrConfig.defaults(),
            PageConfig.defaults(),
            Runtime.getRuntime().availableProcessors(),
            false,
            pdfDirectory.resolve(GenerationFailureLog.DEFAULT_FILE_NAME));
    }

    public PipelineOptions withWorkers(int count) {
        return new PipelineOptions(qrDirectory, pdfDirectory, qrConfig, pageConfig, count, qrOnly, failureReport);
    }

    public PipelineOptions withQrOnly(boolean onlyQr) {
        return new PipelineOptions(qrDirectory, pdfDirectory, qrConfig, pageConfig, workers, onlyQr, failureReport);
    }

    public PipelineOptions withPageConfig(PageConfig config) {
        return new PipelineOptions(qrDirectory, pdfDirectory, qrConfig, config, workers, qrOnly, failureReport);
    }
}
