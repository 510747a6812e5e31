package com.osman.badges.config;

import com.osman.badges.core.pdf.PageConfig;
import com.osman.badges.core.pipeline.PipelineOptions;
import com.osman.badges.core.qr.QrConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one badge run needs, resolved by {@link SettingsLoader}.
 *
 * @param inputFile     CSV file; may be {@code null} when supplied on the command line instead
 * @param fontDirectories directories whose .ttf/.otf files are registered under their base names
 * @param fontFiles     explicit logical name to font file registrations
 * @param failureReport CSV failure report, or {@code null} to disable it
 */
public record GeneratorSettings(Path inputFile,
                                int skipRows,
                                int nameColumn,
                                int identifierColumn,
                                Path qrDirectory,
                                Path pdfDirectory,
                                Path failureReport,
                                int workers,
                                boolean qrOnly,
                                List<Path> fontDirectories,
                                Map<String, Path> fontFiles,
                                QrConfig qrConfig,
                                PageConfig pageConfig) {

    public GeneratorSettings {
        fontDirectories = List.copyOf(fontDirectories);
        fontFiles = Map.copyOf(fontFiles);
    }

    public Optional<Path> input() {
        return Optional.ofNullable(inputFile);
    }

    public PipelineOptions toPipelineOptions() {
        return new PipelineOptions(qrDirectory, pdfDirectory, qrConfig, pageConfig, workers, qrOnly, failureReport);
    }

    public GeneratorSettings withInputFile(Path file) {
        return new GeneratorSettings(file, skipRows, nameColumn, identifierColumn, qrDirectory, pdfDirectory,
            failureReport, workers, qrOnly, fontDirectories, fontFiles, qrConfig, pageConfig);
    }
}
