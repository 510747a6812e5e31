package com.osman.badges.core.pipeline;

import com.osman.badges.TestFiles;
import com.osman.badges.core.model.GeneratedArtifact;
import com.osman.badges.core.pdf.AssetNotFoundException;
import com.osman.badges.core.pdf.FontRegistry;
import com.osman.badges.core.pdf.PageConfig;
import com.osman.badges.core.pdf.UnknownFontException;
import com.osman.badges.core.fs.OutputPathAllocator;
import com.osman.badges.core.rows.RecordMapper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BadgePipelineTest {

    private static final String ARABIC_ALI = "\u0639\u0644\u064A";

    private Path outputRoot;
    private PipelineOptions options;

    @BeforeEach
    void setUp() throws Exception {
        outputRoot = Files.createTempDirectory("badge-pipeline");
        options = PipelineOptions.defaults(outputRoot).withWorkers(2);
    }

    @AfterEach
    void tearDown() {
        TestFiles.deleteQuietly(outputRoot);
    }

    @Test
    void generatesQrImageAndPageForEachRow() throws Exception {
        BadgePipeline pipeline = pipeline(options);

        BatchSummary summary = pipeline.run(List.of(List.of("Ali", "12345")));

        assertEquals(1, summary.total());
        assertEquals(1, summary.succeeded());
        assertFalse(summary.hasFailures());

        Path qr = options.qrDirectory().resolve("1-Ali.png");
        Path pdf = options.pdfDirectory().resolve("1-Ali.pdf");
        GeneratedArtifact artifact = summary.artifacts().get(0);
        assertEquals(qr, artifact.qrImagePath());
        assertEquals(pdf, artifact.pdfPath().orElseThrow());
        assertEquals("12345", TestFiles.decodeQr(qr));

        try (PDDocument doc = PDDocument.load(pdf.toFile())) {
            assertEquals(1, doc.getNumberOfPages());
            String text = new PDFTextStripper().getText(doc);
            assertTrue(text.contains("Ali"));
            assertTrue(text.contains("12345"));
        }
        assertFalse(Files.exists(options.failureReport()), "No failures, no report");
    }

    @Test
    void duplicateNamesGetDistinctFilesByRowIndex() throws Exception {
        BatchSummary summary = pipeline(options).run(List.of(
            List.of("Name", "1"),
            List.of("Name", "2")));

        assertEquals(2, summary.succeeded());
        assertEquals(List.of("1-Name.png", "2-Name.png"), TestFiles.fileNames(options.qrDirectory()));
        assertEquals(List.of("1-Name.pdf", "2-Name.pdf"), TestFiles.fileNames(options.pdfDirectory()));
        assertEquals("1", TestFiles.decodeQr(options.qrDirectory().resolve("1-Name.png")));
        assertEquals("2", TestFiles.decodeQr(options.qrDirectory().resolve("2-Name.png")));
    }

    @Test
    void emptyIdentifierStillProducesBadge() throws Exception {
        BatchSummary summary = pipeline(options).run(List.of(List.of("Ali", "")));

        assertEquals(1, summary.succeeded());
        assertEquals("", TestFiles.decodeQr(options.qrDirectory().resolve("1-Ali.png")));
        assertTrue(Files.isRegularFile(options.pdfDirectory().resolve("1-Ali.pdf")));
    }

    @Test
    void failingRecordDoesNotStopTheBatch() throws Exception {
        List<List<String>> rows = new ArrayList<>();
        for (int i = 1; i <= 100; i++) {
            String name = i == 37 ? "bad\uD800name" : "Person" + i;
            rows.add(List.of(name, "ID-" + i));
        }

        BatchSummary summary = pipeline(options.withWorkers(4)).run(rows);

        assertEquals(100, summary.total());
        assertEquals(99, summary.succeeded());
        assertEquals(1, summary.failed());
        assertEquals(0, summary.skipped());
        RecordFailure failure = summary.failures().get(0);
        assertEquals(37, failure.rowIndex());
        assertEquals(RecordState.PENDING, failure.reachedState());

        List<String> pngs = TestFiles.fileNames(options.qrDirectory());
        assertEquals(99, pngs.size());
        assertFalse(pngs.stream().anyMatch(name -> name.startsWith("37-")));
        assertEquals(99, TestFiles.fileNames(options.pdfDirectory(), ".pdf").size());
        assertTrue(pngs.contains("36-Person36.png"));
        assertTrue(pngs.contains("38-Person38.png"));

        assertEquals(options.pdfDirectory().resolve("generation-failures.csv"), options.failureReport());
        List<String> report = Files.readAllLines(options.failureReport(), StandardCharsets.UTF_8);
        assertEquals(2, report.size());
        assertTrue(report.get(0).startsWith("timestamp,row_index"));
        assertTrue(report.get(1).contains(",37,bad?name,PENDING,"), report.get(1));
    }

    @Test
    void farsiNameRendersWithRegisteredArabicFont() throws Exception {
        FontRegistry fonts = FontRegistry.withStandardFonts();
        fonts.registerFontFile("DejaVuSans", TestFiles.arabicFont());
        PipelineOptions farsi = options.withPageConfig(PageConfig.defaults().withTitleFont("DejaVuSans", 16f));
        String gol = "\u06AF\u0644";

        BatchSummary summary = new BadgePipeline(farsi, new RecordMapper(0, 1), fonts, new OutputPathAllocator(), null)
            .run(List.of(List.of(gol, "12345")));

        assertEquals(1, summary.succeeded());
        assertEquals(List.of("1-" + gol + ".pdf"), TestFiles.fileNames(options.pdfDirectory()));
        assertEquals("12345", TestFiles.decodeQr(options.qrDirectory().resolve("1-" + gol + ".png")));
    }

    @Test
    void failureAfterEncodingRemovesTheQrImage() throws Exception {
        BatchSummary summary = pipeline(options).run(List.of(
            List.of(ARABIC_ALI, "12345"),
            List.of("Ali", "678")));

        assertEquals(1, summary.succeeded());
        RecordFailure failure = summary.failures().get(0);
        assertEquals(1, failure.rowIndex());
        assertEquals(ARABIC_ALI, failure.rawName());
        assertEquals(RecordState.ENCODED, failure.reachedState());
        assertEquals(List.of("2-Ali.png"), TestFiles.fileNames(options.qrDirectory()));
        assertEquals(List.of("2-Ali.pdf", "generation-failures.csv"), TestFiles.fileNames(options.pdfDirectory()));
    }

    @Test
    void shortRowIsReportedAndLaterRowsKeepTheirIndex() throws Exception {
        BatchSummary summary = pipeline(options).run(List.of(
            List.of("OnlyName"),
            List.of("Sara", "2")));

        assertEquals(1, summary.failed());
        assertEquals(1, summary.failures().get(0).rowIndex());
        assertEquals(List.of("2-Sara.png"), TestFiles.fileNames(options.qrDirectory()));
    }

    @Test
    void qrOnlyModeSkipsPages() throws Exception {
        BatchSummary summary = pipeline(options.withQrOnly(true)).run(List.of(List.of(ARABIC_ALI, "12345")));

        assertEquals(1, summary.succeeded());
        assertTrue(summary.artifacts().get(0).pdfPath().isEmpty());
        assertEquals(List.of("1-" + ARABIC_ALI + ".png"), TestFiles.fileNames(options.qrDirectory()));
        assertFalse(Files.exists(options.pdfDirectory()));
    }

    @Test
    void stopSignalSkipsRecordsNotYetStarted() throws Exception {
        AtomicInteger checks = new AtomicInteger();
        BadgePipeline pipeline = new BadgePipeline(options.withWorkers(1), new RecordMapper(0, 1),
            FontRegistry.withStandardFonts(), new OutputPathAllocator(), () -> checks.incrementAndGet() > 3);

        List<List<String>> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(List.of("P" + i, Integer.toString(i)));
        }
        BatchSummary summary = pipeline.run(rows);

        assertEquals(5, summary.total());
        assertEquals(3, summary.succeeded());
        assertEquals(2, summary.skipped());
        assertEquals(3, summary.processed());
        assertEquals(List.of("1-P1.png", "2-P2.png", "3-P3.png"), TestFiles.fileNames(options.qrDirectory()));
    }

    @Test
    void interruptWhileCollectingLetsRunningRecordFinish() throws Exception {
        Thread caller = Thread.currentThread();
        AtomicInteger checks = new AtomicInteger();
        BadgePipeline pipeline = new BadgePipeline(options.withWorkers(1), new RecordMapper(0, 1),
            FontRegistry.withStandardFonts(), new OutputPathAllocator(), () -> {
                if (checks.incrementAndGet() == 1) {
                    caller.interrupt();
                    return false;
                }
                return true;
            });

        List<List<String>> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(List.of("P" + i, Integer.toString(i)));
        }
        BatchSummary summary;
        try {
            summary = pipeline.run(rows);
        } finally {
            assertTrue(Thread.interrupted(), "interrupt flag is restored");
        }

        assertTrue(pipeline.isStopRequested());
        assertEquals(1, summary.succeeded());
        assertEquals(4, summary.skipped());
        assertEquals(0, summary.failed());
        assertEquals(List.of("1-P1.png"), TestFiles.fileNames(options.qrDirectory()));
        try (PDDocument doc = PDDocument.load(options.pdfDirectory().resolve("1-P1.pdf").toFile())) {
            assertEquals(1, doc.getNumberOfPages());
        }
    }

    @Test
    void stopRequestedBeforeRunSkipsEverything() throws Exception {
        BadgePipeline pipeline = pipeline(options);
        pipeline.requestStop();

        BatchSummary summary = pipeline.run(List.of(List.of("A", "1"), List.of("B", "2")));

        assertTrue(pipeline.isStopRequested());
        assertEquals(2, summary.skipped());
        assertEquals(0, summary.processed());
    }

    @Test
    void unknownFontFailsBeforeAnyRecord() {
        PipelineOptions withFont = options.withPageConfig(PageConfig.defaults().withTitleFont("BNazanin", 16f));

        assertThrows(UnknownFontException.class, () -> pipeline(withFont).run(List.of(List.of("Ali", "1"))));
        assertFalse(Files.exists(options.qrDirectory()));
    }

    @Test
    void missingBackgroundFailsBeforeAnyRecord() {
        PipelineOptions withBackground = options.withPageConfig(
            PageConfig.defaults().withBackground(outputRoot.resolve("missing.png")));

        assertThrows(AssetNotFoundException.class, () -> pipeline(withBackground).run(List.of(List.of("Ali", "1"))));
        assertFalse(Files.exists(options.qrDirectory()));
    }

    @Test
    void emptyInputProducesEmptySummary() throws Exception {
        BatchSummary summary = pipeline(options).run(List.of());

        assertEquals(0, summary.total());
        assertFalse(summary.hasFailures());
    }

    private static BadgePipeline pipeline(PipelineOptions options) {
        return new BadgePipeline(options, new RecordMapper(0, 1), FontRegistry.withStandardFonts());
    }
}
