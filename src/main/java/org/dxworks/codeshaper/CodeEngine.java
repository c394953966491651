package org.dxworks.codeshaper;

import org.dxworks.codeshaper.format.FormatOptions;
import org.dxworks.codeshaper.format.SourceFormatter;
import org.dxworks.codeshaper.io.BackupPolicy;
import org.dxworks.codeshaper.io.ByteOrderMark;
import org.dxworks.codeshaper.io.FileSystemSourceStore;
import org.dxworks.codeshaper.io.SourceStore;
import org.dxworks.codeshaper.io.TimestampedBackupPolicy;
import org.dxworks.codeshaper.model.*;
import org.dxworks.codeshaper.modify.ModificationEngine;
import org.dxworks.codeshaper.modify.ModificationRequest;
import org.dxworks.codeshaper.parser.ParsedSource;
import org.dxworks.codeshaper.parser.StructuralParser;
import org.dxworks.codeshaper.quality.QualityAnalyzer;
import org.dxworks.codeshaper.refactoring.RefactoringAdvisor;
import org.dxworks.codeshaper.refactoring.SuggestionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Entry point of the engine. Every call reads its file, works on a fresh parse and keeps
 * no state between calls, so instances can be shared across threads working on different
 * files.
 */
public class CodeEngine {

    private static final Logger log = LoggerFactory.getLogger(CodeEngine.class);

    private final StructuralParser parser;
    private final QualityAnalyzer qualityAnalyzer;
    private final RefactoringAdvisor refactoringAdvisor;
    private final ModificationEngine modificationEngine;
    private final SourceFormatter formatter;
    private final SourceStore store;
    private final CodeshaperConfig config;

    public CodeEngine(CodeshaperConfig config) {
        this(config, new FileSystemSourceStore(), new TimestampedBackupPolicy(), Clock.systemUTC());
    }

    public CodeEngine(CodeshaperConfig config, SourceStore store, BackupPolicy backupPolicy, Clock clock) {
        this(config, new StructuralParser(config.getDeclarationScope()), new QualityAnalyzer(),
                new RefactoringAdvisor(), store, backupPolicy, clock);
    }

    public CodeEngine(CodeshaperConfig config, StructuralParser parser, QualityAnalyzer qualityAnalyzer,
                      RefactoringAdvisor refactoringAdvisor, SourceStore store, BackupPolicy backupPolicy,
                      Clock clock) {
        this.config = config;
        this.parser = parser;
        this.qualityAnalyzer = qualityAnalyzer;
        this.refactoringAdvisor = refactoringAdvisor;
        this.store = store;
        this.modificationEngine = new ModificationEngine(parser, store, backupPolicy, clock, config);
        this.formatter = new SourceFormatter(parser, config.getIndentSize());
    }

    public AnalysisReport analyze(Path file) throws IOException {
        Loaded loaded = load(file);
        ParsedSource parsed = parser.parseTree(loaded.text, DialectDetector.detectDialect(file));
        ProgramSummary summary = parser.summarize(parsed, loaded.deadline);
        loaded.deadline.check();
        QualityMetrics metrics = qualityAnalyzer.analyzeQuality(loaded.text, summary);

        AnalysisReport.Summary counts = new AnalysisReport.Summary(
                summary.functions.size(),
                summary.classes.size(),
                summary.imports.size(),
                summary.exports.size(),
                metrics.linesOfCode);
        AnalysisReport.Complexity complexity = new AnalysisReport.Complexity(
                metrics.complexity, metrics.maintainability, metrics.rating);

        log.debug("Analyzed {}: complexity {}, maintainability {}", file, metrics.complexity, metrics.maintainability);
        return new AnalysisReport(file.toString(), parsed.getGrammar().name().toLowerCase(), counts, complexity,
                metrics.issues, qualityAnalyzer.coarseSuggestions(metrics, summary), summary);
    }

    public RefactoringReport suggestRefactoring(Path file) throws IOException {
        return suggestRefactoring(file, SuggestionOptions.all());
    }

    public RefactoringReport suggestRefactoring(Path file, SuggestionOptions options) throws IOException {
        Loaded loaded = load(file);
        ProgramSummary summary = parser.parse(loaded.text, DialectDetector.detectDialect(file), loaded.deadline);
        return refactoringAdvisor.suggestRefactoring(file.toString(), summary, options);
    }

    public ModifyResult modify(Path file, List<ModificationRequest> requests) throws IOException {
        return modificationEngine.modify(file, requests);
    }

    public List<ModificationRequest> parseRequests(String json) {
        return ModificationEngine.parseRequests(json);
    }

    public FormatResult format(Path file) throws IOException {
        return format(file, FormatOptions.defaults());
    }

    public FormatResult format(Path file, FormatOptions options) throws IOException {
        Loaded loaded = load(file);
        FormatResult result = formatter.format(loaded.text, DialectDetector.detectDialect(file), loaded.deadline);
        if (result.modified && options.shouldWrite()) {
            store.write(file, ByteOrderMark.restore(result.formattedContent, loaded.hadBom));
            log.info("Formatted {} ({} line changes)", file, result.changes.size());
        }
        return result;
    }

    private Loaded load(Path file) throws IOException {
        String content = store.read(file);
        config.checkSize(content);
        return new Loaded(ByteOrderMark.strip(content), ByteOrderMark.isPresent(content), config.newDeadline());
    }

    private static final class Loaded {
        final String text;
        final boolean hadBom;
        final Deadline deadline;

        Loaded(String text, boolean hadBom, Deadline deadline) {
            this.text = text;
            this.hadBom = hadBom;
            this.deadline = deadline;
        }
    }
}
