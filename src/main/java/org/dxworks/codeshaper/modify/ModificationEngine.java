package org.dxworks.codeshaper.modify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codeshaper.CodeshaperConfig;
import org.dxworks.codeshaper.Deadline;
import org.dxworks.codeshaper.Dialect;
import org.dxworks.codeshaper.DialectDetector;
import org.dxworks.codeshaper.io.BackupPolicy;
import org.dxworks.codeshaper.io.ByteOrderMark;
import org.dxworks.codeshaper.io.SourceStore;
import org.dxworks.codeshaper.model.ModifyResult;
import org.dxworks.codeshaper.parser.ParseException;
import org.dxworks.codeshaper.parser.ParsedSource;
import org.dxworks.codeshaper.parser.StructuralParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies an ordered list of requests to one file.
 * <p>
 * Requests are validated before the file is touched. The original text is parsed, then
 * copied verbatim to a new backup file, and only after every request has been applied in
 * memory is the source file overwritten, exactly once. Any failure after the backup leaves
 * the source file as it was.
 */
public class ModificationEngine {

    private static final Logger log = LoggerFactory.getLogger(ModificationEngine.class);

    private static final ObjectMapper REQUEST_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final StructuralParser parser;
    private final SourceStore store;
    private final BackupPolicy backupPolicy;
    private final Clock clock;
    private final CodeshaperConfig config;

    public ModificationEngine(StructuralParser parser, SourceStore store, BackupPolicy backupPolicy,
                              Clock clock, CodeshaperConfig config) {
        this.parser = parser;
        this.store = store;
        this.backupPolicy = backupPolicy;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Reads a JSON array of requests. Unknown {@code type} tags and malformed JSON are
     * reported as invalid modifications.
     */
    public static List<ModificationRequest> parseRequests(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidModificationException("Modification list is empty");
        }
        try {
            List<ModificationRequest> requests = REQUEST_MAPPER.readValue(json,
                    new TypeReference<List<ModificationRequest>>() {
                    });
            if (requests == null) {
                throw new InvalidModificationException("Modification list is null");
            }
            return requests;
        } catch (JsonProcessingException e) {
            throw new InvalidModificationException("Malformed modification list: " + e.getOriginalMessage(), e);
        }
    }

    public ModifyResult modify(Path file, List<ModificationRequest> requests) throws IOException {
        validate(requests);

        String original = store.read(file);
        config.checkSize(original);
        Deadline deadline = config.newDeadline();

        boolean hadBom = ByteOrderMark.isPresent(original);
        Dialect dialect = DialectDetector.detectDialect(file);
        ParsedSource parsed = parser.parseTree(ByteOrderMark.strip(original), dialect);

        Path backupPath = writeBackup(file, original);

        List<String> applied = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            deadline.check();
            ModificationRequest request = requests.get(i);
            TreeEditor editor = new TreeEditor(parsed, parser, config.isRenameDeclarations(),
                    config.getIndentSize(), deadline);
            EditPlan plan = request.accept(editor);

            if (!plan.isMatched()) {
                String reason = request.typeName() + ": " + plan.getUnmatchedReason();
                if (config.getUnmatchedTargetPolicy() == UnmatchedTargetPolicy.FAIL) {
                    throw new UnmatchedTargetException("Request " + i + " (" + reason + ")");
                }
                log.warn("Skipping request {} on {}: {}", i, file, reason);
                applied.add("Skipped " + reason);
                continue;
            }

            String edited = EditApplier.apply(parsed.getSource(), plan.getEdits());
            parsed = reparse(edited, dialect, i, request);
            applied.add(plan.getDescription());
            log.debug("Request {} on {}: {}", i, file, plan.getDescription());
        }

        String result = ByteOrderMark.restore(parsed.getText(), hadBom);
        store.write(file, result);
        log.info("Applied {} modification(s) to {} (backup {})", applied.size(), file, backupPath);

        return new ModifyResult(applied, backupPath.toString(), original, result);
    }

    private static void validate(List<ModificationRequest> requests) {
        if (requests == null) {
            throw new InvalidModificationException("Modification list is null");
        }
        for (int i = 0; i < requests.size(); i++) {
            ModificationRequest request = requests.get(i);
            if (request == null) {
                throw new InvalidModificationException("Request " + i + " is null");
            }
            try {
                request.validate();
            } catch (InvalidModificationException e) {
                throw new InvalidModificationException("Request " + i + " (" + e.getMessage() + ")", e);
            }
        }
    }

    private Path writeBackup(Path file, String original) throws IOException {
        Path base = backupPolicy.backupPathFor(file, clock.instant());
        Path candidate = base;
        int suffix = 1;
        while (store.exists(candidate)) {
            candidate = base.resolveSibling(base.getFileName() + "." + suffix++);
        }
        store.writeNew(candidate, original);
        log.debug("Backed up {} to {}", file, candidate);
        return candidate;
    }

    private ParsedSource reparse(String edited, Dialect dialect, int index, ModificationRequest request) {
        try {
            return parser.parseTree(edited, dialect);
        } catch (ParseException e) {
            throw new InvalidModificationException("Request " + index + " (" + request.typeName()
                    + ") produced invalid source: " + e.getMessage(), e);
        }
    }
}
