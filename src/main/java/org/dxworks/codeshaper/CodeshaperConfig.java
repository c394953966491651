package org.dxworks.codeshaper;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codeshaper.modify.UnmatchedTargetPolicy;
import org.dxworks.codeshaper.parser.DeclarationScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CodeshaperConfig {

    private static final Logger log = LoggerFactory.getLogger(CodeshaperConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_MAX_SOURCE_BYTES = 2 * 1024 * 1024;
    private static final long DEFAULT_TIMEOUT_MILLIS = 10_000L;
    private static final int DEFAULT_INDENT_SIZE = 2;
    private static final String CONFIG_FILE_NAME = "codeshaper-config.yml";

    private final int maxFileLines;
    private final int maxSourceBytes;
    private final long timeoutMillis;
    private final DeclarationScope declarationScope;
    private final UnmatchedTargetPolicy unmatchedTargetPolicy;
    private final boolean renameDeclarations;
    private final int indentSize;

    private CodeshaperConfig(int maxFileLines, int maxSourceBytes, long timeoutMillis,
                             DeclarationScope declarationScope, UnmatchedTargetPolicy unmatchedTargetPolicy,
                             boolean renameDeclarations, int indentSize) {
        this.maxFileLines = maxFileLines;
        this.maxSourceBytes = maxSourceBytes;
        this.timeoutMillis = timeoutMillis;
        this.declarationScope = declarationScope;
        this.unmatchedTargetPolicy = unmatchedTargetPolicy;
        this.renameDeclarations = renameDeclarations;
        this.indentSize = indentSize;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getMaxSourceBytes() {
        return maxSourceBytes;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public DeclarationScope getDeclarationScope() {
        return declarationScope;
    }

    public UnmatchedTargetPolicy getUnmatchedTargetPolicy() {
        return unmatchedTargetPolicy;
    }

    public boolean isRenameDeclarations() {
        return renameDeclarations;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public static CodeshaperConfig defaults() {
        return new CodeshaperConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_MAX_SOURCE_BYTES, DEFAULT_TIMEOUT_MILLIS,
                DeclarationScope.MODULE, UnmatchedTargetPolicy.FAIL, false, DEFAULT_INDENT_SIZE);
    }

    public static CodeshaperConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodeshaperConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable configuration {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    private static CodeshaperConfig fromYaml(YamlConfig yaml) {
        int effectiveMaxFileLines = (yaml.maxFileLines != null && yaml.maxFileLines > 0)
                ? yaml.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxSourceBytes = (yaml.maxSourceBytes != null && yaml.maxSourceBytes > 0)
                ? yaml.maxSourceBytes
                : DEFAULT_MAX_SOURCE_BYTES;
        long effectiveTimeout = (yaml.timeoutMillis != null && yaml.timeoutMillis >= 0)
                ? yaml.timeoutMillis
                : DEFAULT_TIMEOUT_MILLIS;
        DeclarationScope effectiveScope = yaml.declarationScope != null
                ? yaml.declarationScope
                : DeclarationScope.MODULE;
        UnmatchedTargetPolicy effectivePolicy = yaml.unmatchedTargetPolicy != null
                ? yaml.unmatchedTargetPolicy
                : UnmatchedTargetPolicy.FAIL;
        boolean effectiveRenameDeclarations = yaml.renameDeclarations != null && yaml.renameDeclarations;
        int effectiveIndent = (yaml.indentSize != null && yaml.indentSize > 0)
                ? yaml.indentSize
                : DEFAULT_INDENT_SIZE;

        return new CodeshaperConfig(effectiveMaxFileLines, effectiveMaxSourceBytes, effectiveTimeout,
                effectiveScope, effectivePolicy, effectiveRenameDeclarations, effectiveIndent);
    }

    public CodeshaperConfig withUnmatchedTargetPolicy(UnmatchedTargetPolicy policy) {
        return new CodeshaperConfig(maxFileLines, maxSourceBytes, timeoutMillis, declarationScope,
                policy, renameDeclarations, indentSize);
    }

    public CodeshaperConfig withDeclarationScope(DeclarationScope scope) {
        return new CodeshaperConfig(maxFileLines, maxSourceBytes, timeoutMillis, scope,
                unmatchedTargetPolicy, renameDeclarations, indentSize);
    }

    public CodeshaperConfig withRenameDeclarations(boolean rename) {
        return new CodeshaperConfig(maxFileLines, maxSourceBytes, timeoutMillis, declarationScope,
                unmatchedTargetPolicy, rename, indentSize);
    }

    public CodeshaperConfig withLimits(int maxFileLines, int maxSourceBytes, long timeoutMillis) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveMaxSourceBytes = maxSourceBytes > 0 ? maxSourceBytes : DEFAULT_MAX_SOURCE_BYTES;
        return new CodeshaperConfig(effectiveMaxFileLines, effectiveMaxSourceBytes, timeoutMillis,
                declarationScope, unmatchedTargetPolicy, renameDeclarations, indentSize);
    }

    /**
     * Rejects sources above the configured size before any parsing happens.
     */
    public void checkSize(String sourceCode) {
        int bytes = sourceCode.getBytes(java.nio.charset.StandardCharsets.UTF_8).length;
        if (bytes > maxSourceBytes) {
            throw new LimitExceededException("Source has " + bytes + " bytes, limit is " + maxSourceBytes);
        }
        long lines = sourceCode.chars().filter(c -> c == '\n').count() + 1;
        if (lines > maxFileLines) {
            throw new LimitExceededException("Source has " + lines + " lines, limit is " + maxFileLines);
        }
    }

    public Deadline newDeadline() {
        return Deadline.afterMillis(timeoutMillis);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer maxSourceBytes;
        public Long timeoutMillis;
        public DeclarationScope declarationScope;
        public UnmatchedTargetPolicy unmatchedTargetPolicy;
        public Boolean renameDeclarations;
        public Integer indentSize;
    }
}
