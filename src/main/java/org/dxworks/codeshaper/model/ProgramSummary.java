package org.dxworks.codeshaper.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattened view of one parsed file. Line numbers refer to the text that was parsed.
 */
public class ProgramSummary {
    public final List<ImportInfo> imports;
    public final List<ExportInfo> exports;
    public final List<FunctionInfo> functions;
    public final List<ClassInfo> classes;
    public final List<VariableInfo> variables;

    private ProgramSummary(Builder builder) {
        this.imports = List.copyOf(builder.imports);
        this.exports = List.copyOf(builder.exports);
        this.functions = List.copyOf(builder.functions);
        this.classes = List.copyOf(builder.classes);
        this.variables = List.copyOf(builder.variables);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<ImportInfo> imports = new ArrayList<>();
        private final List<ExportInfo> exports = new ArrayList<>();
        private final List<FunctionInfo> functions = new ArrayList<>();
        private final List<ClassInfo> classes = new ArrayList<>();
        private final List<VariableInfo> variables = new ArrayList<>();

        public Builder addImport(ImportInfo info) {
            imports.add(info);
            return this;
        }

        public Builder addExport(ExportInfo info) {
            exports.add(info);
            return this;
        }

        public Builder addFunction(FunctionInfo info) {
            functions.add(info);
            return this;
        }

        public Builder addClass(ClassInfo info) {
            classes.add(info);
            return this;
        }

        public Builder addVariable(VariableInfo info) {
            variables.add(info);
            return this;
        }

        public ProgramSummary build() {
            return new ProgramSummary(this);
        }
    }
}
