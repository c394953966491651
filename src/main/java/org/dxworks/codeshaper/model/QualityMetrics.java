package org.dxworks.codeshaper.model;

import java.util.List;

public class QualityMetrics {
    public final int linesOfCode;
    public final int functionCount;
    public final int classCount;
    public final int complexity;
    public final int maintainability;
    public final ComplexityRating rating;
    public final List<QualityIssue> issues;

    public QualityMetrics(int linesOfCode, int functionCount, int classCount, int complexity,
                          int maintainability, ComplexityRating rating, List<QualityIssue> issues) {
        this.linesOfCode = linesOfCode;
        this.functionCount = functionCount;
        this.classCount = classCount;
        this.complexity = complexity;
        this.maintainability = maintainability;
        this.rating = rating;
        this.issues = List.copyOf(issues);
    }
}
