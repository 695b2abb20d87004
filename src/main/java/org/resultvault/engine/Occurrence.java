package org.resultvault.engine;

import java.util.Comparator;
import java.util.Objects;

/**
 * One place a fingerprint was reported from: the compilation unit that produced it and the location it points to.
 */
public record Occurrence(String compilationUnit, String filePath, int line, int column) {
    public static final Comparator<Occurrence> ORDER = Comparator.comparing(Occurrence::compilationUnit)
            .thenComparing(Occurrence::filePath)
            .thenComparingInt(Occurrence::line)
            .thenComparingInt(Occurrence::column);

    public Occurrence {
        Objects.requireNonNull(compilationUnit, "compilationUnit");
        Objects.requireNonNull(filePath, "filePath");
    }
}
