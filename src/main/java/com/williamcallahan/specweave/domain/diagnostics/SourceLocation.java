package com.williamcallahan.specweave.domain.diagnostics;

/**
 * Position of a diagnostic in source text.
 *
 * @param file source file, or null for the root document when it has no path
 * @param line 1-based line
 * @param column 1-based column
 * @param offset 0-based character offset into the source text, or -1 when unknown
 */
public record SourceLocation(String file, int line, int column, int offset) {

    public SourceLocation {
        if (line < 1) {
            throw new IllegalArgumentException("Line must be 1 or greater");
        }
        if (column < 1) {
            throw new IllegalArgumentException("Column must be 1 or greater");
        }
    }

    /**
     * Returns a copy shifted by a position relative to this location.
     *
     * @param relativeLine 1-based line relative to this location
     * @param relativeColumn 1-based column relative to this location
     * @return shifted location; the offset becomes unknown
     */
    public SourceLocation shiftedBy(int relativeLine, int relativeColumn) {
        int shiftedLine = line + relativeLine - 1;
        int shiftedColumn = relativeLine == 1 ? column + relativeColumn - 1 : relativeColumn;
        return new SourceLocation(file, shiftedLine, shiftedColumn, -1);
    }

    @Override
    public String toString() {
        String prefix = file == null ? "" : file + ":";
        return prefix + line + ":" + column;
    }
}
