package org.shellgo.compiler.api;

/**
 * A pure data class representing a position in a shell script.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The script the construct was read from.
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /**
     * Placeholder for constructs that carry no position (e.g. synthetic nodes in tests).
     */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", -1, -1);

    @Override
    public String toString() {
        if (lineNumber < 0) {
            return fileName;
        }
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
