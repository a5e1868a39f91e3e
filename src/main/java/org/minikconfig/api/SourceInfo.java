package org.minikconfig.api;

/**
 * A pure data class representing a position in a configuration description file.
 *
 * @param fileName The file where the statement is located.
 * @param lineNumber The 1-based line number.
 */
public record SourceInfo(String fileName, int lineNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber;
    }
}
