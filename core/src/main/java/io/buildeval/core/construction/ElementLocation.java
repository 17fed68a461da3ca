package io.buildeval.core.construction;

import java.io.Serializable;

/**
 * Source position of a project element.
 *
 * @param file   full path of the containing file, never null
 * @param line   1-based line, 0 when unknown
 * @param column 1-based column, 0 when unknown
 */
public record ElementLocation(String file, int line, int column) implements Serializable {

    /** Location for a whole file, with no line information. */
    public static ElementLocation ofFile(String file) {
        return new ElementLocation(file, 0, 0);
    }

    @Override
    public String toString() {
        if (line == 0) {
            return file;
        }
        return file + "(" + line + "," + column + ")";
    }
}
