package com.scanforge.infrastructure.rendering;

/**
 * Output of one render call.
 *
 * @param code               generated Python module
 * @param className          primary generated class
 * @param fragmentStartLine  first line (1-based) of the embedded detection fragment
 * @param fragmentEndLine    last line (1-based) of the embedded detection fragment
 */
public record RenderedArtifact(String code, String className, int fragmentStartLine, int fragmentEndLine) {

    public boolean isFragmentLine(int line) {
        return line >= fragmentStartLine && line <= fragmentEndLine;
    }
}
