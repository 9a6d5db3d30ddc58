package com.scanforge.infrastructure.rendering;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects offset-based replacements on one source text and applies them in a single pass.
 * Edits must not overlap; insertions at the offset where a replacement starts land before it.
 */
final class SourceEdits {

    private record Edit(int start, int end, String text) {
    }

    private final String source;
    private final List<Edit> edits = new ArrayList<>();

    SourceEdits(String source) {
        this.source = source;
    }

    void replace(int start, int end, String text) {
        if (start < 0 || end > source.length() || start > end) {
            throw new RenderException("Edit range out of bounds: " + start + ".." + end);
        }
        edits.add(new Edit(start, end, text));
    }

    void insert(int offset, String text) {
        replace(offset, offset, text);
    }

    void delete(int start, int end) {
        replace(start, end, "");
    }

    /**
     * Applies all edits and returns the slice {@code [from, to)} of the edited text, where the bounds are
     * offsets in the original text.
     */
    String apply(int from, int to) {
        List<Edit> ordered = edits.stream()
                .filter(e -> e.start() >= from && e.end() <= to)
                .sorted(Comparator.comparingInt(Edit::start).reversed()
                        .thenComparing(Comparator.comparingInt((Edit e) -> e.end() - e.start()).reversed()))
                .toList();
        StringBuilder out = new StringBuilder(source.substring(from, to));
        int lastStart = Integer.MAX_VALUE;
        for (Edit edit : ordered) {
            if (edit.end() > lastStart) {
                throw new RenderException("Overlapping edits at offset " + edit.start());
            }
            out.replace(edit.start() - from, edit.end() - from, edit.text());
            lastStart = edit.start();
        }
        return out.toString();
    }

    String apply() {
        return apply(0, source.length());
    }

    /**
     * Offset of the first character of each 1-based line; index 0 is unused, index {@code n + 1} is the
     * source length.
     */
    static int[] lineOffsets(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        starts.add(source.length());
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
