package dev.juridica.rag.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splits text along an ordered hierarchy of separators. The first separator
 * found in the text is used; pieces that are still too long are split again
 * with the remaining separators. Separators stay attached to the start of the
 * following piece so that no character is lost.
 */
final class RecursiveTextSplitter {

    private final List<String> separators;
    private final int chunkSize;
    private final int chunkOverlap;

    RecursiveTextSplitter(List<String> separators, int chunkSize, int chunkOverlap) {
        if (separators.isEmpty()) {
            throw new IllegalArgumentException("at least one separator is required");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be between 0 and chunkSize");
        }
        this.separators = List.copyOf(separators);
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    List<String> split(String text) {
        return splitText(text, separators);
    }

    private List<String> splitText(String text, List<String> candidates) {
        String separator = candidates.get(candidates.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                remaining = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        List<String> chunks = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                chunks.addAll(mergeSplits(fitting));
                fitting.clear();
            }
            if (remaining.isEmpty()) {
                chunks.add(piece);
            } else {
                chunks.addAll(splitText(piece, remaining));
            }
        }
        if (!fitting.isEmpty()) {
            chunks.addAll(mergeSplits(fitting));
        }
        return chunks;
    }

    static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        int from = 0;
        int index = text.indexOf(separator);
        while (index >= 0) {
            if (index > from) {
                pieces.add(text.substring(from, index));
            }
            from = index;
            index = text.indexOf(separator, index + separator.length());
        }
        if (from < text.length()) {
            pieces.add(text.substring(from));
        }
        return pieces;
    }

    private List<String> mergeSplits(List<String> splits) {
        List<String> merged = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;
        for (String split : splits) {
            int length = split.length();
            if (total + length > chunkSize && !window.isEmpty()) {
                addIfNotBlank(merged, String.join("", window));
                while (total > chunkOverlap || (total + length > chunkSize && total > 0)) {
                    total -= window.removeFirst().length();
                }
            }
            window.addLast(split);
            total += length;
        }
        addIfNotBlank(merged, String.join("", window));
        return merged;
    }

    private static void addIfNotBlank(List<String> target, String text) {
        if (!text.isBlank()) {
            target.add(text);
        }
    }
}
