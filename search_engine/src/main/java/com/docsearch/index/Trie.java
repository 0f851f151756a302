package com.docsearch.index;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prefix tree over normalized terms. Nodes live in an arena and are addressed
 * by index; the root is always node {@value #ROOT}. Terminal nodes own a
 * {@link PostingsList}.
 *
 * <p>Not thread-safe. Callers serialize mutation.
 */
public final class Trie {

    public static final int ROOT = 0;
    public static final int NONE = -1;

    private final List<Node> nodes = new ArrayList<>();
    private int termCount;

    public Trie() {
        nodes.add(new Node());
    }

    /**
     * Records one occurrence of {@code term} in {@code docId}, creating the
     * path as needed.
     */
    public Insertion insert(String term, int docId) {
        requireTerm(term);

        int current = ROOT;
        for (int i = 0; i < term.length(); i++) {
            char c = term.charAt(i);
            Node node = nodes.get(current);
            Integer next = node.children.get(c);
            if (next == null) {
                next = nodes.size();
                nodes.add(new Node());
                node.children.put(c, next);
            }
            current = next;
        }

        Node terminal = nodes.get(current);
        boolean newTerm = !terminal.terminal;
        if (newTerm) {
            terminal.terminal = true;
            terminal.postings = new PostingsList();
            termCount++;
        }
        terminal.postings.record(docId);
        return new Insertion(current, newTerm);
    }

    /**
     * @return the terminal node for {@code term}, or {@link #NONE}
     */
    public int lookup(String term) {
        if (term == null || term.isEmpty()) return NONE;

        int node = walk(term);
        if (node == NONE || !nodes.get(node).terminal) return NONE;
        return node;
    }

    /**
     * Postings of a terminal node; {@code null} for non-terminal nodes.
     */
    public PostingsList postings(int node) {
        if (node < 0 || node >= nodes.size()) {
            throw new IllegalArgumentException("no such trie node: " + node);
        }
        return nodes.get(node).postings;
    }

    /**
     * Every term below {@code prefix} (the prefix itself included when it is a
     * term) with its postings. Unordered. Empty when no term starts with
     * {@code prefix}.
     */
    public List<TermPostings> collectWithPrefix(String prefix) {
        String start = prefix == null ? "" : prefix;
        int from = walk(start);
        if (from == NONE) return List.of();

        List<TermPostings> out = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(from, start));

        while (!stack.isEmpty()) {
            Frame f = stack.pop();
            Node node = nodes.get(f.node);
            if (node.terminal) {
                out.add(new TermPostings(f.word, node.postings));
            }
            for (Map.Entry<Character, Integer> child : node.children.descendingMap().entrySet()) {
                stack.push(new Frame(child.getValue(), f.word + child.getKey()));
            }
        }
        return out;
    }

    public List<TermPostings> allTerms() {
        return collectWithPrefix("");
    }

    public int termCount() {
        return termCount;
    }

    public int nodeCount() {
        return nodes.size();
    }

    private int walk(String path) {
        int current = ROOT;
        for (int i = 0; i < path.length(); i++) {
            Integer next = nodes.get(current).children.get(path.charAt(i));
            if (next == null) return NONE;
            current = next;
        }
        return current;
    }

    private static void requireTerm(String term) {
        if (term == null || term.isEmpty()) {
            throw new IllegalArgumentException("term must not be empty");
        }
    }

    public record Insertion(int node, boolean newTerm) {}

    public record TermPostings(String term, PostingsList postings) {}

    private record Frame(int node, String word) {}

    private static final class Node {
        // sorted so traversal output is reproducible
        final TreeMap<Character, Integer> children = new TreeMap<>();
        boolean terminal;
        PostingsList postings;
    }
}
