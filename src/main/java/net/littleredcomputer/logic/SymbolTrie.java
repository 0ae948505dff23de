package net.littleredcomputer.logic;

import java.util.HashMap;
import java.util.Map;

/**
 * Character trie over the symbolic tokens, used to find the longest symbol starting at a
 * given position of the input.
 */
final class SymbolTrie {
    private final Map<Character, SymbolTrie> children = new HashMap<>();
    private boolean leaf = false;

    SymbolTrie(Iterable<String> symbols) {
        for (String s : symbols) insert(s);
    }

    private SymbolTrie() {}

    private void insert(String s) {
        SymbolTrie node = this;
        for (int i = 0; i < s.length(); ++i) node = node.children.computeIfAbsent(s.charAt(i), c -> new SymbolTrie());
        node.leaf = true;
    }

    /**
     * @return the length of the longest symbol that is a prefix of {@code s.substring(start)},
     * or 0 if there is none
     */
    int longestMatch(CharSequence s, int start) {
        int best = 0;
        SymbolTrie node = this;
        for (int i = start; i < s.length(); ++i) {
            node = node.children.get(s.charAt(i));
            if (node == null) break;
            if (node.leaf) best = i - start + 1;
        }
        return best;
    }
}
