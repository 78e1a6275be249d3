package com.permgroups;

import java.util.Collections;
import java.util.List;

/**
 * Every element of a group, sorted, paired with a word in the generators.
 * A word lists 1-based generator indices; composing the generators in that
 * order, left to right, yields the element.
 */
public final class ElementsAndWords {
    private final List<Perm> elements;
    private final List<List<Integer>> words;

    ElementsAndWords(List<Perm> elements, List<List<Integer>> words) {
        if (elements.size() != words.size())
            throw new IllegalArgumentException("elements and words differ in length");
        this.elements = Collections.unmodifiableList(elements);
        this.words = Collections.unmodifiableList(words);
    }

    public List<Perm> elements() { return elements; }
    public List<List<Integer>> words() { return words; }
    public int size() { return elements.size(); }

    /** Stored word of {@code g}, or null when {@code g} is not listed. */
    public List<Integer> wordOf(Perm g) {
        int at = Collections.binarySearch(elements, g);
        return at < 0 ? null : words.get(at);
    }
}
