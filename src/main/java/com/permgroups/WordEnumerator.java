package com.permgroups;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists all elements of {@code <gens>} with short words, independently of any
 * stabilizer chain. The subgroup {@code <gens[1..i]>} is grown one generator
 * at a time: right coset representatives of the previous subgroup are found
 * breadth first, so representative words never get shorter in discovery order.
 */
final class WordEnumerator {
    private static final Logger LOG = LoggerFactory.getLogger(WordEnumerator.class);

    private WordEnumerator() {}

    static ElementsAndWords enumerate(List<Perm> gens) {
        List<Perm> elements = new ArrayList<>();
        List<List<Integer>> words = new ArrayList<>();
        elements.add(Perm.IDENTITY);
        words.add(List.of());

        for (int i = 1; i <= gens.size(); i++) {
            List<Perm> reps = new ArrayList<>();
            List<List<Integer>> repWords = new ArrayList<>();
            reps.add(Perm.IDENTITY);
            repWords.add(List.of());

            List<Perm> grown = new ArrayList<>(elements);
            List<List<Integer>> grownWords = new ArrayList<>(words);
            Set<Perm> seen = new HashSet<>(elements);

            for (int j = 0; j < reps.size(); j++) {
                for (int k = 1; k <= i; k++) {
                    Perm e = reps.get(j).multiply(gens.get(k - 1));
                    if (seen.contains(e)) continue;
                    List<Integer> we = append(repWords.get(j), k);
                    reps.add(e);
                    repWords.add(we);
                    for (int x = 0; x < elements.size(); x++) {
                        Perm g = elements.get(x).multiply(e);
                        grown.add(g);
                        grownWords.add(concat(words.get(x), we));
                        seen.add(g);
                    }
                }
            }
            elements = grown;
            words = grownWords;
            LOG.debug("Word enumeration: |elements|={} after generator {}", elements.size(), i);
        }

        Integer[] idx = new Integer[elements.size()];
        for (int x = 0; x < idx.length; x++) idx[x] = x;
        final List<Perm> unsorted = elements;
        Arrays.sort(idx, (a, b) -> unsorted.get(a).compareTo(unsorted.get(b)));
        List<Perm> sortedElements = new ArrayList<>(idx.length);
        List<List<Integer>> sortedWords = new ArrayList<>(idx.length);
        for (int x : idx) {
            sortedElements.add(elements.get(x));
            sortedWords.add(words.get(x));
        }
        return new ElementsAndWords(sortedElements, sortedWords);
    }

    private static List<Integer> append(List<Integer> w, int k) {
        List<Integer> out = new ArrayList<>(w.size() + 1);
        out.addAll(w);
        out.add(k);
        return Collections.unmodifiableList(out);
    }

    private static List<Integer> concat(List<Integer> a, List<Integer> b) {
        if (a.isEmpty()) return b;
        List<Integer> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return Collections.unmodifiableList(out);
    }
}
