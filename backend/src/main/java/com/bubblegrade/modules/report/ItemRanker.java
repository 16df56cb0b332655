package com.bubblegrade.modules.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks questions by percentage correct, highest first. Questions with equal
 * percentages share a label such as {@code "2-3"} and the same candidate rank
 * numbers; the next group continues after the shared range.
 */
public final class ItemRanker {

    private ItemRanker() {
    }

    public record Rank(String label, List<Integer> numbers) {

        public Rank {
            numbers = List.copyOf(numbers);
        }
    }

    public record Entry(int questionNumber, double percentage) {
    }

    /** Rank of every entry keyed by question number. */
    public static Map<Integer, Rank> rank(List<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingDouble(Entry::percentage).reversed()
                .thenComparingInt(Entry::questionNumber));

        Map<Integer, Rank> ranks = new HashMap<>();
        int i = 0;
        while (i < sorted.size()) {
            int j = i + 1;
            while (j < sorted.size() && Double.compare(sorted.get(j).percentage(), sorted.get(i).percentage()) == 0) {
                j++;
            }
            int start = i + 1;
            int end = j;
            List<Integer> numbers = new ArrayList<>(end - start + 1);
            for (int r = start; r <= end; r++) {
                numbers.add(r);
            }
            Rank rank = new Rank(start == end ? String.valueOf(start) : start + "-" + end, numbers);
            for (int k = i; k < j; k++) {
                ranks.put(sorted.get(k).questionNumber(), rank);
            }
            i = j;
        }
        return ranks;
    }
}
