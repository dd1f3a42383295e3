package com.example.coa.application.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs two independently recovered sequences by index: the k-th label takes the k-th value for every
 * {@code k < min(labels, values)}. Labels without a value and values without a label are reported, not paired.
 */
public final class PositionalAlignment {

    private PositionalAlignment() {
    }

    public static Alignment pairByIndex(List<String> labels, List<String> values) {
        int paired = Math.min(labels.size(), values.size());
        List<LabelValue> pairs = new ArrayList<>(paired);
        for (int index = 0; index < paired; index++) {
            pairs.add(new LabelValue(labels.get(index), values.get(index)));
        }
        return new Alignment(
                pairs,
                List.copyOf(labels.subList(paired, labels.size())),
                List.copyOf(values.subList(paired, values.size())));
    }

    public record LabelValue(String label, String value) {
    }

	/**
	 * @param pairs            labels matched with a value, in order
	 * @param unmatchedLabels  tail labels for which no value was recovered
	 * @param surplusValues    tail values for which no label exists
	 */
    public record Alignment(List<LabelValue> pairs, List<String> unmatchedLabels, List<String> surplusValues) {

        public Alignment {
            pairs = List.copyOf(pairs);
        }
    }
}
