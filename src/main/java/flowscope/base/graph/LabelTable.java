package flowscope.base.graph;

import java.util.*;

/**
 * Label text to the handles of the flow nodes a {@code goto} to that label
 * enters. Kept current while the builder rewrites nodes.
 */
public class LabelTable {
    private final Map<String, LinkedHashSet<Integer>> labelToHandles = new LinkedHashMap<>();

    public void bind(String label, int handle) {
        labelToHandles.computeIfAbsent(label, k -> new LinkedHashSet<>()).add(handle);
    }

    /**
     * Repoint every label entry naming {@code retired} at {@code replacements},
     * keeping the position of the retired handle in each entry.
     */
    public void replace(int retired, Collection<Integer> replacements) {
        for (var entry : labelToHandles.entrySet()) {
            var handles = entry.getValue();
            if (!handles.contains(retired)) {
                continue;
            }
            var updated = new LinkedHashSet<Integer>();
            for (var handle : handles) {
                if (handle == retired) {
                    updated.addAll(replacements);
                } else {
                    updated.add(handle);
                }
            }
            entry.setValue(updated);
        }
    }

    public Optional<Set<Integer>> targets(String label) {
        var handles = labelToHandles.get(label);
        return handles == null ? Optional.empty() : Optional.of(Collections.unmodifiableSet(handles));
    }

    public boolean contains(String label) {
        return labelToHandles.containsKey(label);
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(labelToHandles.keySet());
    }
}
