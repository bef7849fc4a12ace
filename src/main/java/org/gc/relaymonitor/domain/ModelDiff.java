package org.gc.relaymonitor.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelDiff {

    @Builder.Default
    private List<String> added = new ArrayList<>();

    @Builder.Default
    private List<String> removed = new ArrayList<>();

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }

    /**
     * Compares two model id snapshots, keeping the order in which ids appear.
     */
    public static ModelDiff between(Collection<String> previous, Collection<String> current) {
        Set<String> before = previous == null ? Set.of() : new LinkedHashSet<>(previous);
        Set<String> after = current == null ? Set.of() : new LinkedHashSet<>(current);

        List<String> added = after.stream().filter(id -> !before.contains(id)).toList();
        List<String> removed = before.stream().filter(id -> !after.contains(id)).toList();

        return ModelDiff.builder()
                .added(new ArrayList<>(added))
                .removed(new ArrayList<>(removed))
                .build();
    }
}
