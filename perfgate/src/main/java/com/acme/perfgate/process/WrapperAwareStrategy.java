package com.acme.perfgate.process;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Walks through launcher shells and affinity wrappers towards the subject binary.
 *
 * <p>A process named like the target stops the walk. A wrapper descends to its children,
 * ranked as: children named like the target, then children that are not wrappers, then the
 * remaining children. Anything else, an unreadable name or a childless wrapper stops the
 * walk at the current process.</p>
 */
public final class WrapperAwareStrategy implements ResolutionStrategy {
    public static final Set<String> DEFAULT_WRAPPERS = Set.of("bash", "sh", "taskset");

    private final String targetName;
    private final Set<String> wrapperNames;

    public WrapperAwareStrategy(String targetName) {
        this(targetName, DEFAULT_WRAPPERS);
    }

    public WrapperAwareStrategy(String targetName, Set<String> wrapperNames) {
        this.targetName = Objects.requireNonNull(targetName, "targetName");
        this.wrapperNames = Set.copyOf(wrapperNames);
    }

    @Override
    public ResolutionStep step(ProcessDescriptor current, ProcessTable table) {
        if (!current.nameReadable()
            || targetName.equals(current.name())
            || !wrapperNames.contains(current.name())) {
            return new ResolutionStep.Target(current.pid());
        }
        List<Long> children = table.children(current.pid());
        if (children.isEmpty()) {
            return new ResolutionStep.Target(current.pid());
        }
        Set<Long> ranked = new LinkedHashSet<>();
        List<Long> nonWrappers = new ArrayList<>();
        for (long child : children) {
            String childName = table.name(child).orElse(null);
            if (targetName.equals(childName)) {
                ranked.add(child);
            } else if (childName != null && !wrapperNames.contains(childName)) {
                nonWrappers.add(child);
            }
        }
        ranked.addAll(nonWrappers);
        ranked.addAll(children);
        return new ResolutionStep.Descend(new ArrayList<>(ranked));
    }
}
