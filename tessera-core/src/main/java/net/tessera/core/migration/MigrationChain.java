package net.tessera.core.migration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Linear, ordered list of migrations from {@link Migration#BASE} to head. */
public final class MigrationChain {

    private final List<Migration> steps;

    public MigrationChain(List<Migration> steps) {
        if (steps == null || steps.isEmpty()) throw new IllegalArgumentException("migration chain must not be empty");
        Set<String> seen = new HashSet<>();
        String previous = Migration.BASE;
        for (Migration m : steps) {
            if (!m.downRevision().equals(previous)) {
                throw new IllegalArgumentException("migration " + m.revision() + " follows " + m.downRevision()
                        + " but the chain is at " + previous);
            }
            if (!seen.add(m.revision()) || Migration.BASE.equals(m.revision())) {
                throw new IllegalArgumentException("duplicate revision " + m.revision());
            }
            previous = m.revision();
        }
        this.steps = List.copyOf(steps);
    }

    public static MigrationChain of(Migration... steps) {
        return new MigrationChain(List.of(steps));
    }

    public List<Migration> steps() { return steps; }

    public String head() { return steps.get(steps.size() - 1).revision(); }

    public boolean contains(String revision) {
        return Migration.BASE.equals(revision) || indexOf(revision) >= 0;
    }

    public Optional<Migration> find(String revision) {
        int i = indexOf(revision);
        return i < 0 ? Optional.empty() : Optional.of(steps.get(i));
    }

    /** Steps after {@code current}; every step when {@code current} is null or base. */
    public List<Migration> after(String current) {
        if (current == null || Migration.BASE.equals(current)) return steps;
        int i = requireIndex(current);
        return steps.subList(i + 1, steps.size());
    }

    /** Steps to undo, newest first, to go from {@code current} down to {@code target}. */
    public List<Migration> between(String target, String current) {
        int from = current == null || Migration.BASE.equals(current) ? -1 : requireIndex(current);
        int to = Migration.BASE.equals(target) ? -1 : requireIndex(target);
        if (to > from) throw new IllegalArgumentException("revision " + target + " is ahead of " + current);
        List<Migration> undo = new ArrayList<>(steps.subList(to + 1, from + 1));
        Collections.reverse(undo);
        return undo;
    }

    private int indexOf(String revision) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).revision().equals(revision)) return i;
        }
        return -1;
    }

    private int requireIndex(String revision) {
        int i = indexOf(revision);
        if (i < 0) throw new IllegalArgumentException("unknown revision " + revision);
        return i;
    }
}
