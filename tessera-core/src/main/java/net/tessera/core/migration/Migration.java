package net.tessera.core.migration;

import java.util.Objects;

/**
 * One reversible schema step. {@code downRevision} is the revision the step starts from,
 * {@link #BASE} for the first step of a chain.
 *
 * <p>An optional step may stay pending indefinitely: storages keep working against the older shape
 * and only use the added columns once the step has been applied.
 */
public final class Migration {
    public static final String BASE = "base";

    @FunctionalInterface
    public interface Action {
        void apply() throws Exception;
    }

    private final String revision;
    private final String downRevision;
    private final String description;
    private final boolean optional;
    private final Action up;
    private final Action down;

    private Migration(Builder b) {
        this.revision = Objects.requireNonNull(b.revision, "revision");
        this.downRevision = Objects.requireNonNull(b.downRevision, "downRevision");
        this.description = b.description == null ? revision : b.description;
        this.optional = b.optional;
        this.up = Objects.requireNonNull(b.up, "up action of " + b.revision);
        this.down = Objects.requireNonNull(b.down, "down action of " + b.revision);
    }

    public static Builder builder(String revision, String downRevision) {
        return new Builder(revision, downRevision);
    }

    public String revision() { return revision; }

    public String downRevision() { return downRevision; }

    public String description() { return description; }

    public boolean optional() { return optional; }

    public void up() throws Exception { up.apply(); }

    public void down() throws Exception { down.apply(); }

    @Override
    public String toString() {
        return revision + (optional ? " (optional)" : "") + ": " + description;
    }

    public static final class Builder {
        private final String revision;
        private final String downRevision;
        private String description;
        private boolean optional;
        private Action up;
        private Action down;

        private Builder(String revision, String downRevision) {
            this.revision = revision;
            this.downRevision = downRevision;
        }

        public Builder description(String description) { this.description = description; return this; }

        public Builder optional() { this.optional = true; return this; }

        public Builder up(Action up) { this.up = up; return this; }

        public Builder down(Action down) { this.down = down; return this; }

        public Migration build() { return new Migration(this); }
    }
}
