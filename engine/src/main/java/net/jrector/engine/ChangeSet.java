package net.jrector.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * The outcomes of all files of a run, ordered by path. Files may be added from several threads.
 */
public final class ChangeSet {
    private final Map<String, FileChange> changes = new ConcurrentSkipListMap<>();

    public void add(FileChange change) {
        if (changes.putIfAbsent(change.path(), change) != null) {
            throw new IllegalStateException("File " + change.path() + " was processed twice");
        }
    }

    public Optional<FileChange> get(String path) {
        return Optional.ofNullable(changes.get(path));
    }

    /**
     * All outcomes, sorted by path.
     */
    public Collection<FileChange> changes() {
        return new ArrayList<>(changes.values());
    }

    public int size() {
        return changes.size();
    }

    public long count(FileStatus status) {
        return changes.values().stream().filter(change -> change.status() == status).count();
    }

    public boolean hasChanges() {
        return count(FileStatus.CHANGED) > 0;
    }

    public boolean hasErrors() {
        return count(FileStatus.ERRORED) > 0;
    }

    /**
     * One line per file with its status, followed by the totals.
     */
    public String summary() {
        var builder = new StringBuilder();
        var totals = new EnumMap<FileStatus, Integer>(FileStatus.class);
        for (var change : changes.values()) {
            builder.append(String.format("%-9s %s", change.status(), change.path()));
            if (change.error() != null) {
                builder.append(": ").append(change.error());
            }
            builder.append('\n');
            for (var warning : change.warnings()) {
                builder.append("          warning: ").append(warning).append('\n');
            }
            totals.merge(change.status(), 1, Integer::sum);
        }
        builder.append(changes.size()).append(" files: ");
        var first = true;
        for (var status : FileStatus.values()) {
            if (!first) {
                builder.append(", ");
            }
            first = false;
            builder.append(totals.getOrDefault(status, 0)).append(' ').append(status.name().toLowerCase(Locale.ROOT));
        }
        return builder.toString();
    }
}
