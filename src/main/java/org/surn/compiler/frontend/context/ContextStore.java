package org.surn.compiler.frontend.context;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the contexts of one compiler run. Contexts live in an arena indexed by {@link ContextId};
 * ids are handed out densely and never reused, and removing a context leaves an empty slot behind.
 * <p>
 * The store is single-writer: a multi-file build compiling in parallel must guard
 * {@link #create(SourceOrigin)} and {@link #remove(ContextId)} externally.
 */
public class ContextStore {

    private final List<Context> contexts = new ArrayList<>();

    /**
     * Creates and registers a context for a source.
     * @param origin The source the context describes.
     * @return The new context.
     */
    public Context create(SourceOrigin origin) {
        Objects.requireNonNull(origin, "origin");
        Context context = new Context(nextContextId(), origin);
        contexts.add(context);
        return context;
    }

    /**
     * @param id A context id.
     * @return The live context with that id.
     * @throws NoSuchElementException if the id was never handed out or its context was removed.
     */
    public Context get(ContextId id) {
        return find(id).orElseThrow(() -> new NoSuchElementException("No live context with id " + id));
    }

    /**
     * @param id A context id.
     * @return The live context with that id, or empty.
     */
    public Optional<Context> find(ContextId id) {
        if (id.value() >= contexts.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(contexts.get(id.value()));
    }

    /**
     * Looks up a live context by the name of its source.
     * @param name A file path or virtual source name.
     * @return The first live context for that source, or empty.
     */
    public Optional<Context> findByName(String name) {
        return contexts.stream()
                .filter(Objects::nonNull)
                .filter(context -> context.getOrigin().getName().equals(name))
                .findFirst();
    }

    /**
     * Removes a context, leaving its slot empty.
     * @param id The context to remove.
     * @return {@code true} if a live context was removed.
     */
    public boolean remove(ContextId id) {
        if (find(id).isEmpty()) {
            return false;
        }
        contexts.set(id.value(), null);
        return true;
    }

    /**
     * @return The id the next created context will get.
     */
    public ContextId nextContextId() {
        return new ContextId(contexts.size());
    }

    /**
     * @return The number of ids handed out, removed contexts included.
     */
    public int size() {
        return contexts.size();
    }

    /**
     * @return The number of contexts not removed yet.
     */
    public int liveCount() {
        return (int) contexts.stream().filter(Objects::nonNull).count();
    }
}
