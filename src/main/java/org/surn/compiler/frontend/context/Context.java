package org.surn.compiler.frontend.context;

/**
 * Per-file bookkeeping used while parsing: the source origin and a counter for node ids
 * that are unique within the file. A context belongs to a single compilation and is not
 * shared between threads.
 */
public class Context {

    private final ContextId id;
    private final SourceOrigin origin;
    private long localId = 0;

    /**
     * @param id The id assigned by the owning store.
     * @param origin The source this context describes.
     */
    public Context(ContextId id, SourceOrigin origin) {
        this.id = id;
        this.origin = origin;
    }

    /**
     * Allocates the next node id of this file. The first id is 1.
     * @return A fresh id.
     */
    public long nextLocalId() {
        return ++localId;
    }

    public ContextId getId() {
        return id;
    }

    public SourceOrigin getOrigin() {
        return origin;
    }
}
