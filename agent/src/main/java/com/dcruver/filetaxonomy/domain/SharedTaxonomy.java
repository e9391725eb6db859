package com.dcruver.filetaxonomy.domain;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Single-writer access to one {@link TaxonomyTree}.
 *
 * Readers run concurrently; every structural change (refinement, background recategorization,
 * approved suggestions, depth flattening) is serialized through {@link #write}. Callers must not
 * hand tree nodes out of a {@code read} block and mutate them later, and must not call the LLM
 * while holding either lock.
 */
public class SharedTaxonomy {

    private final TaxonomyTree tree;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public SharedTaxonomy(TaxonomyTree tree) {
        this.tree = tree;
    }

    public <T> T read(Function<TaxonomyTree, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(tree);
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Function<TaxonomyTree, T> writer) {
        lock.writeLock().lock();
        try {
            return writer.apply(tree);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void update(Consumer<TaxonomyTree> writer) {
        write(t -> {
            writer.accept(t);
            return null;
        });
    }
}
