package com.videre.tracker.stream;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

/**
 * Walks a query page by page, fetching the next page only when the previous one is used up.
 *
 * <p>Each page is requested as "the next {@code pageSize} rows after this one" rather than by
 * offset, so rows committed while a client is still reading never shift later pages. The fetch
 * receives {@code null} for the first page. Each fetch is independent, so no transaction or
 * connection is held between items.
 */
public class KeysetIterable<T> implements Iterable<T> {

    private final BiFunction<T, Integer, List<T>> fetchAfter;
    private final int pageSize;

    public KeysetIterable(BiFunction<T, Integer, List<T>> fetchAfter, int pageSize) {
        this.fetchAfter = fetchAfter;
        this.pageSize = Math.max(1, pageSize);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private Iterator<T> current = Collections.emptyIterator();
            private T last;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                while (!current.hasNext()) {
                    if (exhausted) return false;
                    List<T> page = fetchAfter.apply(last, pageSize);
                    if (page == null || page.isEmpty()) {
                        exhausted = true;
                        return false;
                    }
                    exhausted = page.size() < pageSize;
                    current = page.iterator();
                }
                return true;
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException();
                last = current.next();
                return last;
            }
        };
    }
}
