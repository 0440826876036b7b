package com.durableflow.core.repository;

import com.durableflow.core.model.Event;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy, restartable sequence of events read in pages.
 * Every call to {@link #iterator()} starts a fresh read from the original position.
 */
public final class EventSequence implements Iterable<Event> {

    private final long fromVersion;
    private final Function<Long, List<Event>> pageLoader;

    /**
     * @param fromVersion events with a sequence number greater than this are returned
     * @param pageLoader loads the next page of events after the given sequence number;
     *                   an empty page ends the sequence
     */
    public EventSequence(long fromVersion, Function<Long, List<Event>> pageLoader) {
        this.fromVersion = fromVersion;
        this.pageLoader = pageLoader;
    }

    @Override
    public Iterator<Event> iterator() {
        return new PagingIterator();
    }

    /**
     * Drain the sequence into a list.
     */
    public List<Event> toList() {
        List<Event> events = new ArrayList<>();
        forEach(events::add);
        return events;
    }

    private final class PagingIterator implements Iterator<Event> {
        private long position = fromVersion;
        private Iterator<Event> page = null;
        private boolean exhausted = false;

        @Override
        public boolean hasNext() {
            if (exhausted) {
                return false;
            }
            if (page == null || !page.hasNext()) {
                List<Event> next = pageLoader.apply(position);
                if (next.isEmpty()) {
                    exhausted = true;
                    return false;
                }
                page = next.iterator();
            }
            return true;
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Event event = page.next();
            position = event.sequenceNumber();
            return event;
        }
    }
}
