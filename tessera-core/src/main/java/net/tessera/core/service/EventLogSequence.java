package net.tessera.core.service;

import net.tessera.core.error.TesseraException;
import net.tessera.core.model.EventLogEntry;
import net.tessera.core.model.EventLogRecord;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy view of one run's log after a cursor, fetched page by page in {@code log_id} order.
 * Every {@link #iterator()} starts again from the cursor, so the sequence can be replayed.
 */
public final class EventLogSequence implements Iterable<EventLogRecord> {

    @FunctionalInterface
    interface PageSource {
        List<EventLogRecord> page(long afterLogId, int limit) throws Exception;
    }

    private final String runId;
    private final long cursor;
    private final int pageSize;
    private final PageSource source;

    EventLogSequence(String runId, long cursor, int pageSize, PageSource source) {
        this.runId = runId;
        this.cursor = cursor;
        this.pageSize = pageSize;
        this.source = source;
    }

    public String runId() { return runId; }

    public long cursor() { return cursor; }

    public int pageSize() { return pageSize; }

    @Override
    public Iterator<EventLogRecord> iterator() {
        return new PagingIterator();
    }

    public List<EventLogRecord> toList() {
        List<EventLogRecord> all = new ArrayList<>();
        forEach(all::add);
        return all;
    }

    public List<EventLogEntry> entries() {
        return toList().stream().map(EventLogRecord::entry).toList();
    }

    private final class PagingIterator implements Iterator<EventLogRecord> {
        private long after = cursor;
        private Iterator<EventLogRecord> page = List.<EventLogRecord>of().iterator();
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (page.hasNext()) return true;
            if (exhausted) return false;
            List<EventLogRecord> next;
            try {
                next = source.page(after, pageSize);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new TesseraException("Failed to read events of run " + runId + " after " + after, e);
            }
            if (next.size() < pageSize) exhausted = true;
            page = next.iterator();
            return page.hasNext();
        }

        @Override
        public EventLogRecord next() {
            if (!hasNext()) throw new NoSuchElementException();
            EventLogRecord r = page.next();
            after = r.logId();
            return r;
        }
    }
}
