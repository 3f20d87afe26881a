package app.herbaria.provenance.service;

import app.herbaria.provenance.config.ExportProps;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.index.SpecimenIndex;
import app.herbaria.provenance.lineage.LineageView;
import app.herbaria.provenance.lineage.ProvenanceTracker;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable sequence of (record, provenance) pairs for archive builders.
 *
 * <p>Specimens are walked in identity order with keyset pages, so a consumer that stops can
 * resume from the last cursor it saw without skipping or repeating specimens.
 */
@Service
public class SpecimenExportService {

    private static final int MAX_SLICE = 1000;

    private final SpecimenIndex index;
    private final ProvenanceTracker tracker;
    private final int pageSize;

    public SpecimenExportService(SpecimenIndex index, ProvenanceTracker tracker, ExportProps props) {
        this.index = index;
        this.tracker = tracker;
        this.pageSize = props.pageSize();
    }

    public Stream<ExportItem> export(SpecimenFilter filter, String afterCursor) {
        Iterator<ExportItem> it = new ExportIterator(filter == null ? SpecimenFilter.all() : filter, afterCursor);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL),
                false
        );
    }

    public ExportPage slice(SpecimenFilter filter, String afterCursor, int limit) {
        if (limit < 1 || limit > MAX_SLICE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_SLICE);
        }
        List<ExportItem> items;
        try (Stream<ExportItem> stream = export(filter, afterCursor)) {
            items = stream.limit(limit + 1L).toList();
        }
        if (items.size() <= limit) {
            return new ExportPage(items, null);
        }
        List<ExportItem> page = items.subList(0, limit);
        return new ExportPage(page, page.get(page.size() - 1).cursor());
    }

    private final class ExportIterator implements Iterator<ExportItem> {

        private final SpecimenFilter filter;
        private final Deque<String> buffer = new ArrayDeque<>();
        private String cursor;
        private boolean exhausted;
        private ExportItem next;

        private ExportIterator(SpecimenFilter filter, String afterCursor) {
            this.filter = filter;
            this.cursor = afterCursor;
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (buffer.isEmpty()) {
                    if (exhausted) {
                        return false;
                    }
                    fill();
                    continue;
                }
                String identity = buffer.pollFirst();
                LineageView view = tracker.lineage(identity).orElse(null);
                if (view != null) {
                    next = new ExportItem(identity, view.record(), view);
                }
            }
            return true;
        }

        @Override
        public ExportItem next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ExportItem item = next;
            next = null;
            return item;
        }

        private void fill() {
            List<String> identities = new ArrayList<>(index.listIdentitiesAfter(cursor, filter, pageSize));
            if (identities.size() < pageSize) {
                exhausted = true;
            }
            if (!identities.isEmpty()) {
                cursor = identities.get(identities.size() - 1);
                buffer.addAll(identities);
            }
        }
    }
}
