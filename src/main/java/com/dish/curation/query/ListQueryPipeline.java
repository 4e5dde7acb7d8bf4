package com.dish.curation.query;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.metrics.CurationMetrics;
import com.dish.curation.metrics.NoOpCurationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Search, filter and sort over an already fetched list snapshot.
 *
 * <p>Stages run in that order and never modify their input; each returns a new list.
 * Search and filter are linear in the snapshot size, sort is O(n log n), so the
 * pipeline can be re-run on every (debounced) keystroke without re-fetching.</p>
 */
public class ListQueryPipeline {
    private static final Logger log = LoggerFactory.getLogger(ListQueryPipeline.class);

    private final CurationMetrics metrics;

    public ListQueryPipeline() {
        this(new NoOpCurationMetrics());
    }

    public ListQueryPipeline(CurationMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Runs all three stages.
     */
    public List<CuratedItem> run(List<CuratedItem> snapshot, ListQuery query) {
        long start = System.nanoTime();
        List<CuratedItem> searched = search(snapshot, query.getText(), query.getSearchFields());
        List<CuratedItem> filtered = filter(searched, query.getFilter());
        List<CuratedItem> sorted = sort(filtered, query.getSortKey());
        metrics.recordPipelineDuration(query.getSortKey(), Duration.ofNanos(System.nanoTime() - start));
        log.debug("pipeline.run input={} searched={} filtered={} sort={}",
                snapshot.size(), searched.size(), filtered.size(), query.getSortKey());
        return sorted;
    }

    /**
     * Keeps items where the text occurs, ignoring case, in any of the given fields.
     * Blank text keeps every item.
     */
    public List<CuratedItem> search(List<CuratedItem> items, String text, Collection<SearchField> fields) {
        if (text == null || text.isBlank()) {
            return List.copyOf(items);
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        List<CuratedItem> out = new ArrayList<>();
        for (CuratedItem item : items) {
            if (matches(item, needle, fields)) {
                out.add(item);
            }
        }
        return List.copyOf(out);
    }

    public List<CuratedItem> filter(List<CuratedItem> items, ItemFilter filter) {
        if (filter.isEmpty()) {
            return List.copyOf(items);
        }
        return items.stream().filter(filter).toList();
    }

    public List<CuratedItem> sort(List<CuratedItem> items, SortKey sortKey) {
        List<CuratedItem> copy = new ArrayList<>(items);
        copy.sort(sortKey.comparator());
        return List.copyOf(copy);
    }

    private static boolean matches(CuratedItem item, String needle, Collection<SearchField> fields) {
        if (contains(SearchField.NAME.valuesOf(item), needle)) {
            return true;
        }
        for (SearchField field : fields) {
            if (field != SearchField.NAME && contains(field.valuesOf(item), needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(List<String> values, String needle) {
        for (String value : values) {
            if (value != null && value.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
