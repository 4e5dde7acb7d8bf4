package com.dish.curation.ranking;

import com.dish.curation.core.model.CuratedItem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A caller-owned, locally displayed copy of a fetched collection.
 *
 * <p>Entries changed speculatively by a {@link RankCommand} are tagged pending until
 * the gateway confirms or the change is undone.</p>
 */
public class ItemSnapshot {

    private final List<CuratedItem> items;
    private final Set<String> pending = new HashSet<>();

    public ItemSnapshot(List<CuratedItem> items) {
        this.items = new ArrayList<>(items);
    }

    public synchronized List<CuratedItem> items() {
        return List.copyOf(items);
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized Optional<CuratedItem> find(CuratedItem ref) {
        return items.stream().filter(i -> i.sameRecordAs(ref)).findFirst();
    }

    /**
     * Replaces the entry for the same record. Returns false when it is not in the snapshot.
     */
    public synchronized boolean replace(CuratedItem item) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).sameRecordAs(item)) {
                items.set(i, item);
                return true;
            }
        }
        return false;
    }

    public synchronized boolean isPending(CuratedItem item) {
        return pending.contains(key(item));
    }

    public synchronized boolean hasPending() {
        return !pending.isEmpty();
    }

    synchronized void markPending(CuratedItem item) {
        pending.add(key(item));
    }

    synchronized void settle(CuratedItem item) {
        pending.remove(key(item));
    }

    private static String key(CuratedItem item) {
        return item.getKind() + ":" + item.getId();
    }
}
