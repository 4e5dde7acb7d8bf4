package com.dish.curation.gateway;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.DishRestaurantLink;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkPair;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.Municipality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link RemoteDataGateway}.
 * Suitable for testing and single-JVM deployments.
 *
 * <p>Link creation ignores existing pairs and link deletion ignores missing pairs,
 * matching the insert-ignore semantics of the SQL store.</p>
 */
public class InMemoryDataGateway implements RemoteDataGateway {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDataGateway.class);

    private final ConcurrentMap<ItemKey, CuratedItem> items = new ConcurrentHashMap<>();
    private final ConcurrentMap<LinkPair, DishRestaurantLink> links = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, Municipality> municipalities = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong(1000);

    /**
     * Stores an item as-is, replacing any item with the same kind and id.
     */
    public InMemoryDataGateway put(CuratedItem item) {
        items.put(ItemKey.of(item), item);
        return this;
    }

    public InMemoryDataGateway putAll(List<CuratedItem> all) {
        all.forEach(this::put);
        return this;
    }

    public InMemoryDataGateway putMunicipality(Municipality municipality) {
        municipalities.put(municipality.id(), municipality);
        return this;
    }

    /**
     * Returns the stored item, or null when absent.
     */
    public CuratedItem get(ItemKind kind, long id) {
        return items.get(new ItemKey(kind, id));
    }

    /**
     * Returns the number of stored link rows.
     */
    public int linkCount() {
        return links.size();
    }

    public boolean hasLink(long dishId, long restaurantId) {
        return links.containsKey(new LinkPair(dishId, restaurantId));
    }

    @Override
    public List<CuratedItem> fetchItems(ItemQuery query) {
        Predicate<CuratedItem> matches = item -> item.getKind() == query.kind();
        if (query.municipalityId() != null) {
            matches = matches.and(item -> item.getMunicipalityId() == query.municipalityId());
        }
        if (query.category() != null) {
            matches = matches.and(item -> query.category().equalsIgnoreCase(item.getCategory()));
        }
        if (query.text() != null) {
            String needle = query.text().toLowerCase(Locale.ROOT);
            matches = matches.and(item -> item.getName().toLowerCase(Locale.ROOT).contains(needle));
        }
        if (query.flaggedOnly()) {
            matches = matches.and(CuratedItem::isFlagged);
        }

        List<CuratedItem> result = items.values().stream()
                .filter(matches)
                .sorted(Comparator.comparingLong(CuratedItem::getId))
                .limit(query.limit() > 0 ? query.limit() : Long.MAX_VALUE)
                .toList();
        log.debug("Fetched {} items for {}", result.size(), query);
        return result;
    }

    @Override
    public CuratedItem updateItem(CuratedItem current, ItemPatch patch) {
        ItemKey key = ItemKey.of(current);
        CuratedItem updated = items.computeIfPresent(key, (k, stored) -> patch.applyTo(stored));
        if (updated == null) {
            throw new RemoteGatewayException(RemoteGatewayException.STATUS_NOT_FOUND,
                    current.getKind().getLabel().toLowerCase(Locale.ROOT) + "_not_found");
        }
        log.debug("Updated {} {} with {}", current.getKind(), current.getId(), patch);
        return updated;
    }

    @Override
    public void createLink(long dishId, long restaurantId, LinkMetadata metadata) {
        LinkPair pair = new LinkPair(dishId, restaurantId);
        DishRestaurantLink previous = links.putIfAbsent(pair, new DishRestaurantLink(dishId, restaurantId, metadata));
        log.debug("Link {} {}", pair, previous == null ? "created" : "already present");
    }

    @Override
    public void deleteLink(long dishId, long restaurantId) {
        DishRestaurantLink removed = links.remove(new LinkPair(dishId, restaurantId));
        log.debug("Link ({},{}) {}", dishId, restaurantId, removed != null ? "deleted" : "was absent");
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedRestaurants(long dishId) {
        return links.values().stream()
                .filter(link -> link.getDishId() == dishId)
                .map(link -> toRef(ItemKind.RESTAURANT, link.getRestaurantId(), link.getMetadata()))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(LinkedItemRef::name))
                .toList();
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedDishes(long restaurantId) {
        return links.values().stream()
                .filter(link -> link.getRestaurantId() == restaurantId)
                .map(link -> toRef(ItemKind.DISH, link.getDishId(), link.getMetadata()))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(LinkedItemRef::name))
                .toList();
    }

    @Override
    public List<Municipality> fetchMunicipalities() {
        return municipalities.values().stream()
                .sorted(Comparator.comparing(Municipality::slug))
                .toList();
    }

    @Override
    public CuratedItem createItem(CuratedItem item) {
        CuratedItem stored = item.getId() > 0
                ? item
                : item.toBuilder().id(idSequence.incrementAndGet()).build();
        if (items.putIfAbsent(ItemKey.of(stored), stored) != null) {
            throw new RemoteGatewayException(RemoteGatewayException.STATUS_CONFLICT,
                    "duplicate_id " + stored.getId());
        }
        return stored;
    }

    @Override
    public void deleteItem(ItemKind kind, long id) {
        items.remove(new ItemKey(kind, id));
        if (kind == ItemKind.DISH) {
            links.keySet().removeIf(pair -> pair.dishId() == id);
        } else {
            links.keySet().removeIf(pair -> pair.restaurantId() == id);
        }
    }

    private LinkedItemRef toRef(ItemKind kind, long id, LinkMetadata metadata) {
        CuratedItem item = items.get(new ItemKey(kind, id));
        if (item == null) {
            return null;
        }
        return new LinkedItemRef(item.getId(), item.getName(), item.getSlug(),
                kind, item.getCategory(), metadata);
    }

    record ItemKey(ItemKind kind, long id) {
        static ItemKey of(CuratedItem item) {
            return new ItemKey(item.getKind(), item.getId());
        }
    }
}
