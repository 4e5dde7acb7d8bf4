package com.dish.curation.gateway;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkPair;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.Municipality;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link RemoteDataGateway} that injects configurable failures
 * for resilience testing: failing link pairs, failing item updates, and latency.
 */
public class FaultInjectingGateway implements RemoteDataGateway {

    private final RemoteDataGateway delegate;
    private final Map<LinkPair, Integer> failingPairs = new ConcurrentHashMap<>();
    private final Set<String> failingUpdates = ConcurrentHashMap.newKeySet();
    private final AtomicInteger updateCalls = new AtomicInteger();
    private final AtomicInteger linkCalls = new AtomicInteger();
    private volatile long injectDelayMs = 0;

    public FaultInjectingGateway(RemoteDataGateway delegate) {
        this.delegate = delegate;
    }

    /**
     * Makes createLink for the pair fail with the given status.
     */
    public void failLink(long dishId, long restaurantId, int status) {
        failingPairs.put(new LinkPair(dishId, restaurantId), status);
    }

    public void healLink(long dishId, long restaurantId) {
        failingPairs.remove(new LinkPair(dishId, restaurantId));
    }

    /**
     * Makes updateItem for the item fail with status 500.
     */
    public void failUpdate(ItemKind kind, long id) {
        failingUpdates.add(kind + ":" + id);
    }

    public void healUpdates() {
        failingUpdates.clear();
    }

    public void setInjectDelayMs(long delayMs) {
        this.injectDelayMs = delayMs;
    }

    public int getUpdateCalls() {
        return updateCalls.get();
    }

    public int getLinkCalls() {
        return linkCalls.get();
    }

    @Override
    public List<CuratedItem> fetchItems(ItemQuery query) {
        maybeDelay();
        return delegate.fetchItems(query);
    }

    @Override
    public CuratedItem updateItem(CuratedItem current, ItemPatch patch) {
        maybeDelay();
        updateCalls.incrementAndGet();
        if (failingUpdates.contains(current.getKind() + ":" + current.getId())) {
            throw new RemoteGatewayException(500, "Injected update failure");
        }
        return delegate.updateItem(current, patch);
    }

    @Override
    public void createLink(long dishId, long restaurantId, LinkMetadata metadata) {
        maybeDelay();
        linkCalls.incrementAndGet();
        Integer status = failingPairs.get(new LinkPair(dishId, restaurantId));
        if (status != null) {
            throw new RemoteGatewayException(status, "Injected link failure");
        }
        delegate.createLink(dishId, restaurantId, metadata);
    }

    @Override
    public void deleteLink(long dishId, long restaurantId) {
        maybeDelay();
        delegate.deleteLink(dishId, restaurantId);
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedRestaurants(long dishId) {
        return delegate.fetchAssociatedRestaurants(dishId);
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedDishes(long restaurantId) {
        return delegate.fetchAssociatedDishes(restaurantId);
    }

    @Override
    public List<Municipality> fetchMunicipalities() {
        return delegate.fetchMunicipalities();
    }

    @Override
    public CuratedItem createItem(CuratedItem item) {
        return delegate.createItem(item);
    }

    @Override
    public void deleteItem(ItemKind kind, long id) {
        delegate.deleteItem(kind, id);
    }

    private void maybeDelay() {
        if (injectDelayMs > 0) {
            try {
                Thread.sleep(injectDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
