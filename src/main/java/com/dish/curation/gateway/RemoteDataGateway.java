package com.dish.curation.gateway;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.Municipality;

import java.util.List;

/**
 * Narrow boundary to the store that persists curated items and associations.
 *
 * <p>Every method either returns its payload or throws {@link RemoteGatewayException}
 * carrying a status and message. Implementations never retry on their own.</p>
 */
public interface RemoteDataGateway {

    /**
     * Fetches items matching the query, in the store's order.
     */
    List<CuratedItem> fetchItems(ItemQuery query);

    /**
     * Applies a partial update to the stored record of {@code current} and returns
     * the updated item. Stores that only acknowledge the write return
     * {@code current} with the patch applied.
     *
     * @throws RemoteGatewayException with status 404 when the item does not exist
     */
    CuratedItem updateItem(CuratedItem current, ItemPatch patch);

    /**
     * Creates a dish-restaurant link. Implementations may either ignore an existing
     * pair or reject it with status 409.
     */
    void createLink(long dishId, long restaurantId, LinkMetadata metadata);

    /**
     * Deletes a dish-restaurant link. Implementations may either ignore a missing
     * pair or reject it with status 404.
     */
    void deleteLink(long dishId, long restaurantId);

    List<LinkedItemRef> fetchAssociatedRestaurants(long dishId);

    List<LinkedItemRef> fetchAssociatedDishes(long restaurantId);

    List<Municipality> fetchMunicipalities();

    /**
     * Creates an item and returns it with its assigned id.
     */
    CuratedItem createItem(CuratedItem item);

    void deleteItem(ItemKind kind, long id);
}
