package com.dish.curation.gateway;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.Municipality;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDataGatewayTest {

    private InMemoryDataGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryDataGateway();
        gateway.putAll(List.of(
                CuratedItem.dish().id(1).name("Longganisa").municipalityId(1).category("main").rank(1).build(),
                CuratedItem.dish().id(2).name("Tapa").municipalityId(1).category("Main").build(),
                CuratedItem.dish().id(3).name("Bibingka").municipalityId(2).category("dessert").build(),
                CuratedItem.restaurant().id(1).name("Carinderia").municipalityId(1).build()));
        gateway.putMunicipality(new Municipality(1, "Lucena", null));
        gateway.putMunicipality(new Municipality(2, "Atimonan", "atimonan"));
    }

    @Test
    @DisplayName("Should filter by kind, municipality, category, text and flag")
    void testFetchItems() {
        assertEquals(3, gateway.fetchItems(ItemQuery.all(ItemKind.DISH)).size());
        assertEquals(2, gateway.fetchItems(ItemQuery.inMunicipality(ItemKind.DISH, 1).withCategory("main")).size());
        assertEquals(List.of(2L), gateway.fetchItems(ItemQuery.all(ItemKind.DISH).withText("ap"))
                .stream().map(CuratedItem::getId).toList());
        assertEquals(1, gateway.fetchItems(ItemQuery.all(ItemKind.DISH).onlyFlagged()).size());
        assertEquals(1, gateway.fetchItems(ItemQuery.all(ItemKind.DISH).withLimit(1)).size());
    }

    @Test
    @DisplayName("Should apply rank patches with the matching flag")
    void testUpdateRank() {
        CuratedItem updated = gateway.updateItem(gateway.get(ItemKind.DISH, 2), ItemPatch.rank(2));

        assertEquals(2, updated.getRank());
        assertTrue(updated.isFlagged());

        CuratedItem cleared = gateway.updateItem(gateway.get(ItemKind.DISH, 1), ItemPatch.clearRank());
        assertNull(cleared.getRank());
        assertFalse(cleared.isFlagged());
    }

    @Test
    @DisplayName("Should report missing items with status 404")
    void testUpdateMissing() {
        RemoteGatewayException e = assertThrows(RemoteGatewayException.class,
                () -> gateway.updateItem(CuratedItem.restaurant().id(9).name("Gone").build(), ItemPatch.rank(1)));

        assertTrue(e.isNotFound());
        assertEquals("restaurant_not_found", e.getRemoteMessage());
    }

    @Test
    @DisplayName("Should ignore duplicate links and missing deletes")
    void testLinkIdempotence() {
        gateway.createLink(1, 1, LinkMetadata.defaults());
        gateway.createLink(1, 1, LinkMetadata.of("P60", null));
        gateway.deleteLink(2, 1);

        assertEquals(1, gateway.linkCount());
        assertEquals(1, gateway.fetchAssociatedDishes(1).size());
    }

    @Test
    @DisplayName("Should assign ids to created items and cascade deletes to links")
    void testCreateAndDelete() {
        CuratedItem created = gateway.createItem(CuratedItem.dish().name("Pancit").municipalityId(1).build());
        assertTrue(created.getId() > 1000);

        gateway.createLink(created.getId(), 1, LinkMetadata.defaults());
        gateway.deleteItem(ItemKind.DISH, created.getId());

        assertNull(gateway.get(ItemKind.DISH, created.getId()));
        assertEquals(0, gateway.linkCount());
        assertThrows(RemoteGatewayException.class,
                () -> gateway.createItem(CuratedItem.dish().id(1).name("Duplicate").build()));
    }

    @Test
    @DisplayName("Should list municipalities by slug")
    void testMunicipalities() {
        assertEquals(List.of("atimonan", "lucena"),
                gateway.fetchMunicipalities().stream().map(Municipality::slug).toList());
    }
}
