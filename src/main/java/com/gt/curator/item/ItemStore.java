package com.gt.curator.item;

import com.gt.curator.model.Item;
import com.gt.curator.model.ItemVersion;

import java.util.List;
import java.util.Optional;

public interface ItemStore {

    Optional<Item> getItem(String learnerId, String itemId);

    boolean createItem(Item item);

    /**
     * Replaces the stored item only if its current version still equals {@code expectedVersion}.
     *
     * @return the stored item, or empty if the item changed since {@code expectedVersion} was read
     */
    Optional<Item> compareAndSwap(String learnerId, String itemId, ItemVersion expectedVersion, Item newItem);

    // Items ordered by id, starting after lastItemId (null for the first batch)
    List<Item> loadItemsBatch(String learnerId, String lastItemId, int batchSize);

    List<String> loadLearnerIds();
}
