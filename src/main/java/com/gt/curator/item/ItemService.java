package com.gt.curator.item;

import com.gt.curator.exception.NotFoundException;
import com.gt.curator.exception.ValidationException;
import com.gt.curator.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class ItemService {

    private static final Logger log = LoggerFactory.getLogger(ItemService.class);

    static final int QUERY_BATCH_SIZE = 1000;

    private final ItemStore itemStore;

    @Autowired
    public ItemService(ItemStore itemStore) {
        this.itemStore = itemStore;
    }

    public Item enroll(String learnerId, String itemId, String itemType, Instant now) {
        if (itemId == null || itemId.isBlank()) {
            throw new ValidationException("An item id is required to enroll an item");
        }

        Item newItem = Item.enroll(itemId, learnerId, itemType, now);
        if (itemStore.createItem(newItem)) {
            log.info("Enrolled item {} for learner {}", itemId, learnerId);
            return newItem;
        }

        log.info("Item {} already enrolled for learner {}", itemId, learnerId);
        return getItem(learnerId, itemId);
    }

    public Item getItem(String learnerId, String itemId) {
        return itemStore.getItem(learnerId, itemId)
                .orElseThrow(() -> new NotFoundException("Item " + itemId + " does not exist for learner " + learnerId));
    }

    public List<Item> loadAllItems(String learnerId) {
        List<Item> allItems = new ArrayList<>();

        List<Item> itemBatch;
        String lastItemId = null;
        do {
            itemBatch = itemStore.loadItemsBatch(learnerId, lastItemId, QUERY_BATCH_SIZE);

            if (itemBatch != null && itemBatch.size() > 0) {
                allItems.addAll(itemBatch);

                lastItemId = itemBatch.get(itemBatch.size() - 1).id();
            }
        } while (itemBatch != null && itemBatch.size() == QUERY_BATCH_SIZE);

        return allItems;
    }

    public List<String> loadLearnerIds() {
        return itemStore.loadLearnerIds();
    }
}
