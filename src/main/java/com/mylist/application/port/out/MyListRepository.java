package com.mylist.application.port.out;

import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.UserId;

import java.util.List;

/**
 * Durable store of list items, the single writer-of-record.
 */
public interface MyListRepository {

    /**
     * Inserts the item unless the user already has the same content, in which case the stored item is returned.
     * A newly inserted item comes back with the creation time the store assigned.
     */
    InsertResult insertIfAbsent(ListItem item);

    boolean deleteIfExists(UserId userId, String contentId);

    /**
     * Items of the user ordered by (createdAt desc, id desc), strictly after {@code cursor} when one is given.
     */
    List<ListItem> findPage(UserId userId, Cursor cursor, int limit);

    record InsertResult(ListItem item, boolean inserted) {}
}
