package com.mylist.adapter.in.web;

import com.mylist.adapter.in.web.MyListController.ListItemResponse;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;

import java.util.List;

/**
 * Wire form of one list page. {@code nextCursor} is null exactly when {@code hasMore} is false.
 */
public record PageResponse(
    List<ListItemResponse> items,
    String nextCursor,
    boolean hasMore
) {
    public static PageResponse from(Page<ListItem> page) {
        return new PageResponse(
            page.items().stream().map(ListItemResponse::from).toList(),
            page.nextCursor(),
            page.hasMore()
        );
    }
}
