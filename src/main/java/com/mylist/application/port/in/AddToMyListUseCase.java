package com.mylist.application.port.in;

import com.mylist.domain.error.MyListError;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Result;
import com.mylist.domain.model.UserId;

public interface AddToMyListUseCase {
    Result<AddedItem, MyListError> addItem(UserId userId, String contentId, String contentType);

    /**
     * @param created false when the content was already in the list and the stored item is returned unchanged
     */
    record AddedItem(ListItem item, boolean created) {}
}
