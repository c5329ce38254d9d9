package com.mylist.application.port.in;

import com.mylist.domain.error.MyListError;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.Result;
import com.mylist.domain.model.UserId;

public interface GetMyListUseCase {

    /**
     * @param cursor opaque token from a previous page, or null for the first page
     * @param limit  requested page size, or null for the configured default
     */
    Result<Page<ListItem>, MyListError> getMyList(UserId userId, String cursor, Integer limit);
}
