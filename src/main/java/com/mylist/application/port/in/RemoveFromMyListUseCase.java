package com.mylist.application.port.in;

import com.mylist.domain.error.MyListError;
import com.mylist.domain.model.Result;
import com.mylist.domain.model.UserId;

public interface RemoveFromMyListUseCase {

    /**
     * Removing content that is not in the list succeeds; the value tells whether anything was deleted.
     */
    Result<Boolean, MyListError> removeItem(UserId userId, String contentId);
}
