package com.mylist.application.service;

import com.mylist.application.port.out.MyListRepository;
import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds one page straight from the durable store. Fetches one row more than asked for so that
 * {@code hasMore} is known without a second query.
 */
@Component
public class PaginatedReader {

    private static final Logger log = LoggerFactory.getLogger(PaginatedReader.class);

    private final MyListRepository repository;
    private final CursorCodec cursorCodec;

    public PaginatedReader(MyListRepository repository, CursorCodec cursorCodec) {
        this.repository = repository;
        this.cursorCodec = cursorCodec;
    }

    public Page<ListItem> fetchPage(UserId userId, Cursor cursor, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<ListItem> rows = repository.findPage(userId, cursor, limit + 1);

        boolean hasMore = rows.size() > limit;
        if (hasMore) {
            rows = rows.subList(0, limit);
        }

        String nextCursor = hasMore ? cursorCodec.encode(rows.get(rows.size() - 1).position()) : null;
        log.debug("Fetched {} items for user={} from store, hasMore={}", rows.size(), userId, hasMore);

        return new Page<>(rows, nextCursor, hasMore);
    }
}
