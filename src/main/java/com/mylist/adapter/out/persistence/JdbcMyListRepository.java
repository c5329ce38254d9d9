package com.mylist.adapter.out.persistence;

import com.mylist.application.port.out.MyListRepository;
import com.mylist.domain.model.ContentType;
import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

@Repository
public class JdbcMyListRepository implements MyListRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcMyListRepository.class);

    // A concurrent remove can delete the conflicting row between the insert and the lookup
    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final JdbcTemplate jdbc;

    private static final RowMapper<ListItem> ROW_MAPPER = (rs, rowNum) -> new ListItem(
        UUID.fromString(rs.getString("id")),
        UserId.fromTrusted(rs.getString("user_id")),
        rs.getString("content_id"),
        ContentType.valueOf(rs.getString("content_type")),
        rs.getTimestamp("created_at").toInstant()
    );

    public JdbcMyListRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public InsertResult insertIfAbsent(ListItem item) {
        return execute("insertIfAbsent", () -> {
            for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
                // The database clock orders items, so instances with skewed clocks still agree on the head
                List<Timestamp> stamped = jdbc.query("""
                    INSERT INTO my_list_items (id, user_id, content_id, content_type, created_at)
                    VALUES (?, ?, ?, ?, now())
                    ON CONFLICT (user_id, content_id) DO NOTHING
                    RETURNING created_at
                    """,
                    (rs, rowNum) -> rs.getTimestamp("created_at"),
                    item.id(),
                    item.userId().toString(),
                    item.contentId(),
                    item.contentType().name()
                );
                if (!stamped.isEmpty()) {
                    ListItem stored = new ListItem(item.id(), item.userId(), item.contentId(), item.contentType(),
                        stamped.get(0).toInstant());
                    return new InsertResult(stored, true);
                }
                Optional<ListItem> existing = findByContentId(item.userId(), item.contentId());
                if (existing.isPresent()) {
                    return new InsertResult(existing.get(), false);
                }
                log.debug("Conflicting row vanished before lookup, retrying insert: user={}, contentId={}, attempt={}",
                    item.userId(), item.contentId(), attempt);
            }
            throw new IllegalStateException("Could not insert or find list item for user " + item.userId()
                + " and content " + item.contentId());
        });
    }

    @Override
    public boolean deleteIfExists(UserId userId, String contentId) {
        return execute("deleteIfExists", () -> jdbc.update(
            "DELETE FROM my_list_items WHERE user_id = ? AND content_id = ?",
            userId.toString(),
            contentId
        ) > 0);
    }

    @Override
    public List<ListItem> findPage(UserId userId, Cursor cursor, int limit) {
        if (cursor == null) {
            return execute("findPage", () -> jdbc.query("""
                SELECT id, user_id, content_id, content_type, created_at
                FROM my_list_items
                WHERE user_id = ?
                ORDER BY created_at DESC, id DESC
                LIMIT ?
                """,
                ROW_MAPPER,
                userId.toString(),
                limit
            ));
        }
        return execute("findPage", () -> jdbc.query("""
            SELECT id, user_id, content_id, content_type, created_at
            FROM my_list_items
            WHERE user_id = ? AND (created_at, id) < (?, ?)
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """,
            ROW_MAPPER,
            userId.toString(),
            Timestamp.from(cursor.createdAt()),
            cursor.id(),
            limit
        ));
    }

    private Optional<ListItem> findByContentId(UserId userId, String contentId) {
        return jdbc.query("""
            SELECT id, user_id, content_id, content_type, created_at
            FROM my_list_items
            WHERE user_id = ? AND content_id = ?
            """,
            ROW_MAPPER,
            userId.toString(),
            contentId
        ).stream().findFirst();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Store call {} failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        }
    }
}
