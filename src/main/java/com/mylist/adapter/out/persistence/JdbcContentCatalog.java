package com.mylist.adapter.out.persistence;

import com.mylist.application.port.out.ContentCatalog;
import com.mylist.domain.model.ContentType;
import com.mylist.infrastructure.exception.StoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcContentCatalog implements ContentCatalog {

    private final JdbcTemplate jdbc;

    public JdbcContentCatalog(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean contentExists(String contentId, ContentType contentType) {
        // Table names come from the enum, never from input
        String table = switch (contentType) {
            case MOVIE -> "movies";
            case TV_SHOW -> "tv_shows";
        };
        try {
            Boolean exists = jdbc.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM " + table + " WHERE id = ?)",
                Boolean.class,
                contentId
            );
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("contentExists", e);
        }
    }
}
