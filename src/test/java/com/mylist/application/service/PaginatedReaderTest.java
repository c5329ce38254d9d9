package com.mylist.application.service;

import com.mylist.application.port.out.MyListRepository;
import com.mylist.domain.model.ContentType;
import com.mylist.domain.model.Cursor;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PaginatedReader")
class PaginatedReaderTest {

    @Mock
    private MyListRepository repository;

    private CursorCodec cursorCodec;
    private PaginatedReader reader;
    private final UserId userId = UserId.random();

    @BeforeEach
    void setUp() {
        cursorCodec = new CursorCodec(new AppProperties());
        reader = new PaginatedReader(repository, cursorCodec);
    }

    private ListItem item(String contentId, long epochSecond) {
        return new ListItem(UUID.randomUUID(), userId, contentId, ContentType.MOVIE, Instant.ofEpochSecond(epochSecond));
    }

    @Test
    @DisplayName("Should over-fetch by one and emit a cursor from the last kept row")
    void shouldOverFetchByOne() {
        ListItem newest = item("m3", 300);
        ListItem middle = item("m2", 200);
        ListItem extra = item("m1", 100);
        when(repository.findPage(userId, null, 3)).thenReturn(List.of(newest, middle, extra));

        Page<ListItem> page = reader.fetchPage(userId, null, 2);

        assertEquals(List.of(newest, middle), page.items());
        assertTrue(page.hasMore());
        assertEquals(middle.position(), cursorCodec.decode(page.nextCursor()).getOrThrow());
    }

    @Test
    @DisplayName("Should report no more items when the extra row is absent")
    void shouldReportNoMoreWithoutExtraRow() {
        ListItem only = item("m1", 100);
        when(repository.findPage(userId, null, 3)).thenReturn(List.of(only));

        Page<ListItem> page = reader.fetchPage(userId, null, 2);

        assertEquals(List.of(only), page.items());
        assertFalse(page.hasMore());
        assertNull(page.nextCursor());
    }

    @Test
    @DisplayName("Should pass the cursor position through to the store")
    void shouldPassCursorToStore() {
        Cursor cursor = new Cursor(Instant.ofEpochSecond(500), UUID.randomUUID());
        when(repository.findPage(eq(userId), eq(cursor), anyInt())).thenReturn(List.of());

        Page<ListItem> page = reader.fetchPage(userId, cursor, 5);

        assertTrue(page.items().isEmpty());
        verify(repository).findPage(userId, cursor, 6);
    }

    @Test
    @DisplayName("Should refuse a non-positive limit")
    void shouldRefuseNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> reader.fetchPage(userId, null, 0));
        verifyNoInteractions(repository);
    }
}
