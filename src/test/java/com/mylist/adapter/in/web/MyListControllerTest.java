package com.mylist.adapter.in.web;

import com.mylist.application.port.in.AddToMyListUseCase;
import com.mylist.application.port.in.AddToMyListUseCase.AddedItem;
import com.mylist.application.port.in.GetMyListUseCase;
import com.mylist.application.port.in.RemoveFromMyListUseCase;
import com.mylist.domain.error.MyListError;
import com.mylist.domain.error.ValidationError;
import com.mylist.domain.model.ContentType;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.Page;
import com.mylist.domain.model.Result;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.SQLTransientConnectionException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(MyListController.class)
class MyListControllerTest {

    private static final String TEST_USER = "demo-user-1";
    private static final UserId USER_ID = UserId.fromTrusted(TEST_USER);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetMyListUseCase getMyListUseCase;

    @MockBean
    private AddToMyListUseCase addToMyListUseCase;

    @MockBean
    private RemoveFromMyListUseCase removeFromMyListUseCase;

    private ListItem item(String contentId, ContentType type) {
        return new ListItem(UUID.randomUUID(), USER_ID, contentId, type, Instant.parse("2024-05-01T10:15:30.123456Z"));
    }

    @Test
    void shouldReturnFirstPage() throws Exception {
        ListItem movie = item("m1", ContentType.MOVIE);
        ListItem show = item("s1", ContentType.TV_SHOW);
        when(getMyListUseCase.getMyList(USER_ID, null, 2))
            .thenReturn(Result.success(new Page<>(List.of(movie, show), "next-token", true)));

        mockMvc.perform(get("/my-list").param("limit", "2").header("x-user-id", TEST_USER))
            .andExpect(status().isOk())
            .andExpect(header().exists("X-Request-Id"))
            .andExpect(jsonPath("$.items.length()").value(2))
            .andExpect(jsonPath("$.items[0].id").value(movie.id().toString()))
            .andExpect(jsonPath("$.items[0].contentId").value("m1"))
            .andExpect(jsonPath("$.items[0].contentType").value("movie"))
            .andExpect(jsonPath("$.items[1].contentType").value("tvshow"))
            .andExpect(jsonPath("$.nextCursor").value("next-token"))
            .andExpect(jsonPath("$.hasMore").value(true));
    }

    @Test
    void shouldPassCursorThrough() throws Exception {
        when(getMyListUseCase.getMyList(USER_ID, "abc.def", null)).thenReturn(Result.success(Page.empty()));

        mockMvc.perform(get("/my-list").param("cursor", "abc.def").header("x-user-id", TEST_USER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items").isEmpty())
            .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void shouldRejectInvalidCursor() throws Exception {
        when(getMyListUseCase.getMyList(USER_ID, "bogus", null))
            .thenReturn(Result.failure(new MyListError.InvalidCursor("bogus")));

        mockMvc.perform(get("/my-list").param("cursor", "bogus").header("x-user-id", TEST_USER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_CURSOR"));
    }

    @Test
    void shouldRejectNonPositiveLimit() throws Exception {
        when(getMyListUseCase.getMyList(USER_ID, null, 0))
            .thenReturn(Result.failure(new MyListError.ValidationFailed(new ValidationError.LimitError.NotPositive(0))));

        mockMvc.perform(get("/my-list").param("limit", "0").header("x-user-id", TEST_USER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("LIMIT_NOT_POSITIVE"));
    }

    @Test
    void shouldRejectNonNumericLimit() throws Exception {
        mockMvc.perform(get("/my-list").param("limit", "ten").header("x-user-id", TEST_USER))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldRejectMissingUserId() throws Exception {
        mockMvc.perform(get("/my-list"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("USER_ID_EMPTY"));

        verifyNoInteractions(getMyListUseCase);
    }

    @Test
    void shouldRejectUserIdThatWouldBreakCacheKeys() throws Exception {
        mockMvc.perform(get("/my-list").header("x-user-id", "alice:page"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("USER_ID_INVALID_FORMAT"));
    }

    @Test
    void shouldReturnServiceUnavailableWhenStoreIsDown() throws Exception {
        when(getMyListUseCase.getMyList(any(UserId.class), any(), any()))
            .thenThrow(new StoreUnavailableException("findPage", new SQLTransientConnectionException("timeout")));

        mockMvc.perform(get("/my-list").header("x-user-id", TEST_USER))
            .andExpect(status().isServiceUnavailable())
            .andExpect(header().string("Retry-After", "1"))
            .andExpect(jsonPath("$.error").value("STORE_UNAVAILABLE"));
    }

    @Test
    void shouldAddNewItem() throws Exception {
        ListItem movie = item("m1", ContentType.MOVIE);
        when(addToMyListUseCase.addItem(USER_ID, "m1", "movie"))
            .thenReturn(Result.success(new AddedItem(movie, true)));

        mockMvc.perform(post("/my-list")
                .header("x-user-id", TEST_USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contentId\":\"m1\",\"contentType\":\"movie\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.message").value("Added to list"))
            .andExpect(jsonPath("$.item.id").value(movie.id().toString()))
            .andExpect(jsonPath("$.item.contentType").value("movie"));
    }

    @Test
    void shouldReportDuplicateAdd() throws Exception {
        ListItem movie = item("m1", ContentType.MOVIE);
        when(addToMyListUseCase.addItem(USER_ID, "m1", "movie"))
            .thenReturn(Result.success(new AddedItem(movie, false)));

        mockMvc.perform(post("/my-list")
                .header("x-user-id", TEST_USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contentId\":\"m1\",\"contentType\":\"movie\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Already in list"))
            .andExpect(jsonPath("$.item.id").value(movie.id().toString()));
    }

    @Test
    void shouldReturnNotFoundForMissingContent() throws Exception {
        when(addToMyListUseCase.addItem(USER_ID, "m404", "movie"))
            .thenReturn(Result.failure(new MyListError.ContentNotFound("m404", ContentType.MOVIE)));

        mockMvc.perform(post("/my-list")
                .header("x-user-id", TEST_USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contentId\":\"m404\",\"contentType\":\"movie\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("CONTENT_NOT_FOUND"));
    }

    @Test
    void shouldRejectUnsupportedContentType() throws Exception {
        when(addToMyListUseCase.addItem(USER_ID, "p1", "podcast"))
            .thenReturn(Result.failure(new MyListError.UnsupportedContentType("podcast")));

        mockMvc.perform(post("/my-list")
                .header("x-user-id", TEST_USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contentId\":\"p1\",\"contentType\":\"podcast\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("UNSUPPORTED_CONTENT_TYPE"));
    }

    @Test
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/my-list")
                .header("x-user-id", TEST_USER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(addToMyListUseCase);
    }

    @Test
    void shouldRemoveItem() throws Exception {
        when(removeFromMyListUseCase.removeItem(USER_ID, "m1")).thenReturn(Result.success(true));

        mockMvc.perform(delete("/my-list/m1").header("x-user-id", TEST_USER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Removed from list"));
    }

    @Test
    void shouldSucceedRemovingAbsentItem() throws Exception {
        when(removeFromMyListUseCase.removeItem(USER_ID, "m1")).thenReturn(Result.success(false));

        mockMvc.perform(delete("/my-list/m1").header("x-user-id", TEST_USER))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Not in list"));
    }
}
