package com.mylist.adapter.in.web;

import com.mylist.application.port.in.AddToMyListUseCase;
import com.mylist.application.port.in.AddToMyListUseCase.AddedItem;
import com.mylist.application.port.in.GetMyListUseCase;
import com.mylist.application.port.in.RemoveFromMyListUseCase;
import com.mylist.domain.error.MyListError;
import com.mylist.domain.error.ValidationError;
import com.mylist.domain.model.ListItem;
import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.context.RequestContext;
import com.mylist.infrastructure.filter.AuthFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/my-list")
@Tag(name = "My List", description = "Saved movies and TV shows of the current user")
public class MyListController {

    private final GetMyListUseCase getMyListUseCase;
    private final AddToMyListUseCase addToMyListUseCase;
    private final RemoveFromMyListUseCase removeFromMyListUseCase;

    public MyListController(
            GetMyListUseCase getMyListUseCase,
            AddToMyListUseCase addToMyListUseCase,
            RemoveFromMyListUseCase removeFromMyListUseCase) {
        this.getMyListUseCase = getMyListUseCase;
        this.addToMyListUseCase = addToMyListUseCase;
        this.removeFromMyListUseCase = removeFromMyListUseCase;
    }

    @GetMapping
    @Operation(summary = "Get my list", description = "Returns the current user's list, newest first, one page at a time")
    public ResponseEntity<?> getMyList(
            @Parameter(description = "User ID", example = "demo-user-1")
            @RequestHeader(AuthFilter.USER_ID_HEADER) String userIdHeader,
            @Parameter(description = "Pagination cursor from previous response")
            @RequestParam(required = false) String cursor,
            @Parameter(description = "Number of items to return (max 100)")
            @RequestParam(required = false) Integer limit) {

        var userIdResult = UserId.parse(userIdHeader);
        if (userIdResult.isFailure()) {
            return toValidationErrorResponse(userIdResult.errorOrNull());
        }

        return getMyListUseCase.getMyList(userIdResult.getOrThrow(), cursor, limit).<ResponseEntity<?>>fold(
            page -> ResponseEntity.ok(PageResponse.from(page)),
            this::toErrorResponse
        );
    }

    @PostMapping
    @Operation(summary = "Add to my list", description = "Adds a movie or TV show; adding the same content again returns the stored item")
    public ResponseEntity<?> addItem(
            @Parameter(description = "User ID", example = "demo-user-1")
            @RequestHeader(AuthFilter.USER_ID_HEADER) String userIdHeader,
            @RequestBody AddItemRequest request) {

        var userIdResult = UserId.parse(userIdHeader);
        if (userIdResult.isFailure()) {
            return toValidationErrorResponse(userIdResult.errorOrNull());
        }

        var result = addToMyListUseCase.addItem(userIdResult.getOrThrow(), request.contentId(), request.contentType());
        if (result.isFailure()) {
            return toErrorResponse(result.errorOrNull());
        }

        AddedItem added = result.getOrThrow();
        return added.created()
            ? ResponseEntity.status(HttpStatus.CREATED).body(new AddItemResponse("Added to list", ListItemResponse.from(added.item())))
            : ResponseEntity.ok(new AddItemResponse("Already in list", ListItemResponse.from(added.item())));
    }

    @DeleteMapping("/{contentId}")
    @Operation(summary = "Remove from my list", description = "Removes content from the list; removing absent content succeeds")
    public ResponseEntity<?> removeItem(
            @Parameter(description = "User ID", example = "demo-user-1")
            @RequestHeader(AuthFilter.USER_ID_HEADER) String userIdHeader,
            @Parameter(description = "Content ID", example = "m1")
            @PathVariable String contentId) {

        var userIdResult = UserId.parse(userIdHeader);
        if (userIdResult.isFailure()) {
            return toValidationErrorResponse(userIdResult.errorOrNull());
        }

        var result = removeFromMyListUseCase.removeItem(userIdResult.getOrThrow(), contentId);
        if (result.isFailure()) {
            return toErrorResponse(result.errorOrNull());
        }
        String message = result.getOrThrow() ? "Removed from list" : "Not in list";
        return ResponseEntity.ok(new MessageResponse(message));
    }

    private ResponseEntity<ErrorResponse> toValidationErrorResponse(ValidationError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(MyListError error) {
        HttpStatus status = error instanceof MyListError.ContentNotFound ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record AddItemRequest(String contentId, String contentType) {}

    public record AddItemResponse(String message, ListItemResponse item) {}

    public record MessageResponse(String message) {}

    public record ErrorResponse(String error, String message, String requestId) {}

    public record ListItemResponse(
        UUID id,
        String contentId,
        String contentType,
        Instant createdAt
    ) {
        public static ListItemResponse from(ListItem item) {
            return new ListItemResponse(item.id(), item.contentId(), item.contentType().wireName(), item.createdAt());
        }
    }
}
