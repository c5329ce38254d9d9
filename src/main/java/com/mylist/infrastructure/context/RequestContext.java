package com.mylist.infrastructure.context;

import com.mylist.domain.model.UserId;
import org.slf4j.MDC;

/**
 * Per-request diagnostic context. The request id is echoed in error bodies; both ids are copied into the
 * logging MDC so every log line of a request carries them.
 */
public final class RequestContext {

    static final String USER_ID_KEY = "userId";
    static final String REQUEST_ID_KEY = "requestId";

    private static final ThreadLocal<String> requestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void bind(String id) {
        requestId.set(id);
        MDC.put(REQUEST_ID_KEY, id);
    }

    public static void bind(String id, UserId userId) {
        bind(id);
        MDC.put(USER_ID_KEY, userId.value());
    }

    /**
     * Request id of the current request, or null outside of one.
     */
    public static String getRequestId() {
        return requestId.get();
    }

    public static void clear() {
        requestId.remove();
        MDC.remove(REQUEST_ID_KEY);
        MDC.remove(USER_ID_KEY);
    }
}
