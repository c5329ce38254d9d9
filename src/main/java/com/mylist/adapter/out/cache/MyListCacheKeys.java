package com.mylist.adapter.out.cache;

import com.mylist.domain.model.CursorSignature;
import com.mylist.domain.model.UserId;

/**
 * Redis key layout shared by the version, page and lock adapters.
 * <pre>
 * mylist:{userId}:version
 * mylist:{userId}:page:{cursorSignature}:v{version}
 * mylist:{userId}:heads
 * mylist:lock:{userId}:{cursorSignature}
 * </pre>
 */
final class MyListCacheKeys {

    static final String PREFIX = "mylist:";

    private MyListCacheKeys() {}

    static String version(UserId userId) {
        return PREFIX + userId + ":version";
    }

    static String page(UserId userId, CursorSignature signature, long version) {
        return PREFIX + userId + ":page:" + signature + ":v" + version;
    }

    static String firstPageLimits(UserId userId) {
        return PREFIX + userId + ":heads";
    }

    static String lock(UserId userId, CursorSignature signature) {
        return PREFIX + "lock:" + userId + ":" + signature;
    }
}
