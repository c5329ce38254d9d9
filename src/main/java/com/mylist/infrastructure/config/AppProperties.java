package com.mylist.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private MyList myList = new MyList();

    public MyList getMyList() {
        return myList;
    }

    public void setMyList(MyList myList) {
        this.myList = myList;
    }

    public static class MyList {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
        private long pageCacheTtlMs = 300_000;
        private long lockTtlMs = 5_000;
        private long lockPollIntervalMs = 50;
        private long lockMaxWaitMs = 1_000;
        private String cursorSecret;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public long getPageCacheTtlMs() {
            return pageCacheTtlMs;
        }

        public void setPageCacheTtlMs(long pageCacheTtlMs) {
            this.pageCacheTtlMs = pageCacheTtlMs;
        }

        public long getLockTtlMs() {
            return lockTtlMs;
        }

        public void setLockTtlMs(long lockTtlMs) {
            this.lockTtlMs = lockTtlMs;
        }

        public long getLockPollIntervalMs() {
            return lockPollIntervalMs;
        }

        public void setLockPollIntervalMs(long lockPollIntervalMs) {
            this.lockPollIntervalMs = lockPollIntervalMs;
        }

        public long getLockMaxWaitMs() {
            return lockMaxWaitMs;
        }

        public void setLockMaxWaitMs(long lockMaxWaitMs) {
            this.lockMaxWaitMs = lockMaxWaitMs;
        }

        public String getCursorSecret() {
            return cursorSecret;
        }

        public void setCursorSecret(String cursorSecret) {
            this.cursorSecret = cursorSecret;
        }

        public Duration pageCacheTtl() {
            return Duration.ofMillis(pageCacheTtlMs);
        }

        public Duration lockTtl() {
            return Duration.ofMillis(lockTtlMs);
        }
    }
}
