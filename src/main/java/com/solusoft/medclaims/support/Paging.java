package com.solusoft.medclaims.support;

/**
 * Page/size query parameters turned into LIMIT/OFFSET values.
 */
public final class Paging {

    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 100;

    private Paging() {
    }

    public static int limit(int size) {
        if (size <= 0) {
            return DEFAULT_SIZE;
        }
        return Math.min(size, MAX_SIZE);
    }

    public static long offset(int page, int size) {
        return (long) Math.max(page, 0) * limit(size);
    }
}
