package com.psl.search.query;

/**
 * The requested offset window reaches past the deepest page served by offset paging.
 */
public class CursorRequiredException extends QueryException {
    private final int maxDepth;

    public CursorRequiredException(int maxDepth) {
        super("start + size may not exceed " + maxDepth + "; follow the cursor link to page deeper");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
