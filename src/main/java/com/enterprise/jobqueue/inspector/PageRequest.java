package com.enterprise.jobqueue.inspector;

import com.enterprise.jobqueue.exception.InvalidPageException;

/**
 * Validated page coordinates. Page sizes above the maximum are capped.
 */
public final class PageRequest {
    
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
    
    private final int page;
    private final int pageSize;
    
    private PageRequest(int page, int pageSize) {
        this.page = page;
        this.pageSize = pageSize;
    }
    
    public static PageRequest of(int page, int pageSize) throws InvalidPageException {
        if (page < 1) {
            throw new InvalidPageException("page must be at least 1, got " + page);
        }
        if (pageSize < 1) {
            throw new InvalidPageException("page_size must be at least 1, got " + pageSize);
        }
        return new PageRequest(page, Math.min(pageSize, MAX_PAGE_SIZE));
    }
    
    /**
     * Page 1 with the default size
     */
    public static PageRequest first() {
        return new PageRequest(DEFAULT_PAGE, DEFAULT_PAGE_SIZE);
    }
    
    public int getPage() {
        return page;
    }
    
    public int getPageSize() {
        return pageSize;
    }
    
    public long getOffset() {
        return (long) (page - 1) * pageSize;
    }
}
