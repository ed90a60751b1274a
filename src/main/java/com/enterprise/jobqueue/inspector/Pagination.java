package com.enterprise.jobqueue.inspector;

/**
 * Page metadata returned alongside listed jobs
 */
public final class Pagination {
    
    private final int page;
    private final int pageSize;
    private final long total;
    private final int totalPages;
    
    public Pagination(int page, int pageSize, long total) {
        this.page = page;
        this.pageSize = pageSize;
        this.total = total;
        this.totalPages = (int) Math.max(1, (total + pageSize - 1) / pageSize);
    }
    
    public int getPage() { return page; }
    
    public int getPageSize() { return pageSize; }
    
    public long getTotal() { return total; }
    
    public int getTotalPages() { return totalPages; }
}
