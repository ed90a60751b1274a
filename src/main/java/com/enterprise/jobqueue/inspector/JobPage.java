package com.enterprise.jobqueue.inspector;

import java.util.Collections;
import java.util.List;

/**
 * One page of listed jobs
 */
public final class JobPage<T> {
    
    private final List<T> items;
    private final Pagination pagination;
    
    public JobPage(List<T> items, Pagination pagination) {
        this.items = Collections.unmodifiableList(items);
        this.pagination = pagination;
    }
    
    public List<T> getItems() {
        return items;
    }
    
    public Pagination getPagination() {
        return pagination;
    }
}
