package com.nosota.bankrec.api.dto;

import java.util.List;

/**
 * One page of results together with pagination metadata.
 *
 * @param <T> type of the page items
 */
public class PagedResponse<T> {

    private List<T> data;
    private int pageNumber;
    private int pageSize;
    private long totalRecords;
    private int totalPages;

    /**
     * Required by Jackson when the response is read back by a client.
     */
    public PagedResponse() {
    }

    /**
     * Creates a paged response.
     *
     * @param data         Items of the current page, at most {@code pageSize} of them
     * @param pageNumber   Zero-based page number
     * @param pageSize     Maximum number of items per page, positive
     * @param totalRecords Total number of items across all pages
     */
    public PagedResponse(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        this.data = data;
        this.pageNumber = pageNumber;
        this.pageSize = pageSize;
        this.totalRecords = totalRecords;
        this.totalPages = pageSize > 0 ? (int) Math.ceil((double) totalRecords / pageSize) : 0;
    }

    public List<T> getData() {
        return data;
    }

    public void setData(List<T> data) {
        this.data = data;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public void setPageNumber(int pageNumber) {
        this.pageNumber = pageNumber;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public void setTotalRecords(long totalRecords) {
        this.totalRecords = totalRecords;
    }

    public int getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(int totalPages) {
        this.totalPages = totalPages;
    }
}
