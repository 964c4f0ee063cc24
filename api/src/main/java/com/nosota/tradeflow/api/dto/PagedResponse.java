package com.nosota.tradeflow.api.dto;

import java.util.List;

public class PagedResponse<T> {

    private List<T> data;
    private int pageNumber;
    private int pageSize;
    private long totalRecords;
    private int totalPages;

    public PagedResponse() {
    }

    /**
     * Creates a paged response.
     *
     * @param data         Records of the current page only, at most {@code pageSize} of them
     * @param pageNumber   Current page number (0-indexed)
     * @param pageSize     Effective page size after server-side capping
     * @param totalRecords Number of records across all pages
     */
    public PagedResponse(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        this.data = data;
        this.pageNumber = pageNumber;
        this.pageSize = pageSize;
        this.totalRecords = totalRecords;
        this.totalPages = pageSize == 0 ? 0 : (int) Math.ceil((double) totalRecords / pageSize);
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
