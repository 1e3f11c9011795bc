package vn.com.fecredit.fileportal.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One page of the caller's files, newest first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileListResponse {

    private List<FileRecordView> items;
    private int page;
    private int size;
    private long totalElements;
    private int totalPages;

    public FileListResponse() {
    }

    public FileListResponse(List<FileRecordView> items, int page, int size, long totalElements, int totalPages) {
        this.items = items;
        this.page = page;
        this.size = size;
        this.totalElements = totalElements;
        this.totalPages = totalPages;
    }

    public List<FileRecordView> getItems() { return items; }
    public void setItems(List<FileRecordView> items) { this.items = items; }
    public int getPage() { return page; }
    public void setPage(int page) { this.page = page; }
    public int getSize() { return size; }
    public void setSize(int size) { this.size = size; }
    public long getTotalElements() { return totalElements; }
    public void setTotalElements(long totalElements) { this.totalElements = totalElements; }
    public int getTotalPages() { return totalPages; }
    public void setTotalPages(int totalPages) { this.totalPages = totalPages; }
}
