package vn.com.fecredit.fileportal.model;

public enum StorageMode {
    /** Chunks and final objects live on the local filesystem. */
    LOCAL,
    /** Chunks are parts of an S3 multipart upload; final objects are S3 keys. */
    REMOTE
}
