package com.archivist.sync.review;

public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
