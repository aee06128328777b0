package com.archivist.sync.review;

import com.archivist.sync.api.Page;
import com.archivist.sync.api.PageRequest;
import com.archivist.sync.core.model.TargetType;

import java.util.Optional;

/**
 * Mapping proposals held for manual approval.
 */
public interface ReviewQueue {

    /**
     * Adds an item. A pending item for the same source record is replaced.
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByTargetType(TargetType targetType, PageRequest page);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is not pending
     */
    void reject(String reviewId, String reviewerId, String notes);

    Optional<ReviewItem> get(String reviewId);

    Optional<ReviewItem> findPendingBySource(String sourceId);

    long countPending();
}
