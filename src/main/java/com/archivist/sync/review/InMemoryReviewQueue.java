package com.archivist.sync.review;

import com.archivist.sync.api.Page;
import com.archivist.sync.api.PageRequest;
import com.archivist.sync.core.model.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Stream;

/**
 * In-memory implementation of {@link ReviewQueue}.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public synchronized ReviewItem submit(ReviewItem item) {
        findPendingBySource(item.getSourceId()).ifPresent(previous -> items.remove(previous.getId()));
        items.put(item.getId(), item);
        log.debug("review.submitted id={} source={} target={} score={}",
                item.getId(), item.getSourceId(), item.getProposal().targetType(), item.getScore());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return Page.of(pending().toList(), page);
    }

    @Override
    public Page<ReviewItem> getPendingByTargetType(TargetType targetType, PageRequest page) {
        return Page.of(pending().filter(i -> i.getProposal().targetType() == targetType).toList(), page);
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        requirePending(reviewId).markApproved(reviewerId, notes);
        log.info("review.approved id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        requirePending(reviewId).markRejected(reviewerId, notes);
        log.info("review.rejected id={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public Optional<ReviewItem> findPendingBySource(String sourceId) {
        return pending().filter(i -> i.getSourceId().equals(sourceId)).findFirst();
    }

    @Override
    public long countPending() {
        return pending().count();
    }

    private Stream<ReviewItem> pending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt).thenComparing(ReviewItem::getId));
    }

    private ReviewItem requirePending(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
