package com.solusoft.medclaims.features.reviews.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.events.ClaimStatusChangedEvent;
import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.PermissionDeniedException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.claims.service.ClaimAccessService;
import com.solusoft.medclaims.features.claims.workflow.ApprovedAmountAggregator;
import com.solusoft.medclaims.features.claims.workflow.ClaimStatusTransitions;
import com.solusoft.medclaims.features.reviews.model.CreateReviewRequest;
import com.solusoft.medclaims.features.reviews.model.Review;
import com.solusoft.medclaims.features.reviews.model.ReviewDecision;
import com.solusoft.medclaims.features.reviews.model.ReviewItem;
import com.solusoft.medclaims.features.reviews.model.ReviewItemPatch;
import com.solusoft.medclaims.features.reviews.model.ReviewItemRequest;
import com.solusoft.medclaims.features.reviews.model.ReviewPatch;
import com.solusoft.medclaims.features.reviews.model.ReviewType;
import com.solusoft.medclaims.features.reviews.model.ReviewView;
import com.solusoft.medclaims.features.reviews.repository.ReviewItemRepository;
import com.solusoft.medclaims.features.reviews.repository.ReviewRepository;
import com.solusoft.medclaims.features.users.model.User;
import com.solusoft.medclaims.features.users.repository.UserRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

import lombok.extern.slf4j.Slf4j;

/**
 * Records reviewer decisions and drives the claim through its review stages.
 */
@Service
@Slf4j
public class ReviewService {

    private final ReviewRepository reviewRepository;
    private final ReviewItemRepository itemRepository;
    private final ClaimRepository claimRepository;
    private final UserRepository userRepository;
    private final ClaimAccessService claimAccess;
    private final ClaimStatusTransitions transitions;
    private final ApprovedAmountAggregator aggregator;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher events;
    private final AuditTrail auditTrail;

    public ReviewService(ReviewRepository reviewRepository,
                         ReviewItemRepository itemRepository,
                         ClaimRepository claimRepository,
                         UserRepository userRepository,
                         ClaimAccessService claimAccess,
                         ClaimStatusTransitions transitions,
                         ApprovedAmountAggregator aggregator,
                         AccessPolicy accessPolicy,
                         ApplicationEventPublisher events,
                         AuditTrail auditTrail) {
        this.reviewRepository = reviewRepository;
        this.itemRepository = itemRepository;
        this.claimRepository = claimRepository;
        this.userRepository = userRepository;
        this.claimAccess = claimAccess;
        this.transitions = transitions;
        this.aggregator = aggregator;
        this.accessPolicy = accessPolicy;
        this.events = events;
        this.auditTrail = auditTrail;
    }

    /**
     * Records a review and moves the claim to the status the decision leads to. The review and
     * the status change commit together or not at all.
     */
    @Transactional
    public ReviewView create(ClaimsPrincipal principal, Long claimId, CreateReviewRequest request) {
        log.info("Entering create review");
        log.debug("Input claimId: {}, type: {}, decision: {}", claimId, request.reviewType(), request.decision());
        accessPolicy.requireReviewType(principal, request.reviewType());

        Claim claim = claimAccess.loadClaim(claimId);
        ClaimStatus previous = claim.getStatus();
        ClaimStatus next = transitions.next(previous, request.reviewType(), request.decision());

        Instant now = Instant.now();
        Review review = new Review();
        review.setClaimId(claimId);
        review.setReviewerId(principal.userId());
        review.setReviewType(request.reviewType());
        review.setDecision(request.decision());
        review.setComments(request.comments());
        review.setRejectionReason(request.rejectionReason());
        review.setReviewedAt(now);
        review.setCreatedAt(now);
        review.setUpdatedAt(now);
        review = reviewRepository.save(review);

        moveClaim(principal, claim, next);
        auditTrail.record(principal, auditActionOf(request.decision()), "Review", review.getId(),
                details("claim_id", claimId, "review_type", request.reviewType(), "decision", request.decision()));

        log.info("{} review {} on claim {}: {} -> {}", request.reviewType(), review.getId(), claim.getReferenceNumber(),
                previous, next);
        return toView(review, List.of(), reviewerNames(List.of(review)));
    }

    @Transactional(readOnly = true)
    public List<ReviewView> list(ClaimsPrincipal principal, Long claimId, ReviewType reviewType, int page, int size) {
        accessPolicy.require(principal, Operation.READ_REVIEW);
        ReviewType typeFilter = reviewType;
        Optional<ReviewType> ownType = principal.isAdmin() ? Optional.empty() : accessPolicy.reviewTypeOf(principal.role());
        if (ownType.isPresent()) {
            if (reviewType != null && reviewType != ownType.get()) {
                throw new PermissionDeniedException("Role " + principal.role() + " may only list " + ownType.get() + " reviews");
            }
            typeFilter = ownType.get();
        }
        if (claimId != null) {
            claimAccess.loadAccessibleClaim(principal, claimId);
        }

        List<Review> reviews = reviewRepository.findVisible(claimId, typeFilter == null ? null : typeFilter.name(),
                claimAccess.ownerScope(principal), Paging.limit(size), Paging.offset(page, size));
        Map<Long, String> names = reviewerNames(reviews);
        return reviews.stream()
                .map(review -> toView(review, itemRepository.findByReviewId(review.getId()), names))
                .toList();
    }

    @Transactional(readOnly = true)
    public ReviewView get(ClaimsPrincipal principal, Long reviewId) {
        accessPolicy.require(principal, Operation.READ_REVIEW);
        Review review = loadReview(reviewId);
        requireReadable(principal, review);
        return toView(review, itemRepository.findByReviewId(reviewId), reviewerNames(List.of(review)));
    }

    /**
     * Reviewer and review type never change. A changed decision is only accepted while the claim
     * still sits where the old decision put it.
     */
    @Transactional
    public ReviewView patch(ClaimsPrincipal principal, Long reviewId, ReviewPatch patch) {
        log.info("Entering patch review");
        Review review = loadReview(reviewId);
        requireEditable(principal, review);

        if (patch.comments() != null) {
            review.setComments(patch.comments());
        }
        if (patch.rejectionReason() != null) {
            review.setRejectionReason(patch.rejectionReason());
        }
        ReviewDecision previousDecision = review.getDecision();
        boolean decisionChanged = patch.decision() != null && patch.decision() != previousDecision;
        if (decisionChanged) {
            Claim claim = claimAccess.loadClaim(review.getClaimId());
            ClaimStatus next = transitions.reviseDecision(claim.getStatus(), review.getReviewType(),
                    previousDecision, patch.decision());
            review.setDecision(patch.decision());
            review.setReviewedAt(Instant.now());
            moveClaim(principal, claim, next);
        }
        review.setUpdatedAt(Instant.now());
        review = reviewRepository.save(review);

        auditTrail.record(principal, decisionChanged ? auditActionOf(review.getDecision()) : AuditAction.UPDATE,
                "Review", reviewId, details("claim_id", review.getClaimId(), "decision", review.getDecision()));
        return toView(review, itemRepository.findByReviewId(reviewId), reviewerNames(List.of(review)));
    }

    @Transactional
    public ReviewItem addItem(ClaimsPrincipal principal, Long reviewId, ReviewItemRequest request) {
        log.info("Entering addItem");
        log.debug("Input reviewId: {}, item: {}, approved: {}", reviewId, request.itemName(), request.approvedAmount());
        Review review = loadReview(reviewId);
        requireEditable(principal, review);
        requireItemsOpen(review.getClaimId());
        requireWithinRequested(request.approvedAmount(), request.requestedAmount());

        Instant now = Instant.now();
        ReviewItem item = new ReviewItem();
        item.setReviewId(reviewId);
        item.setItemName(request.itemName().trim());
        item.setRequestedAmount(request.requestedAmount());
        item.setApprovedAmount(request.approvedAmount());
        item.setStatus(request.status());
        item.setRejectionReason(request.rejectionReason());
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        item = itemRepository.save(item);

        BigDecimal total = aggregator.recalculate(review.getClaimId());
        auditTrail.record(principal, AuditAction.CREATE, "ReviewItem", item.getId(),
                details("review_id", reviewId, "approved_amount", item.getApprovedAmount(), "claim_total", total));
        return item;
    }

    @Transactional
    public ReviewItem updateItem(ClaimsPrincipal principal, Long reviewId, Long itemId, ReviewItemPatch patch) {
        log.info("Entering updateItem");
        Review review = loadReview(reviewId);
        requireEditable(principal, review);
        requireItemsOpen(review.getClaimId());
        ReviewItem item = itemRepository.findByIdAndReviewId(itemId, reviewId)
                .orElseThrow(() -> ResourceNotFoundException.of("Review item", itemId));

        if (patch.itemName() != null && !patch.itemName().isBlank()) {
            item.setItemName(patch.itemName().trim());
        }
        if (patch.requestedAmount() != null) {
            item.setRequestedAmount(patch.requestedAmount());
        }
        if (patch.approvedAmount() != null) {
            item.setApprovedAmount(patch.approvedAmount());
        }
        if (patch.status() != null) {
            item.setStatus(patch.status());
        }
        if (patch.rejectionReason() != null) {
            item.setRejectionReason(patch.rejectionReason());
        }
        requireWithinRequested(item.getApprovedAmount(), item.getRequestedAmount());
        item.setUpdatedAt(Instant.now());
        item = itemRepository.save(item);

        BigDecimal total = aggregator.recalculate(review.getClaimId());
        auditTrail.record(principal, AuditAction.UPDATE, "ReviewItem", itemId,
                details("review_id", reviewId, "approved_amount", item.getApprovedAmount(), "claim_total", total));
        return item;
    }

    /** Reviews of a claim with their items, oldest first. */
    @Transactional(readOnly = true)
    public List<ReviewView> viewsForClaim(Long claimId) {
        List<Review> reviews = reviewRepository.findByClaimId(claimId);
        Map<Long, List<ReviewItem>> itemsByReview = itemRepository.findByClaimId(claimId).stream()
                .collect(Collectors.groupingBy(ReviewItem::getReviewId));
        Map<Long, String> names = reviewerNames(reviews);
        return reviews.stream()
                .sorted((a, b) -> a.getReviewedAt().compareTo(b.getReviewedAt()))
                .map(review -> toView(review, itemsByReview.getOrDefault(review.getId(), List.of()), names))
                .toList();
    }

    private void moveClaim(ClaimsPrincipal principal, Claim claim, ClaimStatus next) {
        ClaimStatus previous = claim.getStatus();
        if (previous == next) {
            return;
        }
        claim.setStatus(next);
        claim.setUpdatedAt(Instant.now());
        claimRepository.save(claim);

        events.publishEvent(new ClaimStatusChangedEvent(claim.getId(), claim.getReferenceNumber(),
                claimAccess.policyholderOf(claim), previous, next));
        auditTrail.record(principal, AuditAction.STATUS_CHANGE, "Claim", claim.getId(),
                details("old_status", previous, "new_status", next));
    }

    private Review loadReview(Long reviewId) {
        return reviewRepository.findById(reviewId)
                .orElseThrow(() -> ResourceNotFoundException.of("Review", reviewId));
    }

    private void requireReadable(ClaimsPrincipal principal, Review review) {
        if (!principal.isAdmin()) {
            accessPolicy.reviewTypeOf(principal.role())
                    .filter(own -> own != review.getReviewType())
                    .ifPresent(own -> {
                        throw new PermissionDeniedException("Role " + principal.role() + " may not read "
                                + review.getReviewType() + " reviews");
                    });
        }
        claimAccess.loadAccessibleClaim(principal, review.getClaimId());
    }

    private void requireEditable(ClaimsPrincipal principal, Review review) {
        accessPolicy.require(principal, Operation.UPDATE_REVIEW);
        if (!principal.isAdmin() && !Objects.equals(review.getReviewerId(), principal.userId())) {
            throw new PermissionDeniedException("Review " + review.getId() + " was recorded by another reviewer");
        }
    }

    private void requireItemsOpen(Long claimId) {
        Claim claim = claimAccess.loadClaim(claimId);
        ClaimStatus status = claim.getStatus();
        if (status == ClaimStatus.PENDING_PAYMENT || status.isTerminal()) {
            throw new InconsistentStateException("Claim " + claim.getReferenceNumber() + " is " + status
                    + ", its review items are frozen");
        }
    }

    private static void requireWithinRequested(BigDecimal approved, BigDecimal requested) {
        if (approved != null && requested != null && approved.compareTo(requested) > 0) {
            throw new IllegalArgumentException("Approved amount " + approved + " exceeds requested amount " + requested);
        }
    }

    private static AuditAction auditActionOf(ReviewDecision decision) {
        return decision == ReviewDecision.REJECTED ? AuditAction.REJECT : AuditAction.APPROVE;
    }

    private Map<Long, String> reviewerNames(Collection<Review> reviews) {
        List<Long> ids = reviews.stream()
                .map(Review::getReviewerId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return new HashMap<>();
        }
        return userRepository.findAllById(ids).stream()
                .filter(user -> user.getFullName() != null)
                .collect(Collectors.toMap(User::getId, User::getFullName, (a, b) -> a));
    }

    private static ReviewView toView(Review review, List<ReviewItem> items, Map<Long, String> names) {
        return new ReviewView(review.getId(), review.getClaimId(), review.getReviewerId(),
                names.get(review.getReviewerId()), review.getReviewType(), review.getDecision(),
                review.getComments(), review.getRejectionReason(), review.getReviewedAt(), items);
    }
}
