package com.solusoft.medclaims.features.reviews.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.reviews.model.CreateReviewRequest;
import com.solusoft.medclaims.features.reviews.model.ReviewItem;
import com.solusoft.medclaims.features.reviews.model.ReviewItemPatch;
import com.solusoft.medclaims.features.reviews.model.ReviewItemRequest;
import com.solusoft.medclaims.features.reviews.model.ReviewPatch;
import com.solusoft.medclaims.features.reviews.model.ReviewType;
import com.solusoft.medclaims.features.reviews.model.ReviewView;
import com.solusoft.medclaims.features.reviews.service.ReviewService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @Audited("create_review")
    @PostMapping("/claims/{claimId}/reviews")
    public ResponseEntity<ReviewView> create(@AuthenticationPrincipal ClaimsPrincipal principal,
                                             @PathVariable Long claimId,
                                             @Valid @RequestBody CreateReviewRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reviewService.create(principal, claimId, request));
    }

    @GetMapping("/reviews")
    public List<ReviewView> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                                 @RequestParam(required = false) Long claimId,
                                 @RequestParam(required = false) ReviewType reviewType,
                                 @RequestParam(defaultValue = "0") int page,
                                 @RequestParam(defaultValue = "20") int size) {
        return reviewService.list(principal, claimId, reviewType, page, size);
    }

    @GetMapping("/reviews/{reviewId}")
    public ReviewView get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long reviewId) {
        return reviewService.get(principal, reviewId);
    }

    @Audited("patch_review")
    @PatchMapping("/reviews/{reviewId}")
    public ReviewView patch(@AuthenticationPrincipal ClaimsPrincipal principal,
                            @PathVariable Long reviewId,
                            @Valid @RequestBody ReviewPatch patch) {
        return reviewService.patch(principal, reviewId, patch);
    }

    @Audited("add_review_item")
    @PostMapping("/reviews/{reviewId}/items")
    public ResponseEntity<ReviewItem> addItem(@AuthenticationPrincipal ClaimsPrincipal principal,
                                              @PathVariable Long reviewId,
                                              @Valid @RequestBody ReviewItemRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reviewService.addItem(principal, reviewId, request));
    }

    @Audited("update_review_item")
    @PutMapping("/reviews/{reviewId}/items/{itemId}")
    public ReviewItem updateItem(@AuthenticationPrincipal ClaimsPrincipal principal,
                                 @PathVariable Long reviewId,
                                 @PathVariable Long itemId,
                                 @Valid @RequestBody ReviewItemPatch patch) {
        return reviewService.updateItem(principal, reviewId, itemId, patch);
    }
}
