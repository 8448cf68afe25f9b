package com.solusoft.medclaims.features.payments.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.payments.model.CreatePaymentRequest;
import com.solusoft.medclaims.features.payments.model.PaymentStatus;
import com.solusoft.medclaims.features.payments.model.PaymentUpdate;
import com.solusoft.medclaims.features.payments.model.PaymentView;
import com.solusoft.medclaims.features.payments.service.PaymentService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1")
public class PaymentController {

    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @Audited("create_payment")
    @PostMapping("/claims/{claimId}/payments")
    public ResponseEntity<PaymentView> create(@AuthenticationPrincipal ClaimsPrincipal principal,
                                              @PathVariable Long claimId,
                                              @Valid @RequestBody CreatePaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentService.create(principal, claimId, request));
    }

    @GetMapping("/payments")
    public List<PaymentView> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                                  @RequestParam(required = false) Long claimId,
                                  @RequestParam(required = false) PaymentStatus status,
                                  @RequestParam(defaultValue = "0") int page,
                                  @RequestParam(defaultValue = "20") int size) {
        return paymentService.list(principal, claimId, status, page, size);
    }

    @GetMapping("/payments/{paymentId}")
    public PaymentView get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long paymentId) {
        return paymentService.get(principal, paymentId);
    }

    @Audited("update_payment")
    @PutMapping("/payments/{paymentId}")
    public PaymentView update(@AuthenticationPrincipal ClaimsPrincipal principal,
                              @PathVariable Long paymentId,
                              @Valid @RequestBody PaymentUpdate update) {
        return paymentService.update(principal, paymentId, update);
    }
}
