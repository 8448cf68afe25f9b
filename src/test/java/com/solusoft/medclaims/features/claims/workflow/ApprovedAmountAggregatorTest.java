package com.solusoft.medclaims.features.claims.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.claims.model.Claim;
import com.solusoft.medclaims.features.claims.model.ClaimStatus;
import com.solusoft.medclaims.features.claims.repository.ClaimRepository;
import com.solusoft.medclaims.features.reviews.repository.ReviewItemRepository;

public class ApprovedAmountAggregatorTest {

    @Mock
    private ReviewItemRepository reviewItemRepository;

    @Mock
    private ClaimRepository claimRepository;

    private ApprovedAmountAggregator aggregator;

    private Claim claim;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        aggregator = new ApprovedAmountAggregator(reviewItemRepository, claimRepository);

        claim = new Claim();
        claim.setId(7L);
        claim.setReferenceNumber("CLM-0000ABCD");
        claim.setRequestedAmount(new BigDecimal("1000.00"));
        claim.setStatus(ClaimStatus.APPROVED);
        when(claimRepository.findById(7L)).thenReturn(Optional.of(claim));
        when(claimRepository.save(any(Claim.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    public void testRecalculate_storesFullSum() {
        when(reviewItemRepository.sumApprovedAmountByClaimId(7L)).thenReturn(new BigDecimal("750.5"));

        BigDecimal total = aggregator.recalculate(7L);

        assertEquals(new BigDecimal("750.50"), total);
        ArgumentCaptor<Claim> saved = ArgumentCaptor.forClass(Claim.class);
        verify(claimRepository).save(saved.capture());
        assertEquals(new BigDecimal("750.50"), saved.getValue().getApprovedAmount());
    }

    @Test
    public void testRecalculate_noItems_countsAsZero() {
        when(reviewItemRepository.sumApprovedAmountByClaimId(7L)).thenReturn(null);

        assertEquals(new BigDecimal("0.00"), aggregator.recalculate(7L));
        assertEquals(new BigDecimal("0.00"), claim.getApprovedAmount());
    }

    @Test
    public void testRecalculate_totalAboveRequested_throwsAndDoesNotSave() {
        when(reviewItemRepository.sumApprovedAmountByClaimId(7L)).thenReturn(new BigDecimal("1000.01"));

        assertThrows(InconsistentStateException.class, () -> aggregator.recalculate(7L));
        verify(claimRepository, never()).save(any(Claim.class));
    }

    @Test
    public void testRecalculate_unknownClaim_throwsNotFound() {
        when(claimRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> aggregator.recalculate(99L));
    }
}
