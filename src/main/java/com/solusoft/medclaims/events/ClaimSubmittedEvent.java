package com.solusoft.medclaims.events;

public record ClaimSubmittedEvent(Long claimId, String referenceNumber, Long policyholderId) {}
