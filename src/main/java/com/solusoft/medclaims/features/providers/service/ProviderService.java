package com.solusoft.medclaims.features.providers.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.InconsistentStateException;
import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.providers.model.Provider;
import com.solusoft.medclaims.features.providers.model.ProviderRequest;
import com.solusoft.medclaims.features.providers.repository.ProviderRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

@Service
public class ProviderService {

    private final ProviderRepository repository;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;

    public ProviderService(ProviderRepository repository, AccessPolicy accessPolicy, AuditTrail auditTrail) {
        this.repository = repository;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
    }

    @Transactional
    public Provider create(ClaimsPrincipal principal, ProviderRequest request) {
        accessPolicy.require(principal, Operation.MANAGE_REFERENCE_DATA);
        requireUniqueEmail(request.contactEmail(), null);
        Instant now = Instant.now();
        Provider provider = new Provider();
        apply(provider, request);
        provider.setCreatedAt(now);
        provider.setUpdatedAt(now);
        provider = repository.save(provider);

        auditTrail.record(principal, AuditAction.CREATE, "Provider", provider.getId(), details("name", provider.getName()));
        return provider;
    }

    @Transactional(readOnly = true)
    public List<Provider> list(ClaimsPrincipal principal, int page, int size) {
        accessPolicy.require(principal, Operation.READ_REFERENCE_DATA);
        return repository.findPage(Paging.limit(size), Paging.offset(page, size));
    }

    @Transactional(readOnly = true)
    public Provider get(ClaimsPrincipal principal, Long id) {
        accessPolicy.require(principal, Operation.READ_REFERENCE_DATA);
        return load(id);
    }

    @Transactional
    public Provider update(ClaimsPrincipal principal, Long id, ProviderRequest request) {
        accessPolicy.require(principal, Operation.MANAGE_REFERENCE_DATA);
        Provider provider = load(id);
        requireUniqueEmail(request.contactEmail(), id);
        apply(provider, request);
        provider.setUpdatedAt(Instant.now());
        provider = repository.save(provider);

        auditTrail.record(principal, AuditAction.UPDATE, "Provider", id, details("name", provider.getName()));
        return provider;
    }

    @Transactional
    public void delete(ClaimsPrincipal principal, Long id) {
        accessPolicy.require(principal, Operation.MANAGE_REFERENCE_DATA);
        Provider provider = load(id);
        repository.delete(provider);
        auditTrail.record(principal, AuditAction.DELETE, "Provider", id, details("name", provider.getName()));
    }

    private Provider load(Long id) {
        return repository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.of("Provider", id));
    }

    private void requireUniqueEmail(String contactEmail, Long currentId) {
        repository.findByContactEmail(contactEmail.trim())
                .filter(existing -> !existing.getId().equals(currentId))
                .ifPresent(existing -> {
                    throw new InconsistentStateException("A provider with contact email " + contactEmail + " already exists");
                });
    }

    private static void apply(Provider provider, ProviderRequest request) {
        provider.setName(request.name().trim());
        provider.setContactPerson(request.contactPerson().trim());
        provider.setContactEmail(request.contactEmail().trim());
        provider.setContactPhone(request.contactPhone().trim());
    }
}
