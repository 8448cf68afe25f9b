package com.solusoft.medclaims.features.employers.service;

import static com.solusoft.medclaims.features.audit.service.AuditTrail.details;

import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.solusoft.medclaims.exception.ResourceNotFoundException;
import com.solusoft.medclaims.features.audit.model.AuditAction;
import com.solusoft.medclaims.features.audit.service.AuditTrail;
import com.solusoft.medclaims.features.employers.model.Employer;
import com.solusoft.medclaims.features.employers.model.EmployerRequest;
import com.solusoft.medclaims.features.employers.repository.EmployerRepository;
import com.solusoft.medclaims.security.AccessPolicy;
import com.solusoft.medclaims.security.ClaimsPrincipal;
import com.solusoft.medclaims.security.Operation;
import com.solusoft.medclaims.support.Paging;

@Service
public class EmployerService {

    private final EmployerRepository repository;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;

    public EmployerService(EmployerRepository repository, AccessPolicy accessPolicy, AuditTrail auditTrail) {
        this.repository = repository;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
    }

    @Transactional
    public Employer create(ClaimsPrincipal principal, EmployerRequest request) {
        accessPolicy.require(principal, Operation.MANAGE_REFERENCE_DATA);
        Instant now = Instant.now();
        Employer employer = new Employer();
        apply(employer, request);
        employer.setCreatedAt(now);
        employer.setUpdatedAt(now);
        employer = repository.save(employer);

        auditTrail.record(principal, AuditAction.CREATE, "Employer", employer.getId(), details("name", employer.getName()));
        return employer;
    }

    @Transactional(readOnly = true)
    public List<Employer> list(ClaimsPrincipal principal, int page, int size) {
        accessPolicy.require(principal, Operation.READ_REFERENCE_DATA);
        return repository.findPage(Paging.limit(size), Paging.offset(page, size));
    }

    @Transactional(readOnly = true)
    public Employer get(ClaimsPrincipal principal, Long id) {
        accessPolicy.require(principal, Operation.READ_REFERENCE_DATA);
        return load(id);
    }

    @Transactional
    public Employer update(ClaimsPrincipal principal, Long id, EmployerRequest request) {
        accessPolicy.require(principal, Operation.MANAGE_REFERENCE_DATA);
        Employer employer = load(id);
        apply(employer, request);
        employer.setUpdatedAt(Instant.now());
        employer = repository.save(employer);

        auditTrail.record(principal, AuditAction.UPDATE, "Employer", id, details("name", employer.getName()));
        return employer;
    }

    @Transactional
    public void delete(ClaimsPrincipal principal, Long id) {
        accessPolicy.require(principal, Operation.MANAGE_REFERENCE_DATA);
        Employer employer = load(id);
        repository.delete(employer);
        auditTrail.record(principal, AuditAction.DELETE, "Employer", id, details("name", employer.getName()));
    }

    private Employer load(Long id) {
        return repository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.of("Employer", id));
    }

    private static void apply(Employer employer, EmployerRequest request) {
        employer.setName(request.name().trim());
        employer.setContactPerson(request.contactPerson().trim());
        employer.setContactEmail(request.contactEmail().trim());
        employer.setContactPhone(request.contactPhone().trim());
    }
}
