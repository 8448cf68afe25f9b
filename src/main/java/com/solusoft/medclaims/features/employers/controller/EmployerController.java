package com.solusoft.medclaims.features.employers.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.solusoft.medclaims.aspect.Audited;
import com.solusoft.medclaims.features.employers.model.Employer;
import com.solusoft.medclaims.features.employers.model.EmployerRequest;
import com.solusoft.medclaims.features.employers.service.EmployerService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/employers")
public class EmployerController {

    private final EmployerService employerService;

    public EmployerController(EmployerService employerService) {
        this.employerService = employerService;
    }

    @Audited("create_employer")
    @PostMapping
    public ResponseEntity<Employer> create(@AuthenticationPrincipal ClaimsPrincipal principal,
                                         @Valid @RequestBody EmployerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(employerService.create(principal, request));
    }

    @GetMapping
    public List<Employer> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                             @RequestParam(defaultValue = "0") int page,
                             @RequestParam(defaultValue = "20") int size) {
        return employerService.list(principal, page, size);
    }

    @GetMapping("/{id}")
    public Employer get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long id) {
        return employerService.get(principal, id);
    }

    @Audited("update_employer")
    @PutMapping("/{id}")
    public Employer update(@AuthenticationPrincipal ClaimsPrincipal principal,
                         @PathVariable Long id,
                         @Valid @RequestBody EmployerRequest request) {
        return employerService.update(principal, id, request);
    }

    @Audited("delete_employer")
    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long id) {
        employerService.delete(principal, id);
        return Map.of("message", "Employer deleted successfully");
    }
}
