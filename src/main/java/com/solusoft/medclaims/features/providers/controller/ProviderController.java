package com.solusoft.medclaims.features.providers.controller;

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
import com.solusoft.medclaims.features.providers.model.Provider;
import com.solusoft.medclaims.features.providers.model.ProviderRequest;
import com.solusoft.medclaims.features.providers.service.ProviderService;
import com.solusoft.medclaims.security.ClaimsPrincipal;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/v1/providers")
public class ProviderController {

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @Audited("create_provider")
    @PostMapping
    public ResponseEntity<Provider> create(@AuthenticationPrincipal ClaimsPrincipal principal,
                                         @Valid @RequestBody ProviderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(providerService.create(principal, request));
    }

    @GetMapping
    public List<Provider> list(@AuthenticationPrincipal ClaimsPrincipal principal,
                             @RequestParam(defaultValue = "0") int page,
                             @RequestParam(defaultValue = "20") int size) {
        return providerService.list(principal, page, size);
    }

    @GetMapping("/{id}")
    public Provider get(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long id) {
        return providerService.get(principal, id);
    }

    @Audited("update_provider")
    @PutMapping("/{id}")
    public Provider update(@AuthenticationPrincipal ClaimsPrincipal principal,
                         @PathVariable Long id,
                         @Valid @RequestBody ProviderRequest request) {
        return providerService.update(principal, id, request);
    }

    @Audited("delete_provider")
    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@AuthenticationPrincipal ClaimsPrincipal principal, @PathVariable Long id) {
        providerService.delete(principal, id);
        return Map.of("message", "Provider deleted successfully");
    }
}
