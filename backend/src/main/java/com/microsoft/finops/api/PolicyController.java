package com.microsoft.finops.api;

import com.microsoft.finops.domain.model.Policy;
import com.microsoft.finops.governance.PolicyService;
import com.microsoft.finops.governance.PolicyService.PolicyRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/policies")
@RequiredArgsConstructor
@Tag(name = "Policies", description = "Governance policy configuration")
@SecurityRequirement(name = "bearer-jwt")
public class PolicyController {

    private final PolicyService policyService;

    @PostMapping
    @Operation(summary = "Create a policy", description = "Malformed policies are rejected with 400")
    public ResponseEntity<Policy> create(@Valid @RequestBody PolicyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(policyService.create(request));
    }

    @GetMapping
    @Operation(summary = "List policies")
    public ResponseEntity<List<Policy>> list() {
        return ResponseEntity.ok(policyService.list());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a policy")
    public ResponseEntity<Policy> get(@PathVariable Long id) {
        return ResponseEntity.ok(policyService.get(id));
    }

    @PostMapping("/{id}/disable")
    @Operation(summary = "Disable a policy", description = "Disabled policies are skipped by later evaluation cycles")
    public ResponseEntity<Policy> disable(@PathVariable Long id) {
        return ResponseEntity.ok(policyService.disable(id));
    }

    @PostMapping("/{id}/enable")
    @Operation(summary = "Enable a policy")
    public ResponseEntity<Policy> enable(@PathVariable Long id) {
        return ResponseEntity.ok(policyService.enable(id));
    }
}
