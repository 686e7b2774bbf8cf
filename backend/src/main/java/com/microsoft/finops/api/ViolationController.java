package com.microsoft.finops.api;

import com.microsoft.finops.domain.model.Severity;
import com.microsoft.finops.domain.model.Violation;
import com.microsoft.finops.domain.model.ViolationStatus;
import com.microsoft.finops.governance.ViolationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/violations")
@RequiredArgsConstructor
@Tag(name = "Violations", description = "Policy violations and their approval workflow")
@SecurityRequirement(name = "bearer-jwt")
public class ViolationController {

    private final ViolationService violationService;

    @GetMapping
    @Operation(summary = "List violations", description = "All filters are optional and combine with AND")
    public ResponseEntity<List<Violation>> list(
            @RequestParam(required = false) Long policyId,
            @RequestParam(required = false) ViolationStatus status,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String accountId
    ) {
        return ResponseEntity.ok(violationService.list(policyId, status, severity, accountId));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a violation")
    public ResponseEntity<Violation> get(@PathVariable Long id) {
        return ResponseEntity.ok(violationService.get(id));
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve an open violation", description = "Only OPEN violations can be actioned; otherwise 409")
    public ResponseEntity<Violation> approve(@PathVariable Long id, @RequestBody(required = false) ActionRequest request) {
        return ResponseEntity.ok(violationService.approve(id, noteOf(request)));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject an open violation", description = "Only OPEN violations can be actioned; otherwise 409")
    public ResponseEntity<Violation> reject(@PathVariable Long id, @RequestBody(required = false) ActionRequest request) {
        return ResponseEntity.ok(violationService.reject(id, noteOf(request)));
    }

    private static String noteOf(ActionRequest request) {
        return request == null ? null : request.note();
    }

    public record ActionRequest(String note) {
    }
}
