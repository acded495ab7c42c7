package com.healthauth.api.authority;

import com.healthauth.api.error.ErrorResponse;
import com.healthauth.api.error.LedgerResponses;
import com.healthauth.core.audit.AuthorityAuditLog.VerificationResult;
import com.healthauth.core.domain.Principal;
import com.healthauth.core.domain.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for principal registration and administrator transfer.
 * The caller identity arrives in {@value #CALLER_HEADER}, authenticated upstream.
 */
@RestController
@RequestMapping("/api/v1")
public class AuthorityController {

    public static final String CALLER_HEADER = "X-Principal-Id";

    private final HealthAuthService healthAuthService;

    public AuthorityController(HealthAuthService healthAuthService) {
        this.healthAuthService = healthAuthService;
    }

    /**
     * Register a principal.
     * POST /api/v1/principals
     */
    @PostMapping("/principals")
    public ResponseEntity<?> registerPrincipal(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody RegisterPrincipalRequest request) {
        return LedgerResponses.toResponse(
                healthAuthService.register(caller, request.identity(), request.role()),
                HttpStatus.CREATED,
                PrincipalResponse::from);
    }

    /**
     * Get a principal.
     * GET /api/v1/principals/{identity}
     */
    @GetMapping("/principals/{identity}")
    public ResponseEntity<?> getPrincipal(@PathVariable String identity) {
        return healthAuthService.getPrincipal(identity)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(PrincipalResponse.from(p)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("NOT_FOUND", "Unknown principal: " + identity)));
    }

    /**
     * Get the current administrator.
     * GET /api/v1/authority
     */
    @GetMapping("/authority")
    public ResponseEntity<AuthorityResponse> getAuthority() {
        return ResponseEntity.ok(new AuthorityResponse(healthAuthService.getAdministrator()));
    }

    /**
     * Transfer the administrator role.
     * PUT /api/v1/authority
     */
    @PutMapping("/authority")
    public ResponseEntity<?> transferAuthority(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestBody TransferAuthorityRequest request) {
        return LedgerResponses.toResponse(
                healthAuthService.transferAuthority(caller, request.newAdministrator()),
                HttpStatus.OK,
                ignored -> new AuthorityResponse(healthAuthService.getAdministrator()));
    }

    /**
     * Verify the audit hash chain.
     * GET /api/v1/audit/verify
     */
    @GetMapping("/audit/verify")
    public ResponseEntity<VerificationResult> verifyAudit() {
        return ResponseEntity.ok(healthAuthService.verifyAudit());
    }

    // DTOs
    public record RegisterPrincipalRequest(
            String identity,
            @NotNull Role role
    ) {}

    public record TransferAuthorityRequest(String newAdministrator) {}

    public record AuthorityResponse(String administrator) {}

    public record PrincipalResponse(String identity, Role role, boolean exists) {
        static PrincipalResponse from(Principal principal) {
            return new PrincipalResponse(principal.identity(), principal.role(), principal.exists());
        }
    }
}
