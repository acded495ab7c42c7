package com.healthauth.api.consent;

import com.healthauth.api.authority.HealthAuthService;
import com.healthauth.api.error.LedgerResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

import static com.healthauth.api.authority.AuthorityController.CALLER_HEADER;

/**
 * REST API for patient consent. The caller is the patient.
 */
@RestController
@RequestMapping("/api/v1/consents")
public class ConsentController {

    private final HealthAuthService healthAuthService;

    public ConsentController(HealthAuthService healthAuthService) {
        this.healthAuthService = healthAuthService;
    }

    /**
     * Grant a doctor access.
     * PUT /api/v1/consents/{doctor}
     */
    @PutMapping("/{doctor}")
    public ResponseEntity<?> grantAccess(
            @RequestHeader(CALLER_HEADER) String patient,
            @PathVariable String doctor) {
        return LedgerResponses.toEmptyResponse(healthAuthService.grantAccess(patient, doctor));
    }

    /**
     * Revoke a doctor's access.
     * DELETE /api/v1/consents/{doctor}
     */
    @DeleteMapping("/{doctor}")
    public ResponseEntity<?> revokeAccess(
            @RequestHeader(CALLER_HEADER) String patient,
            @PathVariable String doctor) {
        return LedgerResponses.toEmptyResponse(healthAuthService.revokeAccess(patient, doctor));
    }

    /**
     * Check a grant.
     * GET /api/v1/consents/{patient}/{doctor}
     */
    @GetMapping("/{patient}/{doctor}")
    public ResponseEntity<ConsentStatusResponse> getConsent(
            @PathVariable String patient,
            @PathVariable String doctor) {
        return ResponseEntity.ok(new ConsentStatusResponse(
                patient, doctor, healthAuthService.isGranted(patient, doctor)));
    }

    /**
     * Doctors a patient currently grants access to.
     * GET /api/v1/consents/{patient}
     */
    @GetMapping("/{patient}")
    public ResponseEntity<GrantedDoctorsResponse> getGrantedDoctors(@PathVariable String patient) {
        return ResponseEntity.ok(new GrantedDoctorsResponse(
                patient, healthAuthService.getGrantedDoctors(patient)));
    }

    public record ConsentStatusResponse(String patient, String doctor, boolean granted) {}

    public record GrantedDoctorsResponse(String patient, Set<String> doctors) {}
}
