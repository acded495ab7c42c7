package com.healthauth.api.record;

import com.healthauth.api.authority.HealthAuthService;
import com.healthauth.api.error.LedgerResponses;
import com.healthauth.api.error.RecordNotFoundException;
import com.healthauth.core.domain.MedicalRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.healthauth.api.authority.AuthorityController.CALLER_HEADER;

/**
 * REST API for medical record references. The caller of a write is the doctor.
 */
@RestController
@RequestMapping("/api/v1/records")
public class RecordController {

    private final HealthAuthService healthAuthService;

    public RecordController(HealthAuthService healthAuthService) {
        this.healthAuthService = healthAuthService;
    }

    /**
     * Add a record.
     * POST /api/v1/records
     */
    @PostMapping
    public ResponseEntity<?> addRecord(
            @RequestHeader(CALLER_HEADER) String doctor,
            @Valid @RequestBody AddRecordRequest request) {
        return LedgerResponses.toResponse(
                healthAuthService.addRecord(doctor, request.patient(), request.fingerprint()),
                HttpStatus.CREATED,
                AddRecordResponse::new);
    }

    /**
     * Get a record.
     * GET /api/v1/records/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<MedicalRecord> getRecord(@PathVariable long id) {
        MedicalRecord record = healthAuthService.getRecord(id)
                .orElseThrow(() -> new RecordNotFoundException("Record not found: " + id));
        return ResponseEntity.ok(record);
    }

    /**
     * Records of a patient.
     * GET /api/v1/records?patient={patient}
     */
    @GetMapping
    public ResponseEntity<List<MedicalRecord>> getRecords(@RequestParam String patient) {
        return ResponseEntity.ok(healthAuthService.getRecordsFor(patient));
    }

    public record AddRecordRequest(
            String patient,
            @NotNull String fingerprint
    ) {}

    public record AddRecordResponse(long recordId) {}
}
