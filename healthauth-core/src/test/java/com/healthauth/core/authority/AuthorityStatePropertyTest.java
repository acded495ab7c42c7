package com.healthauth.core.authority;

import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.Principal;
import com.healthauth.core.domain.Role;
import com.healthauth.core.snapshot.LedgerSnapshot;
import net.jqwik.api.*;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for authority role checks, consent gating and administrator transfer.
 */
class AuthorityStatePropertyTest {

    private static final String ADMIN = "0xAlice_Admin";
    private static final String DOCTOR = "0xBob_Doctor";
    private static final String PATIENT = "0xCharlie_Patient";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Provide
    Arbitrary<String> identities() {
        return Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(16)
                .map(s -> "0x" + s);
    }

    @Provide
    Arbitrary<String> fingerprints() {
        return Arbitraries.strings().withCharRange('0', '9').withCharRange('a', 'f').ofLength(64);
    }

    private AuthorityState registeredAuthority() {
        AuthorityState authority = new AuthorityState(ADMIN);
        authority.registerDoctor(ADMIN, DOCTOR).getOrThrow();
        authority.registerPatient(ADMIN, PATIENT).getOrThrow();
        return authority;
    }

    // ==================== Replay ====================

    @Property(tries = 100)
    void replayIsRejectedWhateverHappensAfterCommit(
            @ForAll("fingerprints") String fingerprint,
            @ForAll("identities") String otherDoctor,
            @ForAll("identities") String otherPatient) {
        Assume.that(!otherDoctor.equals(otherPatient));
        Assume.that(!otherDoctor.equals(ADMIN) && !otherPatient.equals(ADMIN));
        AuthorityState authority = registeredAuthority();
        authority.grant(PATIENT, DOCTOR);
        assertThat(authority.addRecord(DOCTOR, PATIENT, fingerprint, NOW).success()).isTrue();

        authority.registerDoctor(ADMIN, otherDoctor);
        authority.registerPatient(ADMIN, otherPatient);
        authority.grant(otherPatient, otherDoctor);
        authority.revoke(PATIENT, DOCTOR);
        authority.grant(PATIENT, DOCTOR);

        assertThat(authority.addRecord(DOCTOR, PATIENT, fingerprint, NOW).error())
                .isEqualTo(LedgerErrorKind.REPLAY_DETECTED);
        assertThat(authority.addRecord(otherDoctor, otherPatient, fingerprint, NOW).error())
                .isEqualTo(LedgerErrorKind.REPLAY_DETECTED);
        assertThat(authority.recordCount()).isEqualTo(1);
    }

    // ==================== Consent Gating ====================

    @Property(tries = 100)
    void grantThenRevokeThenRetryIsDenied(@ForAll("fingerprints") String fingerprint) {
        AuthorityState authority = registeredAuthority();

        authority.grant(PATIENT, DOCTOR);
        authority.revoke(PATIENT, DOCTOR);

        assertThat(authority.isGranted(PATIENT, DOCTOR)).isFalse();
        assertThat(authority.addRecord(DOCTOR, PATIENT, fingerprint, NOW).error())
                .isEqualTo(LedgerErrorKind.ACCESS_DENIED);
        assertThat(authority.isCommitted(fingerprint)).isFalse();
    }

    @Property(tries = 50)
    void grantingTwiceEqualsGrantingOnce(@ForAll("identities") String doctor) {
        Assume.that(!doctor.equals(PATIENT) && !doctor.equals(ADMIN));
        AuthorityState once = registeredAuthority();
        AuthorityState twice = registeredAuthority();
        once.registerDoctor(ADMIN, doctor);
        twice.registerDoctor(ADMIN, doctor);

        once.grant(PATIENT, doctor);
        twice.grant(PATIENT, doctor);
        twice.grant(PATIENT, doctor);

        assertThat(twice.snapshot()).isEqualTo(once.snapshot());
    }

    // ==================== Role Checks ====================

    @Property(tries = 50)
    void doctorCannotManageConsent(@ForAll("identities") String target) {
        AuthorityState authority = registeredAuthority();

        assertThat(authority.grant(DOCTOR, target).error()).isEqualTo(LedgerErrorKind.UNAUTHORIZED);
        assertThat(authority.grant(DOCTOR, DOCTOR).error()).isEqualTo(LedgerErrorKind.UNAUTHORIZED);
        assertThat(authority.revoke(DOCTOR, target).error()).isEqualTo(LedgerErrorKind.UNAUTHORIZED);
    }

    @Property(tries = 50)
    void patientCannotAddRecords(@ForAll("fingerprints") String fingerprint) {
        AuthorityState authority = registeredAuthority();
        authority.grant(PATIENT, DOCTOR);

        assertThat(authority.addRecord(PATIENT, PATIENT, fingerprint, NOW).error())
                .isEqualTo(LedgerErrorKind.UNAUTHORIZED);
    }

    @Property(tries = 50)
    void onlyAdministratorCanRegister(@ForAll("identities") String caller, @ForAll("identities") String target) {
        Assume.that(!caller.equals(ADMIN));
        AuthorityState authority = registeredAuthority();
        LedgerSnapshot before = authority.snapshot();

        LedgerResult<Principal> result = authority.register(caller, target, Role.DOCTOR);

        assertThat(result.error()).isEqualTo(LedgerErrorKind.UNAUTHORIZED);
        assertThat(authority.snapshot()).isEqualTo(before);
    }

    // ==================== Administrator Transfer ====================

    @Property(tries = 100)
    void transferByNonAdministratorFailsAndKeepsAdministrator(
            @ForAll("identities") String attacker,
            @ForAll("identities") String target) {
        Assume.that(!attacker.equals(ADMIN));
        AuthorityState authority = registeredAuthority();
        LedgerSnapshot before = authority.snapshot();

        assertThat(authority.transfer(attacker, target).error()).isEqualTo(LedgerErrorKind.UNAUTHORIZED);
        assertThat(authority.administrator()).isEqualTo(ADMIN);
        assertThat(authority.snapshot()).isEqualTo(before);
    }

    @Property(tries = 100)
    void transferClearsBothRoles(@ForAll("identities") String successor) {
        Assume.that(!successor.equals(ADMIN));
        AuthorityState authority = registeredAuthority();
        authority.registerDoctor(ADMIN, ADMIN);

        assertThat(authority.transfer(ADMIN, successor).success()).isTrue();

        assertThat(authority.administrator()).isEqualTo(successor);
        assertThat(authority.principal(ADMIN)).contains(new Principal(ADMIN, Role.NONE, true));
        assertThat(authority.principal(successor)).contains(new Principal(successor, Role.NONE, true));
        assertThat(authority.isAdministrator(ADMIN)).isFalse();
        assertThat(authority.register(ADMIN, "0xLate", Role.DOCTOR).error())
                .isEqualTo(LedgerErrorKind.UNAUTHORIZED);
        assertThat(authority.register(successor, "0xLate", Role.DOCTOR).success()).isTrue();
    }
}
