package com.healthauth.api.authority;

import com.healthauth.api.config.HealthAuthProperties;
import com.healthauth.core.audit.AuthorityAuditLog;
import com.healthauth.core.audit.AuthorityAuditLog.Outcome;
import com.healthauth.core.authority.AuthorityState;
import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.Role;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import net.jqwik.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the service facade without a Spring context.
 */
class HealthAuthServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private AuthorityAuditLog auditLog;
    private HealthAuthService service;

    @BeforeEach
    void setUp() {
        auditLog = new AuthorityAuditLog("test", CLOCK);
        service = newService(auditLog, true);
    }

    private static HealthAuthService newService(AuthorityAuditLog auditLog, boolean auditEnabled) {
        HealthAuthProperties properties = new HealthAuthProperties();
        properties.setInitialAdministrator("0xAlice_Admin");
        properties.setAuditEnabled(auditEnabled);
        return new HealthAuthService(new AuthorityState("0xAlice_Admin", CLOCK), auditLog, CLOCK, properties);
    }

    private static void setUpParties(HealthAuthService service) {
        service.register("0xAlice_Admin", "0xBob_Doctor", Role.DOCTOR);
        service.register("0xAlice_Admin", "0xCharlie_Patient", Role.PATIENT);
    }

    @Test
    void addRecord_timestampsWithServiceClock() {
        setUpParties(service);
        service.grantAccess("0xCharlie_Patient", "0xBob_Doctor");

        LedgerResult<Long> result = service.addRecord("0xBob_Doctor", "0xCharlie_Patient", "Hash_Xray_001");

        assertThat(result.value()).isZero();
        assertThat(service.getRecord(0).orElseThrow().createdAt()).isEqualTo(NOW);
        assertThat(service.getRecordsFor("0xCharlie_Patient")).hasSize(1);
    }

    @Test
    void resultsAreReturnedUnchanged() {
        setUpParties(service);

        assertThat(service.addRecord("0xBob_Doctor", "0xCharlie_Patient", "Hash_Xray_001").error())
                .isEqualTo(LedgerErrorKind.ACCESS_DENIED);
        assertThat(service.transferAuthority("0xEve", "0xEve").error())
                .isEqualTo(LedgerErrorKind.UNAUTHORIZED);
        assertThat(service.revokeAccess("0xCharlie_Patient", "0xBob_Doctor").error())
                .isEqualTo(LedgerErrorKind.NOT_GRANTED);
        assertThat(service.getAdministrator()).isEqualTo("0xAlice_Admin");
    }

    @Test
    void auditChainCapturesAcceptedAndRejectedOperations() {
        setUpParties(service);
        service.addRecord("0xBob_Doctor", "0xCharlie_Patient", "Hash_Xray_001");
        service.grantAccess("0xCharlie_Patient", "0xBob_Doctor");
        service.addRecord("0xBob_Doctor", "0xCharlie_Patient", "Hash_Xray_001");
        service.addRecord("0xBob_Doctor", "0xCharlie_Patient", "Hash_Xray_001");

        assertThat(auditLog.getEntries(Outcome.ACCEPTED)).hasSize(4);
        assertThat(auditLog.getEntries(Outcome.REJECTED))
                .extracting(e -> e.event().details().get("error"))
                .containsExactly("ACCESS_DENIED", "REPLAY_DETECTED");
        assertThat(service.verifyAudit().valid()).isTrue();
    }

    @Test
    void auditCanBeDisabled() {
        AuthorityAuditLog silentLog = new AuthorityAuditLog("silent", CLOCK);
        HealthAuthService silent = newService(silentLog, false);

        setUpParties(silent);
        silent.grantAccess("0xBob_Doctor", "0xBob_Doctor");

        assertThat(silentLog.size()).isZero();
    }

    @Test
    void concurrentTransfersLogTheActualOutgoingAdministrator() throws Exception {
        Logger serviceLogger = (Logger) LoggerFactory.getLogger(HealthAuthService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        serviceLogger.addAppender(appender);
        int hops = 4;
        ExecutorService executor = Executors.newFixedThreadPool(hops);
        try {
            for (int round = 0; round < 20; round++) {
                appender.list.clear();
                HealthAuthService fresh = newService(new AuthorityAuditLog("round", CLOCK), false);
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < hops; i++) {
                    String from = i == 0 ? "0xAlice_Admin" : "0xAdmin" + i;
                    String to = "0xAdmin" + (i + 1);
                    futures.add(executor.submit(() -> {
                        start.await();
                        // Each hop waits until the previous hop has handed over the role
                        do {
                            while (!fresh.getAdministrator().equals(from)) {
                                Thread.onSpinWait();
                            }
                        } while (fresh.transferAuthority(from, to).isFailure());
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }

                assertThat(appender.list)
                        .extracting(ILoggingEvent::getFormattedMessage)
                        .filteredOn(m -> m.startsWith("Administrator changed"))
                        .containsExactly(
                                "Administrator changed from 0xAlice_Admin to 0xAdmin1",
                                "Administrator changed from 0xAdmin1 to 0xAdmin2",
                                "Administrator changed from 0xAdmin2 to 0xAdmin3",
                                "Administrator changed from 0xAdmin3 to 0xAdmin4");
                assertThat(fresh.getAdministrator()).isEqualTo("0xAdmin4");
            }
        } finally {
            executor.shutdownNow();
            serviceLogger.detachAppender(appender);
        }
    }

    @Property(tries = 50)
    void grantAndRevokeAreReflectedInQueries(@ForAll("doctors") String doctor) {
        HealthAuthService fresh = newService(new AuthorityAuditLog("prop", CLOCK), true);
        setUpParties(fresh);
        fresh.register("0xAlice_Admin", doctor, Role.DOCTOR);

        fresh.grantAccess("0xCharlie_Patient", doctor);
        assertThat(fresh.isGranted("0xCharlie_Patient", doctor)).isTrue();
        assertThat(fresh.getGrantedDoctors("0xCharlie_Patient")).contains(doctor);

        fresh.revokeAccess("0xCharlie_Patient", doctor);
        assertThat(fresh.isGranted("0xCharlie_Patient", doctor)).isFalse();
        assertThat(fresh.getGrantedDoctors("0xCharlie_Patient")).doesNotContain(doctor);
    }

    @Provide
    Arbitrary<String> doctors() {
        return Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(10).map(s -> "0xDr" + s);
    }
}
