package com.hostelbooking.inventory.domain.repository;

import com.hostelbooking.inventory.domain.ledger.InventoryLedger;
import com.hostelbooking.inventory.domain.ledger.JpaInventoryLedger;
import com.hostelbooking.inventory.domain.model.LedgerEntry;
import com.hostelbooking.inventory.domain.model.LedgerStatus;
import com.hostelbooking.inventory.domain.model.StayInterval;
import com.hostelbooking.inventory.support.TestRooms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.hostelbooking.inventory.support.TestRooms.MIXTO_12A;
import static com.hostelbooking.inventory.support.TestRooms.MIXTO_7;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * The ledger queries behind {@link JpaInventoryLedger}, against a real PostgreSQL.
 * Only the JPA layer is loaded (no Redis, Kafka or Redisson).
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@EntityScan("com.hostelbooking.inventory.domain.model")
@Testcontainers(disabledWithoutDocker = true)
class LedgerEntryRepositoryIntegrationTest {

    private static final LocalDate MAY_20 = LocalDate.of(2026, 5, 20);
    private static final LocalDate MAY_22 = LocalDate.of(2026, 5, 22);
    private static final LocalDate MAY_24 = LocalDate.of(2026, 5, 24);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("inventory_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
    }

    @Autowired
    private LedgerEntryRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private InventoryLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new JpaInventoryLedger(repository);
    }

    private LedgerEntry persist(LedgerEntry entry) {
        LedgerEntry saved = repository.saveAndFlush(entry);
        entityManager.clear();
        return saved;
    }

    @Test
    @DisplayName("Overlap is half-open: a stay ending on a date does not overlap one starting on it")
    void findLiveOverlapping_halfOpen() {
        LedgerEntry first = persist(TestRooms.confirmedDirect(MIXTO_7, MAY_20, MAY_22, 1, 2));
        LedgerEntry second = persist(TestRooms.confirmedDirect(MIXTO_7, MAY_22, MAY_24, 1));
        LedgerEntry cancelled = TestRooms.confirmedDirect(MIXTO_7, MAY_22, MAY_24, 3);
        cancelled.setStatus(LedgerStatus.CANCELLED);
        persist(cancelled);
        persist(TestRooms.confirmedDirect(MIXTO_12A, MAY_22, MAY_24, 1));

        List<LedgerEntry> overlapping = ledger.findLiveOverlapping(MIXTO_7.getId(), StayInterval.of(MAY_22, MAY_24));

        assertThat(overlapping).extracting(LedgerEntry::getId).containsExactly(second.getId());
        assertThat(ledger.findLiveOverlapping(MIXTO_7.getId(), StayInterval.of(MAY_20, MAY_24)))
                .extracting(LedgerEntry::getId)
                .containsExactly(first.getId(), second.getId());
        assertThat(ledger.findLiveOverlapping(StayInterval.of(MAY_22, MAY_24))).hasSize(2);
    }

    @Test
    @DisplayName("Bed set and version survive a round trip through the database")
    void save_persistsBedsAndVersion() {
        LedgerEntry saved = persist(TestRooms.confirmedDirect(MIXTO_7, MAY_20, MAY_22, 7, 3, 5));

        LedgerEntry reloaded = ledger.findById(saved.getId()).orElseThrow();

        assertThat(reloaded.sortedBeds()).containsExactly(3, 5, 7);
        assertThat(reloaded.getVersion()).isNotNull();
    }

    @Test
    @DisplayName("Imports are found by external id and by feed; cancelled imports are not")
    void findImported() {
        LedgerEntry live = persist(TestRooms.imported(MIXTO_7, "airbnb", "HM1", 3L, MAY_20, MAY_22, 1));
        LedgerEntry gone = TestRooms.imported(MIXTO_7, "airbnb", "HM2", 3L, MAY_22, MAY_24, 2);
        gone.setStatus(LedgerStatus.CANCELLED);
        persist(gone);

        assertThat(ledger.findImported(MIXTO_7.getId(), "airbnb", "HM1"))
                .get().extracting(LedgerEntry::getId).isEqualTo(live.getId());
        assertThat(ledger.findImported(MIXTO_7.getId(), "booking.com", "HM1")).isEmpty();
        assertThat(ledger.findImported(MIXTO_7.getId(), "airbnb", "HM2")).isEmpty();
        assertThat(ledger.findImportedByFeed(3L, MAY_20)).extracting(LedgerEntry::getExternalId).containsExactly("HM1");
        assertThat(ledger.findImportedByFeed(3L, MAY_22)).isEmpty();
    }

    @Test
    @DisplayName("Holds expiring at or before now are returned oldest first")
    void findHoldsExpiredAt() {
        LocalDateTime now = LocalDateTime.of(2026, 5, 4, 10, 0);
        persist(TestRooms.hold(MIXTO_7, MAY_20, MAY_22, now.plusMinutes(1), 1));
        LedgerEntry atNow = persist(TestRooms.hold(MIXTO_7, MAY_20, MAY_22, now, 2));
        LedgerEntry earlier = persist(TestRooms.hold(MIXTO_7, MAY_20, MAY_22, now.minusMinutes(5), 3));

        assertThat(ledger.findHoldsExpiredAt(now))
                .extracting(LedgerEntry::getId)
                .containsExactly(earlier.getId(), atNow.getId());
    }

    @Test
    @DisplayName("Confirmed entries for export are ordered by check-in")
    void findConfirmedFrom() {
        LedgerEntry later = persist(TestRooms.confirmedDirect(MIXTO_7, MAY_22, MAY_24, 1));
        LedgerEntry earlier = persist(TestRooms.confirmedDirect(MIXTO_7, MAY_20, MAY_22, 2));
        persist(TestRooms.hold(MIXTO_7, MAY_20, MAY_22, LocalDateTime.of(2026, 5, 4, 10, 15), 3));

        assertThat(ledger.findConfirmedFrom(MIXTO_7.getId(), MAY_20.minusDays(1)))
                .extracting(LedgerEntry::getId)
                .containsExactly(earlier.getId(), later.getId());
    }
}
