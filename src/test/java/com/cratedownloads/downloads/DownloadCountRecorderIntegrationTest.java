package com.cratedownloads.downloads;

import com.cratedownloads.downloads.model.DailyDownloadCount;
import com.cratedownloads.shared.model.Crate;
import com.cratedownloads.shared.model.Version;
import com.cratedownloads.shared.model.VersionDownload;
import com.cratedownloads.shared.repository.CrateRepository;
import com.cratedownloads.shared.repository.VersionDownloadRepository;
import com.cratedownloads.shared.repository.VersionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for recording against a real PostgreSQL store:
 * concurrent increments, failure containment and isolation from the caller's transaction.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class DownloadCountRecorderIntegrationTest {

    @Container
    @SuppressWarnings("resource")
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("cratedownloads_test")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        // Server-side prepared statements off so renaming the table takes effect immediately
        registry.add("spring.datasource.url", () -> postgres.getJdbcUrl() + "&prepareThreshold=0");
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.hikari.maximum-pool-size", () -> "24");
        registry.add("spring.datasource.hikari.connection-timeout", () -> "30000");
    }

    private static final LocalDate DAY = LocalDate.of(2024, 1, 10);

    @Autowired
    private DownloadCountRecorder downloadCountRecorder;

    @Autowired
    private DownloadHistoryReader downloadHistoryReader;

    @Autowired
    private VersionDownloadRepository versionDownloadRepository;

    @Autowired
    private VersionRepository versionRepository;

    @Autowired
    private CrateRepository crateRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long versionId;

    @BeforeEach
    void setUp() {
        Crate crate = crateRepository.save(new Crate("crate-" + UUID.randomUUID()));
        versionId = versionRepository.save(new Version(crate, "1.0.0")).getId();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 10, 100})
    void concurrentRecordsAreAllCounted(int downloads) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(downloads, 16));
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < downloads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return downloadCountRecorder.recordDownload(versionId, DAY);
                };
                results.add(executor.submit(task));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                assertThat(result.get(60, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }

        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM version_downloads WHERE version_id = ?", Integer.class, versionId);
        assertThat(rows).isEqualTo(1);
        assertThat(countOn(DAY)).isEqualTo(downloads);
    }

    @Test
    void threeDownloadsShowUpAtEndOfFilledWindow() {
        for (int i = 0; i < 3; i++) {
            assertThat(downloadCountRecorder.recordDownload(versionId, DAY)).isTrue();
        }

        List<DailyDownloadCount> history = downloadHistoryReader.fetchHistory(versionId, DAY, true);

        assertThat(history).hasSize(90);
        assertThat(history.get(89)).isEqualTo(new DailyDownloadCount(DAY, 3));
        assertThat(history.subList(0, 89)).allMatch(day -> day.getDownloads() == 0);
        assertThat(downloadHistoryReader.fetchHistory(versionId, DAY, true)).isEqualTo(history);
    }

    @Test
    void historyReadDoesNotCreateRows() {
        downloadHistoryReader.fetchHistory(versionId, DAY, true);

        assertThat(versionDownloadRepository.findInRange(versionId, DAY.minusDays(89), DAY)).isEmpty();
    }

    @Test
    void offlineStoreLeavesNoResidue() {
        jdbcTemplate.execute("ALTER TABLE version_downloads RENAME TO version_downloads_offline");
        boolean counted;
        try {
            counted = downloadCountRecorder.recordDownload(versionId, DAY);
        } finally {
            jdbcTemplate.execute("ALTER TABLE version_downloads_offline RENAME TO version_downloads");
        }
        assertThat(counted).isFalse();

        assertThat(downloadCountRecorder.recordDownload(versionId, DAY)).isTrue();
        assertThat(countOn(DAY)).isEqualTo(1);
    }

    @Test
    void failedRecordDoesNotRollBackCallerTransaction() {
        TransactionTemplate outer = new TransactionTemplate(transactionManager);
        String crateName = "outer-" + UUID.randomUUID();

        Boolean counted = outer.execute(status -> {
            crateRepository.save(new Crate(crateName));
            // No such version: the foreign key rejects the counter row
            return downloadCountRecorder.recordDownload(Long.MAX_VALUE, DAY);
        });

        assertThat(counted).isFalse();
        assertThat(crateRepository.findByName(crateName)).isPresent();
        assertThat(versionDownloadRepository.findByVersionIdAndDownloadDate(Long.MAX_VALUE, DAY)).isEmpty();
    }

    @Test
    void callerRollbackDoesNotUndoRecordedDownload() {
        TransactionTemplate outer = new TransactionTemplate(transactionManager);

        Boolean counted = outer.execute(status -> {
            boolean result = downloadCountRecorder.recordDownload(versionId, DAY);
            status.setRollbackOnly();
            return result;
        });

        assertThat(counted).isTrue();
        assertThat(countOn(DAY)).isEqualTo(1);
    }

    private int countOn(LocalDate day) {
        return versionDownloadRepository.findByVersionIdAndDownloadDate(versionId, day)
                .map(VersionDownload::getDownloads)
                .orElse(0);
    }
}
