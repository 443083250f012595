package com.cratedownloads.downloads;

import com.cratedownloads.shared.repository.VersionDownloadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the upsert-increment sequence and its transaction boundary.
 */
@ExtendWith(MockitoExtension.class)
class VersionDownloadWriterTest {

    private static final Long VERSION_ID = 7L;
    private static final LocalDate DAY = LocalDate.of(2024, 1, 10);

    @Mock
    private VersionDownloadRepository repository;

    private VersionDownloadWriter writer;

    @BeforeEach
    void setUp() {
        writer = new VersionDownloadWriter(repository, 3);
    }

    @Test
    void createOrIncrement_incrementsExistingRow() {
        when(repository.incrementDownloads(VERSION_ID, DAY)).thenReturn(1);

        assertThat(writer.createOrIncrement(VERSION_ID, DAY)).isEqualTo(1);

        verify(repository, never()).insertIfAbsent(any(), any());
    }

    @Test
    void createOrIncrement_insertsWhenNoRowExists() {
        when(repository.incrementDownloads(VERSION_ID, DAY)).thenReturn(0);
        when(repository.insertIfAbsent(VERSION_ID, DAY)).thenReturn(1);

        assertThat(writer.createOrIncrement(VERSION_ID, DAY)).isEqualTo(1);

        InOrder order = inOrder(repository);
        order.verify(repository).incrementDownloads(VERSION_ID, DAY);
        order.verify(repository).insertIfAbsent(VERSION_ID, DAY);
    }

    @Test
    void createOrIncrement_retriesIncrementWhenInsertLosesRace() {
        when(repository.incrementDownloads(VERSION_ID, DAY)).thenReturn(0, 1);
        when(repository.insertIfAbsent(VERSION_ID, DAY)).thenReturn(0);

        assertThat(writer.createOrIncrement(VERSION_ID, DAY)).isEqualTo(2);

        verify(repository, times(2)).incrementDownloads(VERSION_ID, DAY);
        verify(repository, times(1)).insertIfAbsent(VERSION_ID, DAY);
    }

    @Test
    void createOrIncrement_failsAfterBoundedAttempts() {
        when(repository.incrementDownloads(VERSION_ID, DAY)).thenReturn(0);
        when(repository.insertIfAbsent(VERSION_ID, DAY)).thenReturn(0);

        assertThatThrownBy(() -> writer.createOrIncrement(VERSION_ID, DAY))
                .isInstanceOf(DownloadCountConflictException.class)
                .hasMessageContaining("after 3 attempt(s)");

        verify(repository, times(3)).incrementDownloads(VERSION_ID, DAY);
        verify(repository, times(3)).insertIfAbsent(VERSION_ID, DAY);
    }

    @Test
    void createOrIncrement_propagatesStoreFailure() {
        when(repository.incrementDownloads(VERSION_ID, DAY))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> writer.createOrIncrement(VERSION_ID, DAY))
                .isInstanceOf(DataAccessResourceFailureException.class);

        verify(repository, never()).insertIfAbsent(any(), any());
    }

    @Test
    void createOrIncrement_runsInNewTransactionWithConfiguredTimeout() throws Exception {
        Transactional transactional = VersionDownloadWriter.class
                .getMethod("createOrIncrement", Long.class, LocalDate.class)
                .getAnnotation(Transactional.class);

        assertThat(transactional).isNotNull();
        assertThat(transactional.propagation()).isEqualTo(Propagation.REQUIRES_NEW);
        assertThat(transactional.timeoutString()).isEqualTo("${app.downloads.record-timeout-seconds:5}");
        assertThat(transactional.readOnly()).isFalse();
    }

    @Test
    void constructor_rejectsNonPositiveAttemptBound() {
        assertThatThrownBy(() -> new VersionDownloadWriter(repository, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
