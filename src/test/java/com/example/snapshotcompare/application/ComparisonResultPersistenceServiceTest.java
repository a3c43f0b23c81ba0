package com.example.snapshotcompare.application;

import com.example.snapshotcompare.domain.ChangeEntry;
import com.example.snapshotcompare.domain.DiffResult;
import com.example.snapshotcompare.domain.DiffSummary;
import com.example.snapshotcompare.domain.SnapshotNode;
import com.example.snapshotcompare.infrastructure.persistence.StoredComparisonResult;
import com.example.snapshotcompare.infrastructure.persistence.StoredComparisonResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComparisonResultPersistenceServiceTest {

    @Mock private StoredComparisonResultRepository repository;

    private ComparisonResultPersistenceService service;

    @BeforeEach
    void setUp() {
        service = new ComparisonResultPersistenceService(repository, SnapshotFixtures.OBJECT_MAPPER);
    }

    @Test
    void savedResultLoadsBackUnchanged() {
        DiffResult result =
                new DiffResult(
                        Map.of("GPU.name", SnapshotNode.text("X")),
                        Map.of("Disk.size", SnapshotNode.number(500)),
                        Map.of(
                                "CPU.cores",
                                new ChangeEntry.Modified(SnapshotNode.number(4), SnapshotNode.number(8))),
                        new DiffSummary(1, 1, 1, "old.json", "new.json", null));
        when(repository.save(any(StoredComparisonResult.class)))
                .thenAnswer(
                        invocation -> {
                            StoredComparisonResult entity = invocation.getArgument(0);
                            entity.setId(7L);
                            return entity;
                        });

        long id = service.saveComparison("old.json vs new.json", "10.0.0.5", result);

        ArgumentCaptor<StoredComparisonResult> captor = ArgumentCaptor.forClass(StoredComparisonResult.class);
        verify(repository).save(captor.capture());
        StoredComparisonResult stored = captor.getValue();
        assertThat(id).isEqualTo(7L);
        assertThat(stored.getTotalAdded()).isEqualTo(1);
        assertThat(stored.isFailed()).isFalse();
        assertThat(stored.getDiffResultJson()).contains("\"total_changed\":1");

        when(repository.findById(7L)).thenReturn(Optional.of(stored));
        ComparisonResultPersistenceService.StoredComparisonResultView view = service.loadComparison(7L);

        assertThat(view.name()).isEqualTo("old.json vs new.json");
        assertThat(view.result()).isEqualTo(result);
    }

    @Test
    void failedComparisonIsFlagged() {
        when(repository.save(any(StoredComparisonResult.class))).thenAnswer(invocation -> {
            StoredComparisonResult entity = invocation.getArgument(0);
            entity.setId(1L);
            return entity;
        });

        service.saveComparison("a vs b", "127.0.0.1", DiffResult.failure("Comparison failed: x", "a", "b"));

        ArgumentCaptor<StoredComparisonResult> captor = ArgumentCaptor.forClass(StoredComparisonResult.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().isFailed()).isTrue();
        assertThat(captor.getValue().getTotalChanged()).isZero();
    }

    @Test
    void loadingUnknownIdIsNotFound() {
        when(repository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.loadComparison(99L))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(e -> ((ResponseStatusException) e).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void searchComparisonsReturnsMappedSummaries() {
        StoredComparisonResult entity = new StoredComparisonResult();
        entity.setId(42L);
        entity.setName("specs.json vs specs.csv");
        entity.setIpRequest("10.0.0.5");
        entity.setCreated(LocalDateTime.of(2024, 3, 1, 12, 30));
        entity.setTotalAdded(2);
        entity.setTotalChanged(3);

        PageImpl<StoredComparisonResult> page =
                new PageImpl<>(List.of(entity), PageRequest.of(0, 5, Sort.by(Sort.Direction.DESC, "created")), 1);

        when(repository.findByNameContainingIgnoreCaseAndIpRequestContainingIgnoreCase(
                        eq("specs"), eq("10.0.0.5"), any(Pageable.class)))
                .thenReturn(page);

        Page<ComparisonResultPersistenceService.StoredComparisonResultSummary> result =
                service.searchComparisons(" specs", "10.0.0.5 ", 0, 5);

        assertThat(result.getTotalElements()).isEqualTo(1);
        ComparisonResultPersistenceService.StoredComparisonResultSummary summary = result.getContent().get(0);
        assertThat(summary.id()).isEqualTo(42L);
        assertThat(summary.totalAdded()).isEqualTo(2);
        assertThat(summary.totalRemoved()).isZero();
        assertThat(summary.totalChanged()).isEqualTo(3);
        assertThat(summary.failed()).isFalse();
    }

    @Test
    void searchComparisonsSanitizesPagingAndFilters() {
        when(repository.findByNameContainingIgnoreCaseAndIpRequestContainingIgnoreCase(
                        any(), any(), any(Pageable.class)))
                .thenReturn(Page.empty());

        service.searchComparisons(null, null, -3, 500);

        ArgumentCaptor<Pageable> pageableCaptor = ArgumentCaptor.forClass(Pageable.class);
        verify(repository)
                .findByNameContainingIgnoreCaseAndIpRequestContainingIgnoreCase(
                        eq(""), eq(""), pageableCaptor.capture());

        Pageable pageable = pageableCaptor.getValue();
        assertThat(pageable.getPageNumber()).isZero();
        assertThat(pageable.getPageSize()).isEqualTo(100);
        Sort.Order createdOrder = pageable.getSort().getOrderFor("created");
        assertThat(createdOrder).isNotNull();
        assertThat(createdOrder.getDirection()).isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void renameIsRestrictedToRequester() {
        StoredComparisonResult entity = new StoredComparisonResult();
        entity.setId(5L);
        entity.setName("old");
        entity.setIpRequest("10.0.0.5");
        when(repository.findById(5L)).thenReturn(Optional.of(entity));

        assertThatThrownBy(() -> service.renameComparison(5L, "10.0.0.6", "new"))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(e -> ((ResponseStatusException) e).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThatThrownBy(() -> service.renameComparison(5L, "10.0.0.5", "   "))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(e -> ((ResponseStatusException) e).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);

        service.renameComparison(5L, "10.0.0.5", "  nightly baseline ");

        assertThat(entity.getName()).isEqualTo("nightly baseline");
    }
}
