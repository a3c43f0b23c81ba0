package com.example.snapshotcompare.infrastructure.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "SNAPSHOT_COMPARISONS")
public class StoredComparisonResult {

    @Id
    @GeneratedValue(
            strategy = GenerationType.SEQUENCE,
            generator = "snapshot_comparison_sequence")
    @SequenceGenerator(
            name = "snapshot_comparison_sequence",
            sequenceName = "SNAPSHOT_COMPARISON_SEQ",
            allocationSize = 1)
    private Long id;

    @Column(name = "NAME", nullable = false)
    private String name;

    @Column(name = "IP_REQUEST", nullable = false)
    private String ipRequest;

    @Column(name = "CREATED", nullable = false, updatable = false)
    private LocalDateTime created;

    @Column(name = "TOTAL_ADDED", nullable = false)
    private int totalAdded;

    @Column(name = "TOTAL_REMOVED", nullable = false)
    private int totalRemoved;

    @Column(name = "TOTAL_CHANGED", nullable = false)
    private int totalChanged;

    @Column(name = "FAILED", nullable = false)
    private boolean failed;

    @Lob
    @Column(name = "DIFF_RESULT", nullable = false)
    private String diffResultJson;

    @PrePersist
    void onCreate() {
        if (created == null) {
            created = LocalDateTime.now();
        }
    }
}
