package com.cratedownloads.shared.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Entity representing one published version of a crate.
 * Maps to the versions table.
 */
@Entity
@Table(name = "versions", indexes = {
    @Index(name = "idx_versions_crate_id", columnList = "crate_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_versions_crate_id_num", columnNames = {"crate_id", "num"})
})
public class Version {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "crate_id", nullable = false, updatable = false)
    private Crate crate;

    @Column(name = "num", length = 64, nullable = false)
    @NotBlank
    private String num;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Constructors
    public Version() {
    }

    public Version(Crate crate, String num) {
        this.crate = crate;
        this.num = num;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Crate getCrate() {
        return crate;
    }

    public void setCrate(Crate crate) {
        this.crate = crate;
    }

    public String getNum() {
        return num;
    }

    public void setNum(String num) {
        this.num = num;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
