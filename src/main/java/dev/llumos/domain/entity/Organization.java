package dev.llumos.domain.entity;

import dev.llumos.domain.enums.PlanTier;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/** Tenant. Read-only here; the plan tier decides providers and prompt quota. */
@Entity
@Table(name = "organizations")
public class Organization {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column
    private String domain;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_tier", nullable = false, length = 20)
    private PlanTier planTier;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Organization() {
    }

    public static Organization create(String name, String domain, PlanTier planTier) {
        Organization o = new Organization();
        o.id = UUID.randomUUID();
        o.name = name;
        o.domain = domain;
        o.planTier = planTier == null ? PlanTier.STARTER : planTier;
        o.createdAt = Instant.now();
        return o;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDomain() {
        return domain;
    }

    public PlanTier getPlanTier() {
        return planTier;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
