package dev.llumos.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "prompts", indexes = @Index(name = "idx_prompts_org_active", columnList = "org_id, active"))
public class Prompt {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "org_id", nullable = false, columnDefinition = "uuid")
    private UUID orgId;

    @Column(nullable = false, columnDefinition = "text")
    private String text;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Prompt() {
    }

    public static Prompt create(UUID orgId, String text, boolean active, Instant createdAt) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("prompt text required");
        Prompt p = new Prompt();
        p.id = UUID.randomUUID();
        p.orgId = orgId;
        p.text = text;
        p.active = active;
        p.createdAt = createdAt;
        return p;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrgId() {
        return orgId;
    }

    public String getText() {
        return text;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
