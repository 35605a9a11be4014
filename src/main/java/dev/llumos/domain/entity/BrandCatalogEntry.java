package dev.llumos.domain.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A brand the organization tracks: its own ({@code orgBrand = true}) or a competitor.
 * Variants are alternative spellings matched alongside the name.
 */
@Entity
@Table(name = "brand_catalog", indexes = @Index(name = "idx_brand_catalog_org", columnList = "org_id, is_org_brand"))
public class BrandCatalogEntry {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "org_id", nullable = false, columnDefinition = "uuid")
    private UUID orgId;

    @Column(nullable = false)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "variants_json", columnDefinition = "jsonb", nullable = false)
    private List<String> variants = new ArrayList<>();

    @Column(name = "is_org_brand", nullable = false)
    private boolean orgBrand;

    protected BrandCatalogEntry() {
    }

    public static BrandCatalogEntry orgBrand(UUID orgId, String name, List<String> variants) {
        return create(orgId, name, variants, true);
    }

    public static BrandCatalogEntry competitor(UUID orgId, String name, List<String> variants) {
        return create(orgId, name, variants, false);
    }

    private static BrandCatalogEntry create(UUID orgId, String name, List<String> variants, boolean orgBrand) {
        BrandCatalogEntry e = new BrandCatalogEntry();
        e.id = UUID.randomUUID();
        e.orgId = orgId;
        e.name = name;
        e.variants = variants == null ? new ArrayList<>() : new ArrayList<>(variants);
        e.orgBrand = orgBrand;
        return e;
    }

    /** Name followed by its variants, blanks dropped. */
    public List<String> terms() {
        List<String> terms = new ArrayList<>();
        if (name != null && !name.isBlank()) terms.add(name);
        variants.stream().filter(v -> v != null && !v.isBlank()).forEach(terms::add);
        return terms;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrgId() {
        return orgId;
    }

    public String getName() {
        return name;
    }

    public List<String> getVariants() {
        return List.copyOf(variants);
    }

    public boolean isOrgBrand() {
        return orgBrand;
    }
}
