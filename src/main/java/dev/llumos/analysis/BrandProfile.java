package dev.llumos.analysis;

import dev.llumos.domain.entity.BrandCatalogEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The brand names an answer is scanned for: the organization's own brands and its tracked
 * competitors, each with spelling variants.
 */
public record BrandProfile(Map<String, List<String>> orgBrands, Map<String, List<String>> competitors) {

    public static final BrandProfile EMPTY = new BrandProfile(Map.of(), Map.of());

    public BrandProfile {
        orgBrands = orgBrands == null ? Map.of() : Map.copyOf(orgBrands);
        competitors = competitors == null ? Map.of() : Map.copyOf(competitors);
    }

    public static BrandProfile from(List<BrandCatalogEntry> catalog) {
        Map<String, List<String>> own = new LinkedHashMap<>();
        Map<String, List<String>> others = new LinkedHashMap<>();
        for (BrandCatalogEntry entry : catalog) {
            List<String> terms = entry.terms();
            if (terms.isEmpty()) continue;
            (entry.isOrgBrand() ? own : others).put(entry.getName(), terms);
        }
        return new BrandProfile(own, others);
    }
}
