package com.job.matching.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Static alias table mapping legal-entity and former names to a canonical brand.
 * Keys and aliases are stored in normalized form so lookups compare like with like.
 */
public class CompanyAliases {
    private static final Logger log = LoggerFactory.getLogger(CompanyAliases.class);

    public static final String DEFAULT_RESOURCE = "company-aliases.json";

    private final Map<String, String> aliasToCanonical;

    private CompanyAliases(Map<String, String> aliasToCanonical) {
        this.aliasToCanonical = Collections.unmodifiableMap(aliasToCanonical);
    }

    /**
     * Builds the lookup from a canonical-name to aliases map, passing every entry
     * through {@code normalizer} first.
     */
    public static CompanyAliases of(Map<String, List<String>> table, UnaryOperator<String> normalizer) {
        Map<String, String> lookup = new HashMap<>();
        table.forEach((canonical, aliases) -> {
            String key = normalizer.apply(canonical);
            lookup.put(key, key);
            for (String alias : aliases) {
                String normalizedAlias = normalizer.apply(alias);
                if (!normalizedAlias.isEmpty()) {
                    lookup.put(normalizedAlias, key);
                }
            }
        });
        return new CompanyAliases(lookup);
    }

    public static CompanyAliases empty() {
        return new CompanyAliases(Map.of());
    }

    /**
     * Loads the bundled alias table from the classpath.
     *
     * @throws UncheckedIOException if the resource is missing or not valid JSON
     */
    public static CompanyAliases loadDefault(UnaryOperator<String> normalizer) {
        ObjectMapper mapper = new ObjectMapper();
        try (InputStream in = CompanyAliases.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Missing classpath resource " + DEFAULT_RESOURCE));
            }
            Map<String, List<String>> table = mapper.readValue(in, new TypeReference<>() {});
            CompanyAliases aliases = of(table, normalizer);
            log.debug("aliases.loaded canonical={} entries={}", table.size(), aliases.size());
            return aliases;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFAULT_RESOURCE, e);
        }
    }

    /**
     * Canonical brand for an already-normalized company name, if it is a known alias.
     */
    public Optional<String> lookup(String normalizedCompany) {
        return Optional.ofNullable(aliasToCanonical.get(normalizedCompany));
    }

    public String canonicalize(String normalizedCompany) {
        return aliasToCanonical.getOrDefault(normalizedCompany, normalizedCompany);
    }

    public int size() {
        return aliasToCanonical.size();
    }
}
