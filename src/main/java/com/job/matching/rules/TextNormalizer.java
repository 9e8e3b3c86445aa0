package com.job.matching.rules;

/**
 * Canonicalizes job titles and company names before they are compared.
 * Never fails; null or blank input yields an empty string.
 */
public class TextNormalizer {

    private final NormalizationEngine engine;
    private final CompanyAliases aliases;

    public TextNormalizer(NormalizationEngine engine, CompanyAliases aliases) {
        this.engine = engine;
        this.aliases = aliases;
    }

    /**
     * Default rules plus the bundled alias table.
     */
    public static TextNormalizer createDefault() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        CompanyAliases aliases = CompanyAliases.loadDefault(text -> engine.normalize(text, TextField.COMPANY));
        return new TextNormalizer(engine, aliases);
    }

    public String normalizeTitle(String title) {
        return engine.normalize(title, TextField.TITLE);
    }

    public String normalizeCompany(String company) {
        return aliases.canonicalize(engine.normalize(company, TextField.COMPANY));
    }

    /**
     * Common cleanup only; used for descriptions and locations.
     */
    public String normalizeText(String text) {
        return engine.normalize(text, TextField.GENERIC);
    }

    public NormalizationEngine getEngine() {
        return engine;
    }

    public CompanyAliases getAliases() {
        return aliases;
    }
}
