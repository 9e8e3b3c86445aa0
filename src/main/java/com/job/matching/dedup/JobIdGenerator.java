package com.job.matching.dedup;

import com.job.matching.rules.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the stable id of a posting. Job-board URLs carry their own id;
 * any other URL yields host plus a short URL hash; without a URL the id is a
 * hash of the normalized title and company.
 */
public class JobIdGenerator {
    private static final Logger log = LoggerFactory.getLogger(JobIdGenerator.class);

    private static final Pattern LINKEDIN = Pattern.compile("linkedin\\.com/jobs/view/(\\d+)");
    private static final Pattern INDEED = Pattern.compile("indeed\\.com/.*jk=([a-f0-9]+)");
    private static final Pattern GLASSDOOR = Pattern.compile("glassdoor\\.com/.*jobListingId=(\\d+)");

    private static final int CONTENT_HASH_LENGTH = 12;
    private static final int URL_HASH_LENGTH = 8;

    private final TextNormalizer normalizer;

    public JobIdGenerator(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Same arguments always give the same id. Blank title or company is logged
     * and hashed as-is.
     */
    public String generate(String title, String company, String url) {
        if (url != null && !url.isBlank()) {
            Optional<String> fromUrl = fromUrl(url.trim());
            if (fromUrl.isPresent()) {
                return fromUrl.get();
            }
        }
        if (title == null || title.isBlank() || company == null || company.isBlank()) {
            log.warn("dedup.malformed title='{}' company='{}' url='{}'", title, company, url);
        }
        String content = normalizer.normalizeTitle(title) + "_" + normalizer.normalizeCompany(company);
        return md5Hex(content).substring(0, CONTENT_HASH_LENGTH);
    }

    /**
     * Id embedded in or derived from a URL, empty if the URL has no host.
     */
    Optional<String> fromUrl(String url) {
        Matcher linkedin = LINKEDIN.matcher(url);
        if (linkedin.find()) {
            return Optional.of("linkedin_" + linkedin.group(1));
        }
        Matcher indeed = INDEED.matcher(url);
        if (indeed.find()) {
            return Optional.of("indeed_" + indeed.group(1));
        }
        Matcher glassdoor = GLASSDOOR.matcher(url);
        if (glassdoor.find()) {
            return Optional.of("glassdoor_" + glassdoor.group(1));
        }

        try {
            String host = new URI(url).getHost();
            if (host == null || host.isBlank()) {
                return Optional.empty();
            }
            String domain = host.startsWith("www.") ? host.substring(4) : host;
            return Optional.of(domain + "_" + md5Hex(url).substring(0, URL_HASH_LENGTH));
        } catch (URISyntaxException e) {
            log.debug("dedup.url.unparseable url='{}' reason={}", url, e.getMessage());
            return Optional.empty();
        }
    }

    static String md5Hex(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
