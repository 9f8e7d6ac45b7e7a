package com.madisonmentions.backend.reporter.service;

import com.madisonmentions.backend.reporter.dto.ReporterImportResult;
import com.madisonmentions.backend.reporter.dto.ReporterImportRow;
import com.madisonmentions.backend.reporter.entity.Reporter;
import com.madisonmentions.backend.reporter.entity.ReporterSource;
import com.madisonmentions.backend.reporter.entity.SocialLinks;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Bulk import of reporters from a user's own list. Imported records carry no provider
 * identity and are never marked fresh, so their first resolution goes through cold start.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReporterImportService {

    private final ReporterStore reporterStore;

    public ReporterImportResult importReporters(List<ReporterImportRow> rows, boolean skipDuplicates) {
        int imported = 0;
        int skipped = 0;
        int invalid = 0;

        for (ReporterImportRow row : rows) {
            if (row == null) {
                invalid++;
                continue;
            }
            String name = trimToNull(row.getName());
            if (name == null || name.length() < ReporterResolutionService.MIN_NAME_LENGTH) {
                invalid++;
                continue;
            }
            if (skipDuplicates && reporterStore.find(name).isPresent()) {
                skipped++;
                continue;
            }

            try {
                reporterStore.upsert(Reporter.builder()
                        .name(name)
                        .currentOutlet(trimToNull(row.getOutlet()))
                        .bio(trimToNull(row.getBio()))
                        .socialLinks(toSocialLinks(row))
                        .source(ReporterSource.MANUAL_IMPORT)
                        .build(), false);
                imported++;
            } catch (DataAccessException e) {
                log.warn("Could not import reporter '{}': {}", name, e.getMessage());
                invalid++;
            }
        }

        log.info("📥 Reporter import: {} imported, {} skipped, {} invalid of {} rows",
                imported, skipped, invalid, rows.size());
        return new ReporterImportResult(imported, skipped, invalid, rows.size());
    }

    static SocialLinks toSocialLinks(ReporterImportRow row) {
        SocialLinks links = new SocialLinks();

        String twitter = trimToNull(row.getTwitterHandle());
        if (twitter != null) {
            String handle = twitter.replaceFirst("^@+", "");
            if (handle.contains("twitter.com/") || handle.contains("x.com/")) {
                links.setTwitterUrl(twitter);
                handle = handle.substring(handle.lastIndexOf('/') + 1);
                int query = handle.indexOf('?');
                if (query >= 0) {
                    handle = handle.substring(0, query);
                }
            } else {
                links.setTwitterUrl("https://twitter.com/" + handle);
            }
            links.setTwitterHandle(handle);
        }

        String linkedin = trimToNull(row.getLinkedinUrl());
        if (linkedin != null) {
            links.setLinkedinUrl(linkedin.startsWith("http") ? linkedin : "https://linkedin.com/in/" + linkedin);
        }

        links.setWebsiteUrl(trimToNull(row.getWebsiteUrl()));
        links.setTitle(trimToNull(row.getTitle()));
        return links.isEmpty() ? null : links;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
