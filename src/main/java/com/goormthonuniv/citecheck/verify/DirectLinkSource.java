package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.extract.ReporterClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Tier 2: 권/리포터/면으로 바로 열리는 판결 페이지를 가져와 확인한다.
 * - U.S. → Justia 연방대법원 페이지
 * - 그 외 → CourtListener 인용 리다이렉트(/c/{reporter}/{vol}/{page}/)
 * 추출된 사건명이 없으면 페이지가 맞는지 판단할 근거가 없으므로 시도하지 않는다.
 */
@Slf4j
@Component
public class DirectLinkSource implements VerificationSource {

    static final String NAME_PREFIX = "direct_link:";
    static final double WEIGHT = 0.85;

    private final OpinionPageFetcher fetcher;
    private final OpinionPageValidator validator;
    private final LegalDomainPolicy domains;
    private final String justiaBase;
    private final String courtListenerBase;

    public DirectLinkSource(OpinionPageFetcher fetcher,
                            OpinionPageValidator validator,
                            LegalDomainPolicy domains,
                            @Value("${citecheck.adapters.justia.base-url:https://supreme.justia.com}") String justiaBase,
                            @Value("${citecheck.adapters.courtlistener.base-url:https://www.courtlistener.com}") String courtListenerBase) {
        this.fetcher = fetcher;
        this.validator = validator;
        this.domains = domains;
        this.justiaBase = stripSlash(justiaBase);
        this.courtListenerBase = stripSlash(courtListenerBase);
    }

    @Override public String name() { return "direct_link"; }

    @Override public int tier() { return 2; }

    @Override
    public VerificationAttempt attempt(Citation citation) {
        String expected = citation.getExtractedCaseName();
        if (expected == null || expected.isBlank()) {
            return VerificationAttempt.notApplicable(name(), tier(), "no extracted case name");
        }
        if (citation.getReporter().reporterClass() == ReporterClass.DATABASE) {
            return VerificationAttempt.notApplicable(name(), tier(), "database citation has no public page");
        }

        VerificationAttempt last = VerificationAttempt.noMatch(name(), tier(), "no candidate url");
        for (String url : candidateUrls(citation)) {
            last = tryUrl(citation, expected, url);
            if (last.outcome() == AttemptOutcome.MATCH) return last;
        }
        return last;
    }

    private VerificationAttempt tryUrl(Citation citation, String expected, String url) {
        String source = NAME_PREFIX + domains.normalizeHost(url);
        OpinionPage page;
        try {
            page = fetcher.fetch(url);
        } catch (HttpClientErrorException.NotFound e) {
            return VerificationAttempt.noMatch(source, tier(), "404 " + url);
        } catch (RuntimeException e) {
            log.warn("direct link fetch failed url={}: {}", url, e.toString());
            return VerificationAttempt.error(source, tier(), e.toString());
        }

        String titleName = validator.caseNameFromTitle(page);
        if (titleName == null) {
            return VerificationAttempt.noMatch(source, tier(), "page title carries no case name");
        }
        if (!OpinionPageValidator.citationPattern(citation).matcher(page.bodyText()).find()
                && !OpinionPageValidator.citationPattern(citation).matcher(page.headerText()).find()) {
            return VerificationAttempt.noMatch(source, tier(), "citation not on page");
        }
        double signal = validator.nameSignal(expected, page);
        if (signal <= 0.0) {
            return VerificationAttempt.noMatch(source, tier(), "case name not on page");
        }
        return VerificationAttempt.match(source, tier(), WEIGHT, signal,
                titleName, validator.yearFrom(page), page.url(), "direct page");
    }

    List<String> candidateUrls(Citation c) {
        List<String> urls = new ArrayList<>();
        if ("U.S.".equals(c.getReporter().canonical())) {
            urls.add(justiaBase + "/cases/federal/us/" + c.getVolume() + "/" + c.getPage() + "/");
        }
        urls.add(courtListenerBase + "/c/"
                + UriUtils.encodePathSegment(c.getReporter().canonical(), StandardCharsets.UTF_8)
                + "/" + c.getVolume() + "/" + c.getPage() + "/");
        return urls;
    }

    private static String stripSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
