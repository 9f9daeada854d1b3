package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.service.SimilarityService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DirectLinkSourceTest {

    private static final String JUSTIA = "https://supreme.justia.com/cases/federal/us/347/483/";
    private static final String COURTLISTENER = "https://www.courtlistener.com/c/U.S./347/483/";

    private final OpinionPageFetcher fetcher = mock(OpinionPageFetcher.class);
    private final DirectLinkSource source = new DirectLinkSource(fetcher,
            new OpinionPageValidator(new SimilarityService(), new CiteCheckProperties()),
            new LegalDomainPolicy(), "https://supreme.justia.com/", "https://www.courtlistener.com");

    private final Citation brown = Fixtures.resolved(0, "U.S.", "347", "483", 0, "Brown v. Board of Education", "1954");

    @Test
    void supremeCourtCitationTriesJustiaFirst() {
        assertThat(source.candidateUrls(brown)).containsExactly(JUSTIA, COURTLISTENER);
        assertThat(source.candidateUrls(Fixtures.citation(1, "P.3d", "80", "598", 0)))
                .containsExactly("https://www.courtlistener.com/c/P.3d/80/598/");
    }

    @Test
    void matchingPageVerifiesCitation() {
        when(fetcher.fetch(JUSTIA)).thenReturn(OpinionPage.parse(JUSTIA, OpinionPageValidatorTest.BROWN_PAGE));

        VerificationAttempt attempt = source.attempt(brown);

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.MATCH);
        assertThat(attempt.source()).isEqualTo("direct_link:supreme.justia.com");
        assertThat(attempt.confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(attempt.canonicalName()).isEqualTo("Brown v. Board of Education");
        assertThat(attempt.canonicalDate()).isEqualTo("1954");
        assertThat(attempt.canonicalUrl()).isEqualTo(JUSTIA);
        verify(fetcher, never()).fetch(COURTLISTENER);
    }

    @Test
    void notFoundFallsThroughToNextUrl() {
        when(fetcher.fetch(JUSTIA)).thenThrow(
                HttpClientErrorException.create(HttpStatus.NOT_FOUND, "Not Found", HttpHeaders.EMPTY, null, null));
        when(fetcher.fetch(COURTLISTENER)).thenReturn(OpinionPage.parse(COURTLISTENER, OpinionPageValidatorTest.BROWN_PAGE));

        VerificationAttempt attempt = source.attempt(brown);

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.MATCH);
        assertThat(attempt.source()).isEqualTo("direct_link:courtlistener.com");
    }

    @Test
    void pageForAnotherCaseIsNoMatch() {
        String other = "<html><head><title>Smith v. Jones, 347 U.S. 483 (1954)</title></head><body><p>Opinion</p></body></html>";
        when(fetcher.fetch(anyString())).thenAnswer(inv -> OpinionPage.parse(inv.getArgument(0), other));

        VerificationAttempt attempt = source.attempt(brown);

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.NO_MATCH);
        assertThat(attempt.detail()).isEqualTo("case name not on page");
    }

    @Test
    void networkFailureIsReportedAsError() {
        when(fetcher.fetch(anyString())).thenThrow(new ResourceAccessException("connect timed out"));

        assertThat(source.attempt(brown).outcome()).isEqualTo(AttemptOutcome.ERROR);
    }

    @Test
    void notAttemptedWithoutExtractedNameOrForDatabaseCitations() {
        Citation unnamed = Fixtures.citation(0, "U.S.", "347", "483", 0);
        Citation westlaw = Fixtures.resolved(1, "WL", "2019", "1234567", 0, "Doe v. Roe", "2019");

        assertThat(source.attempt(unnamed).outcome()).isEqualTo(AttemptOutcome.NOT_APPLICABLE);
        assertThat(source.attempt(westlaw).outcome()).isEqualTo(AttemptOutcome.NOT_APPLICABLE);
        verifyNoInteractions(fetcher);
    }
}
