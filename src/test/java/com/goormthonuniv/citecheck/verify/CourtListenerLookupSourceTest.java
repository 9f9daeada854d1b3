package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.extract.Citation;
import com.goormthonuniv.citecheck.service.SimilarityService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CourtListenerLookupSourceTest {

    private static final String ENDPOINT = "https://cl.test/api/rest/v4/citation-lookup/";

    private static final String BROWN = """
            [{"citation": "347 U.S. 483", "normalized_citations": ["347 U.S. 483"], "start_index": 0, "end_index": 12,
              "status": 200, "error_message": "",
              "clusters": [{"case_name": "Brown v. Board of Education", "date_filed": "1954-05-17",
                            "absolute_url": "/opinion/105221/brown-v-board-of-education/",
                            "citations": [{"volume": 347, "reporter": "U.S.", "page": "483"},
                                          {"volume": 74, "reporter": "S. Ct.", "page": "686"}]}]}]
            """;

    private MockRestServiceServer server;
    private RestClient rest;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        rest = builder.build();
    }

    private CourtListenerLookupSource source(String apiKey) {
        return new CourtListenerLookupSource(rest, new HttpCallGuard(Fixtures.fastProps()), Fixtures.CATALOG,
                new SimilarityService(), ENDPOINT, "https://cl.test/", apiKey);
    }

    @Test
    void singleClusterCarryingTheCitationIsAMatch() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Token secret"))
                .andRespond(withSuccess(BROWN, MediaType.APPLICATION_JSON));
        Citation brown = Fixtures.resolved(0, "U.S.", "347", "483", 0, "Brown v. Board of Education", "1954");

        VerificationAttempt attempt = source("secret").attempt(brown);

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.MATCH);
        assertThat(attempt.source()).isEqualTo("courtlistener_lookup");
        assertThat(attempt.tier()).isEqualTo(1);
        assertThat(attempt.confidence()).isCloseTo(0.95, within(1e-9));
        assertThat(attempt.canonicalName()).isEqualTo("Brown v. Board of Education");
        assertThat(attempt.canonicalDate()).isEqualTo("1954-05-17");
        assertThat(attempt.canonicalUrl()).isEqualTo("https://cl.test/opinion/105221/brown-v-board-of-education/");
        server.verify();
    }

    @Test
    void disagreeingExtractedNameLowersConfidence() {
        server.expect(requestTo(ENDPOINT)).andRespond(withSuccess(BROWN, MediaType.APPLICATION_JSON));
        Citation c = Fixtures.resolved(0, "U.S.", "347", "483", 0, "Smith v. Jones", "1954");

        VerificationAttempt attempt = source("secret").attempt(c);

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.MATCH);
        assertThat(attempt.confidence()).isCloseTo(0.76, within(1e-9));
    }

    @Test
    void batchLookupFillsCacheForLaterAttempts() {
        String body = """
                [{"citation": "347 U.S. 483", "normalized_citations": ["347 U.S. 483"], "status": 200, "error_message": "",
                  "clusters": [{"case_name": "Brown v. Board of Education", "date_filed": "1954-05-17",
                                "absolute_url": "/opinion/105221/brown/",
                                "citations": [{"volume": 347, "reporter": "U.S.", "page": "483"},
                                              {"volume": 74, "reporter": "S. Ct.", "page": "686"}]}]},
                 {"citation": "74 S. Ct. 686", "normalized_citations": ["74 S. Ct. 686"], "status": 200, "error_message": "",
                  "clusters": [{"case_name": "Brown v. Board of Education", "date_filed": "1954-05-17",
                                "absolute_url": "/opinion/105221/brown/",
                                "citations": [{"volume": 347, "reporter": "U.S.", "page": "483"},
                                              {"volume": 74, "reporter": "S. Ct.", "page": "686"}]}]}]
                """;
        server.expect(ExpectedCount.once(), requestTo(ENDPOINT)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
        CourtListenerLookupSource source = source("secret");
        Citation us = Fixtures.resolved(0, "U.S.", "347", "483", 0, "Brown v. Board of Education", "1954");
        Citation sct = Fixtures.resolved(1, "S. Ct.", "74", "686", 14, "Brown v. Board of Education", "1954");

        source.prepare(List.of(us, sct));

        assertThat(source.attempt(us).outcome()).isEqualTo(AttemptOutcome.MATCH);
        assertThat(source.attempt(sct).outcome()).isEqualTo(AttemptOutcome.MATCH);
        server.verify();
    }

    @Test
    void ambiguousLookupIsNoMatch() {
        String body = """
                [{"citation": "1 U.S. 1", "normalized_citations": ["1 U.S. 1"], "status": 300, "error_message": "",
                  "clusters": [{"case_name": "A v. B", "absolute_url": "/opinion/1/a/", "citations": []},
                               {"case_name": "C v. D", "absolute_url": "/opinion/2/c/", "citations": []}]}]
                """;
        server.expect(requestTo(ENDPOINT)).andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        VerificationAttempt attempt = source("secret").attempt(Fixtures.citation(0, "U.S.", "1", "1", 0));

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.NO_MATCH);
        assertThat(attempt.detail()).startsWith("status 300");
    }

    @Test
    void persistentServerErrorBecomesErrorAttempt() {
        server.expect(ExpectedCount.times(3), requestTo(ENDPOINT)).andRespond(withServerError());

        VerificationAttempt attempt = source("secret").attempt(Fixtures.citation(0, "U.S.", "347", "483", 0));

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.ERROR);
        server.verify();
    }

    @Test
    void withoutApiKeyTheTierIsSkipped() {
        VerificationAttempt attempt = source("").attempt(Fixtures.citation(0, "U.S.", "347", "483", 0));

        assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.NOT_APPLICABLE);
        server.verify();
    }
}
