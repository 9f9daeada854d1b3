package com.goormthonuniv.citecheck.search;

import com.goormthonuniv.citecheck.Fixtures;
import com.goormthonuniv.citecheck.config.CiteCheckProperties;
import com.goormthonuniv.citecheck.verify.HttpCallGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SearchAdaptersTest {

    private MockRestServiceServer server;
    private RestClient rest;
    private HttpCallGuard guard;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        rest = builder.build();
        CiteCheckProperties props = Fixtures.fastProps();
        props.getVerification().getRetry().setMaxAttempts(1);
        guard = new HttpCallGuard(props);
    }

    @Test
    void googleResultsKeepRankAndSkipItemsWithoutLink() {
        server.expect(requestTo(startsWith("https://cse.test/v1?key=k&cx=c&q=")))
                .andRespond(withSuccess("""
                        {"items": [
                          {"title": "Brown v. Board of Education", "link": "https://law.justia.com/cases/federal/us/347/483/", "snippet": "347 U.S. 483"},
                          {"title": "no link"},
                          {"title": "Brown - Wikipedia", "link": "https://en.wikipedia.org/wiki/Brown", "snippet": ""}
                        ]}
                        """, MediaType.APPLICATION_JSON));
        GoogleCseAdapter google = new GoogleCseAdapter(rest, guard, "https://cse.test/v1", "k", "c");

        List<SearchResult> out = google.search("\"347 U.S. 483\"", 8);

        assertThat(out).extracting(SearchResult::url).containsExactly(
                "https://law.justia.com/cases/federal/us/347/483/", "https://en.wikipedia.org/wiki/Brown");
        assertThat(out).extracting(SearchResult::rank).containsExactly(0, 1);
        assertThat(out).extracting(SearchResult::source).containsOnly("google_cse");
        server.verify();
    }

    @Test
    void googleFailureAfterRetriesPropagates() {
        server.expect(requestTo(containsString("cse.test"))).andRespond(withServerError());
        GoogleCseAdapter google = new GoogleCseAdapter(rest, guard, "https://cse.test/v1", "k", "c");

        assertThatThrownBy(() -> google.search("q", 8)).isInstanceOf(HttpServerErrorException.class);
        server.verify();
    }

    @Test
    void googleRetriesTransientFailureThenReturnsResults() {
        server.expect(ExpectedCount.once(), requestTo(containsString("cse.test")))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(containsString("cse.test")))
                .andRespond(withSuccess("""
                        {"items": [{"title": "Brown v. Board of Education", "link": "https://law.justia.com/cases/federal/us/347/483/"}]}
                        """, MediaType.APPLICATION_JSON));
        GoogleCseAdapter google = new GoogleCseAdapter(rest, new HttpCallGuard(Fixtures.fastProps()),
                "https://cse.test/v1", "k", "c");

        assertThat(google.search("\"347 U.S. 483\"", 8)).extracting(SearchResult::url)
                .containsExactly("https://law.justia.com/cases/federal/us/347/483/");
        server.verify();
    }

    @Test
    void googleNeedsBothKeyAndEngineId() {
        assertThat(new GoogleCseAdapter(rest, guard, "https://cse.test/v1", "k", "").enabled()).isFalse();
        assertThat(new GoogleCseAdapter(rest, guard, "https://cse.test/v1", "k", "").search("q", 8)).isEmpty();
        server.verify();
    }

    @Test
    void bingSendsSubscriptionKeyAndReadsWebPages() {
        server.expect(requestTo(startsWith("https://bing.test/search?q=")))
                .andExpect(header("Ocp-Apim-Subscription-Key", "b"))
                .andRespond(withSuccess("""
                        {"webPages": {"value": [
                          {"name": "Brown v. Board of Education :: Justia", "url": "https://supreme.justia.com/cases/federal/us/347/483/", "snippet": "..."}
                        ]}}
                        """, MediaType.APPLICATION_JSON));
        BingWebAdapter bing = new BingWebAdapter(rest, guard, "https://bing.test/search", "b");

        List<SearchResult> out = bing.search("brown", 8);

        assertThat(out).singleElement().satisfies(r -> {
            assertThat(r.source()).isEqualTo("bing_web");
            assertThat(r.title()).isEqualTo("Brown v. Board of Education :: Justia");
        });
        server.verify();
    }
}
