package com.goormthonuniv.citecheck.verify;

import com.goormthonuniv.citecheck.Fixtures;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpCallGuardTest {

    private final HttpCallGuard guard = new HttpCallGuard(Fixtures.fastProps());

    @Test
    void transientServerErrorsAreRetried() {
        AtomicInteger calls = new AtomicInteger();

        String out = guard.call(HttpCallGuard.COURTLISTENER, () -> {
            if (calls.incrementAndGet() < 3) throw new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE);
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void tooManyRequestsIsRetried() {
        AtomicInteger calls = new AtomicInteger();

        String out = guard.call(HttpCallGuard.SEARCH, () -> {
            if (calls.incrementAndGet() == 1) throw new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS);
            return "ok";
        });

        assertThat(out).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    void clientErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> guard.call(HttpCallGuard.PAGE_FETCH, () -> {
            calls.incrementAndGet();
            throw new HttpClientErrorException(HttpStatus.NOT_FOUND);
        })).isInstanceOf(HttpClientErrorException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void lastErrorSurfacesWhenRetriesRunOut() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> guard.call(HttpCallGuard.COURTLISTENER, () -> {
            calls.incrementAndGet();
            throw new HttpServerErrorException(HttpStatus.BAD_GATEWAY);
        })).isInstanceOf(HttpServerErrorException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void onlyIoAndServerSideFailuresAreTransient() {
        assertThat(HttpCallGuard.isTransient(new ResourceAccessException("timeout"))).isTrue();
        assertThat(HttpCallGuard.isTransient(new HttpServerErrorException(HttpStatus.INTERNAL_SERVER_ERROR))).isTrue();
        assertThat(HttpCallGuard.isTransient(new HttpClientErrorException(HttpStatus.FORBIDDEN))).isFalse();
        assertThat(HttpCallGuard.isTransient(new IllegalStateException("bug"))).isFalse();
    }
}
