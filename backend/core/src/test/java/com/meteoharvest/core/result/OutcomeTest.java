package com.meteoharvest.core.result;

import com.meteoharvest.core.error.FetchException;
import com.meteoharvest.core.error.IngestionException;
import com.meteoharvest.core.model.RunStage;
import org.junit.jupiter.api.Test;

import java.net.http.HttpTimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

class OutcomeTest {
    @Test
    void successChains() {
        Outcome<Integer> outcome = Outcome.success("abc").flatMap(s -> Outcome.success(s.length() * 2));

        assertEquals(6, assertInstanceOf(Outcome.Success.class, outcome).value());
    }

    @Test
    void failureShortCircuitsAndKeepsError() {
        FetchException error = new FetchException("tanger", "Request failed", new HttpTimeoutException("request timed out"));
        Outcome<String> failed = Outcome.failure(error);

        Outcome<Integer> chained = failed.flatMap(s -> Outcome.success(s.length()));

        IngestionException carried = assertInstanceOf(Outcome.Failure.class, chained).error();
        assertSame(error, carried);
        assertEquals("tanger", carried.scope());
        assertEquals(RunStage.FETCHING, carried.stage());
        assertEquals("Request failed: request timed out", carried.rootMessage());
    }
}
