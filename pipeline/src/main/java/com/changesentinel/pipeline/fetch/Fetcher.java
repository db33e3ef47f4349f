package com.changesentinel.pipeline.fetch;

import com.changesentinel.core.error.BlockedException;
import com.changesentinel.core.error.FetchException;
import com.changesentinel.core.error.NetworkException;

import java.net.URI;
import java.time.Duration;
import java.util.logging.Logger;

public class Fetcher {
    private static final Logger LOGGER = Logger.getLogger(Fetcher.class.getName());

    private final RawFetcher rawFetcher;
    private final RenderedFetcher renderedFetcher;
    private final ChallengeDetector challengeDetector;
    private final RetryPolicy defaultPolicy;
    private final Sleeper sleeper;

    public Fetcher(RawFetcher rawFetcher, RetryPolicy defaultPolicy) {
        this(rawFetcher, null, ChallengeDetector.defaults(), defaultPolicy, Sleeper.SYSTEM);
    }

    public Fetcher(
            RawFetcher rawFetcher,
            RenderedFetcher renderedFetcher,
            ChallengeDetector challengeDetector,
            RetryPolicy defaultPolicy,
            Sleeper sleeper
    ) {
        this.rawFetcher = rawFetcher;
        this.renderedFetcher = renderedFetcher;
        this.challengeDetector = challengeDetector;
        this.defaultPolicy = defaultPolicy;
        this.sleeper = sleeper;
    }

    public String fetch(URI uri, Duration timeout) {
        return fetch(uri, timeout, defaultPolicy);
    }

    public String fetch(URI uri, Duration timeout, RetryPolicy policy) {
        int attempt = 1;
        while (true) {
            try {
                return rawFetcher.fetchRaw(uri, timeout);
            } catch (BlockedException blocked) {
                return renderInstead(uri, blocked);
            } catch (FetchException ex) {
                if (!ex.retryable() || attempt >= policy.maxAttempts() || Thread.currentThread().isInterrupted()) {
                    throw ex;
                }
                Duration delay = policy.delayAfter(attempt);
                int failed = attempt;
                LOGGER.fine(() -> "Attempt " + failed + "/" + policy.maxAttempts() + " for " + uri
                        + " failed (" + ex.getMessage() + "), retrying in " + delay.toMillis() + "ms");
                pause(uri, delay);
                attempt++;
            }
        }
    }

    private String renderInstead(URI uri, BlockedException blocked) {
        if (renderedFetcher == null) {
            throw blocked;
        }
        LOGGER.info(() -> "Raw fetch blocked for " + uri + ", trying rendered fetch");
        String rendered;
        try {
            rendered = renderedFetcher.fetchRendered(uri);
        } catch (RuntimeException ex) {
            throw new BlockedException(uri.toString(), "rendering fallback failed: " + ex.getMessage(), ex);
        }
        if (rendered == null || rendered.isBlank() || challengeDetector.looksBlocked(rendered)) {
            throw new BlockedException(uri.toString(), "rendered page still shows a challenge");
        }
        return rendered;
    }

    private void pause(URI uri, Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(uri.toString(), "Interrupted while waiting to retry " + uri, e);
        }
    }
}
