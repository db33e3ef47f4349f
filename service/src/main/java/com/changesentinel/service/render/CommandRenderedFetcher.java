package com.changesentinel.service.render;

import com.changesentinel.core.error.FetchTimeoutException;
import com.changesentinel.core.error.NetworkException;
import com.changesentinel.pipeline.fetch.RenderedFetcher;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

public class CommandRenderedFetcher implements RenderedFetcher {
    private static final Logger LOGGER = Logger.getLogger(CommandRenderedFetcher.class.getName());
    static final String URL_PLACEHOLDER = "{url}";

    private final List<String> command;
    private final Duration timeout;

    public CommandRenderedFetcher(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Render command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public String fetchRendered(URI uri) {
        List<String> argv = command.stream().map(arg -> arg.replace(URL_PLACEHOLDER, uri.toString())).toList();
        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new NetworkException(uri.toString(), "Unable to start renderer " + argv.get(0) + ": " + e.getMessage(), e);
        }
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new FetchTimeoutException(uri.toString(), null);
            }
            String dom = output.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (process.exitValue() != 0) {
                throw new NetworkException(uri.toString(), "Renderer exited with status " + process.exitValue(), null);
            }
            LOGGER.fine(() -> "Rendered " + uri + " (" + dom.length() + " chars)");
            return dom;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new NetworkException(uri.toString(), "Interrupted while rendering " + uri, e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new NetworkException(uri.toString(), "Unable to read renderer output for " + uri, e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
