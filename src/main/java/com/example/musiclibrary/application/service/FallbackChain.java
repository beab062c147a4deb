package com.example.musiclibrary.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered resolution sources tried one after another until one yields a value. A source that throws is
 * logged and treated as having found nothing.
 *
 * @param <C> lookup context
 * @param <R> resolved value
 */
public final class FallbackChain<C, R> {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    @FunctionalInterface
    public interface Source<C, R> {

        Optional<R> tryResolve(C context) throws Exception;
    }

    private final String chainName;
    private final List<String> sourceNames = new ArrayList<>();
    private final List<Source<C, R>> sources = new ArrayList<>();

    private FallbackChain(String chainName) {
        this.chainName = chainName;
    }

    public static <C, R> FallbackChain<C, R> named(String chainName) {
        return new FallbackChain<>(chainName);
    }

    public FallbackChain<C, R> then(String sourceName, Source<C, R> source) {
        sourceNames.add(sourceName);
        sources.add(source);
        return this;
    }

    public Optional<R> resolve(C context) {
        for (int i = 0; i < sources.size(); i++) {
            String sourceName = sourceNames.get(i);
            try {
                Optional<R> result = sources.get(i).tryResolve(context);
                if (result != null && result.isPresent()) {
                    log.debug("FALLBACK_RESOLVED chain={} source={}", chainName, sourceName);
                    return result;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("FALLBACK_INTERRUPTED chain={} source={}", chainName, sourceName);
                return Optional.empty();
            } catch (Exception e) {
                log.warn("FALLBACK_SOURCE_FAILED chain={} source={} reason={}", chainName, sourceName, e.getMessage(), e);
            }
        }
        return Optional.empty();
    }
}
