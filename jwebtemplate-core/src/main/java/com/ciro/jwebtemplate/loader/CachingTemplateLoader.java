package com.ciro.jwebtemplate.loader;

import com.ciro.jwebtemplate.spi.TemplateLoader;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Objects;

/**
 * Keeps recently loaded template source in a Caffeine cache.
 * <p>
 * Only the source text is cached. Every render still parses and expands a fresh tree.
 * Missing templates are not cached, so a file added later is picked up on the next request.
 */
public class CachingTemplateLoader implements TemplateLoader {

    private final TemplateLoader delegate;
    private final Cache<String, String> cache;

    public CachingTemplateLoader(TemplateLoader delegate, Duration ttl) {
        this(delegate, ttl, 1_000);
    }

    public CachingTemplateLoader(TemplateLoader delegate, Duration ttl, long maximumSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public String loadTemplateHtml(String name) {
        // the delegate throws for unknown names, which leaves no entry behind
        return cache.get(name, delegate::loadTemplateHtml);
    }

    public void invalidate(String name) {
        cache.invalidate(name);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long cachedCount() {
        return cache.estimatedSize();
    }
}
