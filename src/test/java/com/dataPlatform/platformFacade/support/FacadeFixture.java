package com.dataPlatform.platformFacade.support;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.facade.cache.CacheKeyFactory;
import com.dataPlatform.platformFacade.facade.cache.ResponseCache;
import com.dataPlatform.platformFacade.facade.error.ErrorClassifier;
import com.dataPlatform.platformFacade.facade.normalization.ObjectNormalizer;
import com.dataPlatform.platformFacade.facade.service.OperationRunner;

import java.time.Instant;

/**
 * Real facade pipeline (cache, key factory, normalizer, classifier) on a controllable clock.
 */
public class FacadeFixture {

    public static final Instant START = Instant.parse("2025-01-15T12:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final FacadeSettings settings;
    public final ResponseCache cache = new ResponseCache(clock);
    public final ObjectNormalizer normalizer = new ObjectNormalizer();
    public final OperationRunner runner;

    public FacadeFixture() {
        this(FacadeSettings.builder().username("tester").apiKey("secret").build());
    }

    public FacadeFixture(FacadeSettings settings) {
        this.settings = settings;
        this.runner = new OperationRunner(cache, new CacheKeyFactory(normalizer), normalizer,
                new ErrorClassifier(), settings);
    }
}
