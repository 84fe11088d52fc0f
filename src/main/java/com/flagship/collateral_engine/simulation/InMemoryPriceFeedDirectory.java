package com.flagship.collateral_engine.simulation;

import com.flagship.collateral_engine.collateral.PriceFeedId;
import com.flagship.collateral_engine.oracle.PriceFeed;
import com.flagship.collateral_engine.oracle.PriceFeedDirectory;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directory of hand-driven feeds; prices are stamped with the directory's clock.
 */
@Slf4j
public class InMemoryPriceFeedDirectory implements PriceFeedDirectory {

    private final Map<PriceFeedId, InMemoryPriceFeed> feeds = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPriceFeedDirectory(Clock clock) {
        this.clock = clock;
    }

    /**
     * Sets the price of a feed (feed precision), creating the feed on first use.
     */
    public void setPrice(PriceFeedId feedId, BigInteger price) {
        feeds.compute(feedId, (id, feed) -> {
            if (feed == null) {
                return new InMemoryPriceFeed(price, clock.instant());
            }
            feed.update(price, clock.instant());
            return feed;
        });
        log.info("Simulated price set: feed={}, price={}", feedId, price);
    }

    @Override
    public Optional<PriceFeed> find(PriceFeedId feedId) {
        return Optional.ofNullable(feeds.get(feedId));
    }
}
