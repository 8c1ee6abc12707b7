package com.injuryelo.injury.job;

import com.injuryelo.common.config.InjuryAdjustmentSettings;
import com.injuryelo.injury.cache.InjuryCache;
import com.injuryelo.injury.cache.snapshot.InjuryCacheSnapshotStore;
import com.injuryelo.injury.service.InjuryReportService;
import com.injuryelo.injury.support.FakeInjuryFeedClient;
import com.injuryelo.injury.support.FeedPayloads;
import com.injuryelo.injury.support.MutableClock;
import com.injuryelo.injury.support.TestFixtures;
import com.injuryelo.injury.team.TeamDirectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.injuryelo.injury.support.TestFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class InjuryRefreshSchedulerTest {

    @Test
    @DisplayName("start warms the cache immediately and stop ends the loop")
    void warmsCacheAndStops() throws InterruptedException {
        MutableClock clock = new MutableClock(T0);
        InjuryAdjustmentSettings settings = InjuryAdjustmentSettings.defaults();
        TeamDirectory teams = TestFixtures.teams();
        FakeInjuryFeedClient feed = new FakeInjuryFeedClient(clock).respondWith(FeedPayloads.empty());
        InjuryCache cache = new InjuryCache(settings, clock, InjuryCacheSnapshotStore.disabled());
        InjuryReportService reports = new InjuryReportService(feed, TestFixtures.normalizer(teams, settings),
            cache, teams, Duration.ofSeconds(1));

        InjuryRefreshScheduler scheduler = new InjuryRefreshScheduler(reports, cache, Duration.ofHours(1));
        scheduler.start();
        try {
            long deadline = System.currentTimeMillis() + 3_000;
            while (cache.size() < 30 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(30, cache.size());
            assertTrue(scheduler.isRunning());
        } finally {
            scheduler.stop();
        }

        assertFalse(scheduler.isRunning());
        assertEquals(1, feed.calls(), "next cycle is an hour away");
    }
}
