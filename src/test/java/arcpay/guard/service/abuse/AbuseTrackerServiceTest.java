package arcpay.guard.service.abuse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import arcpay.guard.config.AbuseProperties;
import arcpay.guard.testutil.MutableClock;

@DisplayName("AbuseTrackerService Tests")
class AbuseTrackerServiceTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private AbuseProperties properties;
    private InMemoryAbuseStore store;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private AbuseTrackerService tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new AbuseProperties();
        store = new InMemoryAbuseStore();
        scheduler = mock(ScheduledExecutorService.class);
        future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        tracker = new AbuseTrackerService(store, properties, clock, scheduler);
    }

    private void fail(ClientIdentity identity, int times) {
        for (int i = 0; i < times; i++) {
            tracker.recordFailure(identity, "http_500");
        }
    }

    @Nested
    @DisplayName("Threshold Tests")
    class ThresholdTests {

        @Test
        @DisplayName("Should stay unblocked one failure below the threshold")
        void staysUnblockedBelowThreshold() {
            ClientIdentity client = ClientIdentity.ofIp("203.0.113.7");

            fail(client, 49);

            assertThat(tracker.isBlocked(client).blocked()).isFalse();
            assertThat(store.find(AbuseScope.IP, "203.0.113.7")).get()
                .extracting(AbuseEntry::count).isEqualTo(49);
            verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        @DisplayName("Should block the IP when the threshold is reached")
        void blocksAtThreshold() {
            ClientIdentity client = ClientIdentity.ofIp("203.0.113.7");

            fail(client, 50);

            BlockStatus status = tracker.isBlocked(client);
            assertThat(status.blocked()).isTrue();
            assertThat(status.reason()).isEqualTo(AbuseTrackerService.IP_BLOCK_REASON);
            verify(scheduler).schedule(any(Runnable.class),
                eq(Duration.ofHours(1).toMillis()), eq(TimeUnit.MILLISECONDS));
        }

        @Test
        @DisplayName("Should not reschedule an unblock for failures after the block")
        void doesNotRescheduleWhileBlocked() {
            ClientIdentity client = ClientIdentity.ofIp("203.0.113.7");

            fail(client, 55);

            verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
            assertThat(store.find(AbuseScope.IP, "203.0.113.7")).get()
                .extracting(AbuseEntry::count).isEqualTo(55);
        }

        @Test
        @DisplayName("Should reset the count to one after the window elapsed")
        void resetsCountAfterWindow() {
            ClientIdentity client = ClientIdentity.ofIp("198.51.100.4");
            fail(client, 30);

            clock.advance(Duration.ofMinutes(15).plusSeconds(1));
            tracker.recordFailure(client, "http_404");

            AbuseEntry entry = store.find(AbuseScope.IP, "198.51.100.4").orElseThrow();
            assertThat(entry.count()).isEqualTo(1);
            assertThat(entry.windowStart()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("Should keep counting inside the window")
        void keepsCountingInsideWindow() {
            ClientIdentity client = ClientIdentity.ofIp("198.51.100.4");
            fail(client, 30);

            clock.advance(Duration.ofMinutes(14));
            fail(client, 20);

            assertThat(tracker.isBlocked(client).blocked()).isTrue();
        }
    }

    @Nested
    @DisplayName("User Tracking Tests")
    class UserTrackingTests {

        @Test
        @DisplayName("Should block the user across IPs")
        void blocksUserAcrossIps() {
            for (int i = 0; i < 50; i++) {
                tracker.recordFailure(new ClientIdentity("10.0.0." + i, "user-42"), "http_401");
            }

            BlockStatus fromNewIp = tracker.isBlocked(new ClientIdentity("10.9.9.9", "user-42"));
            assertThat(fromNewIp.blocked()).isTrue();
            assertThat(fromNewIp.reason()).isEqualTo(AbuseTrackerService.USER_BLOCK_REASON);
            assertThat(tracker.isBlocked(ClientIdentity.ofIp("10.0.0.1")).blocked()).isFalse();
        }

        @Test
        @DisplayName("Should report the IP reason first when both keys are blocked")
        void reportsIpReasonFirst() {
            ClientIdentity client = new ClientIdentity("10.1.1.1", "user-7");

            fail(client, 50);

            assertThat(tracker.isBlocked(client).reason()).isEqualTo(AbuseTrackerService.IP_BLOCK_REASON);
        }

        @Test
        @DisplayName("Should not track anonymous callers by user")
        void anonymousCallerHasNoUserEntry() {
            fail(ClientIdentity.ofIp("10.1.1.1"), 3);

            assertThat(store.size(AbuseScope.USER)).isZero();
            assertThat(store.size(AbuseScope.IP)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Explicit Block Tests")
    class ExplicitBlockTests {

        @Test
        @DisplayName("Should block both keys and create entries when absent")
        void blocksBothKeys() {
            ClientIdentity client = new ClientIdentity("192.0.2.1", "user-1");

            tracker.block(client, Duration.ofMinutes(10));

            assertThat(tracker.isBlocked(client).blocked()).isTrue();
            assertThat(tracker.isBlocked(new ClientIdentity("192.0.2.99", "user-1")).blocked()).isTrue();
            assertThat(store.find(AbuseScope.IP, "192.0.2.1")).get()
                .extracting(AbuseEntry::blockedUntil).isEqualTo(START.plus(Duration.ofMinutes(10)));
        }

        @Test
        @DisplayName("Should use the default duration when none is given")
        void usesDefaultDuration() {
            ClientIdentity client = ClientIdentity.ofIp("192.0.2.1");

            tracker.block(client, null);

            assertThat(store.find(AbuseScope.IP, "192.0.2.1")).get()
                .extracting(AbuseEntry::blockedUntil).isEqualTo(START.plus(Duration.ofHours(1)));
        }

        @Test
        @DisplayName("Should lift the block when the scheduled unblock runs")
        void scheduledUnblockLiftsBlock() {
            ClientIdentity client = ClientIdentity.ofIp("192.0.2.1");
            fail(client, 2);
            tracker.block(client, Duration.ofMinutes(5));

            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).schedule(task.capture(), eq(Duration.ofMinutes(5).toMillis()), eq(TimeUnit.MILLISECONDS));

            clock.advance(Duration.ofMinutes(5));
            task.getValue().run();

            AbuseEntry entry = store.find(AbuseScope.IP, "192.0.2.1").orElseThrow();
            assertThat(entry.blocked()).isFalse();
            assertThat(entry.count()).isEqualTo(2);
            assertThat(tracker.isBlocked(client).blocked()).isFalse();
        }

        @Test
        @DisplayName("Should keep the latest deadline when blocks overlap")
        void latestDeadlineWins() {
            ClientIdentity client = ClientIdentity.ofIp("192.0.2.1");

            tracker.block(client, Duration.ofMinutes(1));
            tracker.block(client, Duration.ofMinutes(10));

            ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler, times(2)).schedule(tasks.capture(), anyLong(), any(TimeUnit.class));
            verify(future).cancel(false);

            // The superseded task fires anyway
            clock.advance(Duration.ofMinutes(1));
            tasks.getAllValues().get(0).run();
            assertThat(tracker.isBlocked(client).blocked()).isTrue();

            clock.advance(Duration.ofMinutes(9));
            tasks.getAllValues().get(1).run();
            assertThat(tracker.isBlocked(client).blocked()).isFalse();
        }

        @Test
        @DisplayName("Should let a shorter newer block replace a longer one")
        void shorterNewerBlockReplacesDeadline() {
            ClientIdentity client = ClientIdentity.ofIp("192.0.2.1");

            tracker.block(client, Duration.ofHours(2));
            tracker.block(client, Duration.ofMinutes(1));

            assertThat(store.find(AbuseScope.IP, "192.0.2.1")).get()
                .extracting(AbuseEntry::blockedUntil).isEqualTo(START.plus(Duration.ofMinutes(1)));
        }

        @Test
        @DisplayName("Should stop denying once the deadline passed even before the task ran")
        void expiredDeadlineNoLongerDenies() {
            ClientIdentity client = ClientIdentity.ofIp("192.0.2.1");
            tracker.block(client, Duration.ofMinutes(1));

            clock.advance(Duration.ofMinutes(1));

            assertThat(tracker.isBlocked(client).blocked()).isFalse();
        }

        @Test
        @DisplayName("Should unblock immediately and cancel the pending task")
        void explicitUnblock() {
            ClientIdentity client = new ClientIdentity("192.0.2.1", "user-1");
            tracker.block(client, Duration.ofMinutes(30));

            tracker.unblock(client);

            assertThat(tracker.isBlocked(client).blocked()).isFalse();
            verify(future, times(2)).cancel(false);
        }
    }

    @Nested
    @DisplayName("Maintenance Tests")
    class MaintenanceTests {

        @Test
        @DisplayName("Should evict only unblocked entries whose window elapsed")
        void evictsIdleEntries() {
            fail(ClientIdentity.ofIp("10.0.0.1"), 3);
            tracker.block(ClientIdentity.ofIp("10.0.0.2"), Duration.ofHours(5));

            clock.advance(Duration.ofMinutes(20));
            fail(ClientIdentity.ofIp("10.0.0.3"), 1);

            int removed = tracker.evictIdleEntries();

            assertThat(removed).isEqualTo(1);
            assertThat(store.find(AbuseScope.IP, "10.0.0.1")).isEmpty();
            assertThat(store.find(AbuseScope.IP, "10.0.0.2")).isPresent();
            assertThat(store.find(AbuseScope.IP, "10.0.0.3")).isPresent();
        }

        @Test
        @DisplayName("Should evict a lapsed block whose unblock task never ran")
        void evictsLapsedBlock() {
            tracker.block(ClientIdentity.ofIp("10.0.0.4"), Duration.ofMinutes(1));

            clock.advance(Duration.ofMinutes(20));

            assertThat(tracker.evictIdleEntries()).isEqualTo(1);
            assertThat(store.find(AbuseScope.IP, "10.0.0.4")).isEmpty();
        }

        @Test
        @DisplayName("Should expose both entries in the snapshot")
        void snapshotShowsEntries() {
            ClientIdentity client = new ClientIdentity("10.0.0.1", "user-9");
            fail(client, 4);

            AbuseSnapshot snapshot = tracker.snapshot(client);

            assertThat(snapshot.status().blocked()).isFalse();
            assertThat(snapshot.ipEntry().count()).isEqualTo(4);
            assertThat(snapshot.userEntry().count()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should ignore a null identity")
        void ignoresNullIdentity() {
            tracker.recordFailure(null, "http_500");

            assertThat(tracker.isBlocked(null).blocked()).isFalse();
            assertThat(store.size(AbuseScope.IP)).isZero();
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should count every concurrent failure exactly once")
        void concurrentFailuresAreCounted() throws Exception {
            properties.setThreshold(10_000);
            ClientIdentity client = ClientIdentity.ofIp("10.0.0.1");
            int threads = 8;
            int perThread = 250;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<java.util.concurrent.Future<?>> futures = new java.util.ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        fail(client, perThread);
                        return null;
                    }));
                }
                start.countDown();
                for (java.util.concurrent.Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(store.find(AbuseScope.IP, "10.0.0.1")).get()
                .extracting(AbuseEntry::count).isEqualTo(threads * perThread);
        }

        @Test
        @DisplayName("Should schedule exactly one auto-unblock under contention")
        void singleAutoBlockUnderContention() throws Exception {
            ClientIdentity client = ClientIdentity.ofIp("10.0.0.1");
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<java.util.concurrent.Future<?>> futures = new java.util.ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        fail(client, 25);
                        return null;
                    }));
                }
                start.countDown();
                for (java.util.concurrent.Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(tracker.isBlocked(client).blocked()).isTrue();
            verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        @DisplayName("Should keep one live unblock matching the stored deadline when blocks race")
        void racingBlocksKeepOneLiveUnblock() throws Exception {
            List<TrackedTask> scheduled = new CopyOnWriteArrayList<>();
            ScheduledExecutorService recording = mock(ScheduledExecutorService.class);
            doAnswer(inv -> {
                TrackedTask task = new TrackedTask(inv.getArgument(0));
                scheduled.add(task);
                return task;
            }).when(recording).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
            AbuseTrackerService racing = new AbuseTrackerService(store, properties, clock, recording);
            ClientIdentity client = ClientIdentity.ofIp("10.0.0.9");

            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<java.util.concurrent.Future<?>> futures = new java.util.ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    Duration duration = Duration.ofMinutes(1 + t);
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < 50; i++) {
                            racing.block(client, duration);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (java.util.concurrent.Future<?> f : futures) {
                    f.get(10, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            List<TrackedTask> live = scheduled.stream().filter(task -> !task.isCancelled()).toList();
            assertThat(live).hasSize(1);

            clock.advance(Duration.ofHours(1));
            live.get(0).task().run();

            assertThat(store.find(AbuseScope.IP, "10.0.0.9")).get()
                .extracting(AbuseEntry::blocked).isEqualTo(false);
        }
    }

    /**
     * Scheduled handle that only remembers its task and whether it was cancelled.
     */
    private static final class TrackedTask implements ScheduledFuture<Object> {

        private final Runnable task;
        private volatile boolean cancelled;

        TrackedTask(Runnable task) {
            this.task = task;
        }

        Runnable task() {
            return task;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return 0;
        }

        @Override
        public int compareTo(Delayed other) {
            return 0;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
