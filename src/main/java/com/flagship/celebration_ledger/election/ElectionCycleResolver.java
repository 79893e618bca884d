package com.flagship.celebration_ledger.election;

import com.flagship.celebration_ledger.compliance.ComplianceLimits;
import com.flagship.celebration_ledger.compliance.LimitUndeterminedException;
import com.flagship.celebration_ledger.observability.CelebrationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Resolves the election-cycle reset boundary for a jurisdiction.
 *
 * Date chain per (jurisdiction, cycle year):
 * 1. Live election data source, bounded by a timeout
 * 2. Last successful live answer (snapshot cache)
 * 3. Static default table
 * 4. Otherwise {@link LimitUndeterminedException}
 *
 * Every live success refreshes the snapshot cache. The source used is logged,
 * counted and carried on the returned boundary.
 */
@Service
@Slf4j
public class ElectionCycleResolver {

    private static final Pattern JURISDICTION = Pattern.compile("^[A-Z]{2}$");

    private final ElectionDataSource liveSource;
    private final ElectionDateSnapshotCache snapshotCache;
    private final DefaultElectionDateTable defaultTable;
    private final ExecutorService lookupExecutor;
    private final Duration liveTimeout;
    private final ZoneOffset referenceOffset;
    private final CelebrationMetrics metrics;
    private final Clock clock;

    private final AtomicReference<Instant> lastLiveSuccess = new AtomicReference<>();
    private final AtomicReference<Instant> lastLiveFailure = new AtomicReference<>();

    public ElectionCycleResolver(ElectionDataSource liveSource,
                                 ElectionDateSnapshotCache snapshotCache,
                                 DefaultElectionDateTable defaultTable,
                                 @Qualifier("electionLookupExecutor") ExecutorService lookupExecutor,
                                 @Value("${election.live-source.timeout:2s}") Duration liveTimeout,
                                 ComplianceLimits limits,
                                 CelebrationMetrics metrics,
                                 Clock clock) {
        this.liveSource = liveSource;
        this.snapshotCache = snapshotCache;
        this.defaultTable = defaultTable;
        this.lookupExecutor = lookupExecutor;
        this.liveTimeout = liveTimeout;
        this.referenceOffset = limits.getReferenceOffset();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Resolves the boundary of the cycle that contains {@code asOf}.
     * Once a cycle's general election has passed, the next cycle is used.
     *
     * @param jurisdiction Two-letter state code of the recipient's race
     * @param asOf Instant being evaluated
     * @return Boundary with the dates and the source that supplied them
     * @throws LimitUndeterminedException if no source has dates for the jurisdiction
     */
    public ResetBoundary resolveResetBoundary(String jurisdiction, Instant asOf) {
        String state = normalize(jurisdiction);

        int cycleYear = StatutoryElectionCalendar.cycleYearFor(asOf.atOffset(referenceOffset).getYear());
        ResolvedDates resolved = resolveDates(state, cycleYear);

        if (!asOf.isBefore(StatutoryElectionCalendar.closeOf(resolved.dates.getGeneralDate(), referenceOffset))) {
            cycleYear += 2;
            resolved = resolveDates(state, cycleYear);
        }

        ResetBoundary boundary = ResetBoundary.builder()
                .jurisdiction(state)
                .cycleYear(cycleYear)
                .primaryDate(resolved.dates.getPrimaryDate())
                .generalDate(resolved.dates.getGeneralDate())
                .previousGeneralDate(StatutoryElectionCalendar.generalElectionDate(cycleYear - 2))
                .source(resolved.source)
                .referenceOffset(referenceOffset)
                .build();

        metrics.recordBoundarySource(resolved.source.name());
        log.info("Resolved reset boundary: jurisdiction={}, cycle={}, primary={}, general={}, source={}",
                state, cycleYear, boundary.getPrimaryDate(), boundary.getGeneralDate(), resolved.source);
        return boundary;
    }

    public Optional<Instant> getLastLiveSuccess() {
        return Optional.ofNullable(lastLiveSuccess.get());
    }

    public Optional<Instant> getLastLiveFailure() {
        return Optional.ofNullable(lastLiveFailure.get());
    }

    public boolean isLiveSourceConfigured() {
        return liveSource.isConfigured();
    }

    private ResolvedDates resolveDates(String state, int cycleYear) {
        Optional<ElectionDates> live = fetchLive(state, cycleYear);
        if (live.isPresent()) {
            snapshotCache.put(state, cycleYear, live.get());
            return new ResolvedDates(live.get(), BoundarySource.LIVE);
        }

        Optional<ElectionDates> cached = snapshotCache.get(state, cycleYear);
        if (cached.isPresent()) {
            log.warn("Live election data unavailable for {} {}, using cached snapshot", state, cycleYear);
            return new ResolvedDates(cached.get(), BoundarySource.CACHE);
        }

        Optional<ElectionDates> defaults = defaultTable.lookup(state, cycleYear);
        if (defaults.isPresent()) {
            log.warn("No cached election dates for {} {}, using default table", state, cycleYear);
            return new ResolvedDates(defaults.get(), BoundarySource.DEFAULT);
        }

        log.error("No election dates available for {} {} from any source", state, cycleYear);
        throw new LimitUndeterminedException(state,
                String.format("No election dates available for %s in cycle %d", state, cycleYear));
    }

    private Optional<ElectionDates> fetchLive(String state, int cycleYear) {
        if (!liveSource.isConfigured()) {
            return Optional.empty();
        }

        CompletableFuture<Optional<ElectionDates>> future =
                CompletableFuture.supplyAsync(() -> liveSource.fetchElectionDates(state, cycleYear), lookupExecutor);
        try {
            Optional<ElectionDates> result = future.get(liveTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result.isPresent()) {
                lastLiveSuccess.set(clock.instant());
            } else {
                lastLiveFailure.set(clock.instant());
                metrics.recordLiveLookupFailure("unavailable");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            lastLiveFailure.set(clock.instant());
            metrics.recordLiveLookupFailure("timeout");
            log.warn("Live election lookup for {} {} timed out after {}ms", state, cycleYear, liveTimeout.toMillis());
            return Optional.empty();
        } catch (ExecutionException e) {
            lastLiveFailure.set(clock.instant());
            metrics.recordLiveLookupFailure("error");
            log.warn("Live election lookup for {} {} failed: {}", state, cycleYear, e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted during live election lookup for {} {}", state, cycleYear);
            return Optional.empty();
        }
    }

    private String normalize(String jurisdiction) {
        if (jurisdiction == null) {
            throw new IllegalArgumentException("Jurisdiction is required");
        }
        String state = jurisdiction.trim().toUpperCase();
        if (!JURISDICTION.matcher(state).matches()) {
            throw new IllegalArgumentException("Jurisdiction must be a two-letter state code: " + jurisdiction);
        }
        return state;
    }

    private record ResolvedDates(ElectionDates dates, BoundarySource source) {}
}
