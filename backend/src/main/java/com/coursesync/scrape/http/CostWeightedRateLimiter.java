package com.coursesync.scrape.http;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.RateLimitStatus;
import com.coursesync.scrape.model.RequestLane;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every upstream call, plus a small burst reserve that only the foreground lane may
 * draw from. Callers block until admitted; nothing is ever rejected.
 */
@Component
public class CostWeightedRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(CostWeightedRateLimiter.class);
    private static final long MAX_WAIT_SLICE_MS = 1_000L;

    private final double bucketCapacity;
    private final double refillPerNano;
    private final double burstCapacity;
    private final double burstRefillPerNano;
    private final LongSupplier nanoClock;

    private double bucketTokens;
    private double burstTokens;
    private long lastRefillNanos;
    private int foregroundWaiting;
    private long foregroundAdmitted;
    private long backgroundAdmitted;

    @Autowired
    public CostWeightedRateLimiter(ScraperProperties properties) {
        this(properties.getRateLimit(), System::nanoTime);
    }

    public CostWeightedRateLimiter(ScraperProperties.RateLimit config, LongSupplier nanoClock) {
        this.bucketCapacity = config.getBucketCapacity();
        this.refillPerNano = config.getRefillPerMinute() / TimeUnit.MINUTES.toNanos(1);
        this.burstCapacity = config.getBurstCapacity();
        this.burstRefillPerNano = config.getBurstRefillPerMinute() / TimeUnit.MINUTES.toNanos(1);
        this.nanoClock = nanoClock;
        this.bucketTokens = bucketCapacity;
        this.burstTokens = burstCapacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public void admit(RequestLane lane, double cost) throws InterruptedException {
        double effectiveCost = clampCost(cost);
        boolean foreground = lane == RequestLane.FOREGROUND;
        synchronized (this) {
            if (foreground) {
                foregroundWaiting++;
            }
            try {
                while (true) {
                    refill();
                    boolean yieldToForeground = !foreground && foregroundWaiting > 0;
                    if (!yieldToForeground && consume(lane, effectiveCost)) {
                        return;
                    }
                    long waitMs = yieldToForeground ? 50L : millisUntilAvailable(lane, effectiveCost);
                    log.debug("Rate limiter holding {} call of cost {} for {}ms", lane, effectiveCost, waitMs);
                    wait(Math.max(1L, Math.min(waitMs, MAX_WAIT_SLICE_MS)));
                }
            } finally {
                if (foreground) {
                    foregroundWaiting--;
                    notifyAll();
                }
            }
        }
    }

    public synchronized boolean tryAdmit(RequestLane lane, double cost) {
        refill();
        return consume(lane, clampCost(cost));
    }

    public synchronized RateLimitStatus status() {
        refill();
        return new RateLimitStatus(
            bucketTokens,
            bucketCapacity,
            burstTokens,
            burstCapacity,
            foregroundAdmitted,
            backgroundAdmitted
        );
    }

    double clampCost(double cost) {
        if (Double.isNaN(cost) || cost <= 0) {
            return 0.0;
        }
        return Math.min(cost, bucketCapacity);
    }

    private boolean consume(RequestLane lane, double cost) {
        if (bucketTokens >= cost) {
            bucketTokens -= cost;
            countAdmission(lane);
            return true;
        }
        if (lane == RequestLane.FOREGROUND) {
            double shortfall = cost - Math.max(0.0, bucketTokens);
            if (burstTokens >= shortfall) {
                burstTokens -= shortfall;
                bucketTokens = Math.min(bucketTokens, 0.0);
                countAdmission(lane);
                return true;
            }
        }
        return false;
    }

    private void countAdmission(RequestLane lane) {
        if (lane == RequestLane.FOREGROUND) {
            foregroundAdmitted++;
        } else {
            backgroundAdmitted++;
        }
    }

    private long millisUntilAvailable(RequestLane lane, double cost) {
        double missing = cost - bucketTokens;
        if (lane == RequestLane.FOREGROUND && burstRefillPerNano > 0) {
            double missingWithBurst = cost - bucketTokens - burstTokens;
            double viaBucket = missing / refillPerNano;
            double viaBurst = missingWithBurst / (refillPerNano + burstRefillPerNano);
            return nanosToMillis(Math.min(viaBucket, viaBurst));
        }
        return nanosToMillis(missing / refillPerNano);
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        lastRefillNanos = now;
        bucketTokens = Math.min(bucketCapacity, bucketTokens + elapsed * refillPerNano);
        burstTokens = Math.min(burstCapacity, burstTokens + elapsed * burstRefillPerNano);
    }

    private static long nanosToMillis(double nanos) {
        if (nanos <= 0) {
            return 1L;
        }
        return (long) Math.ceil(nanos / 1_000_000.0);
    }
}
