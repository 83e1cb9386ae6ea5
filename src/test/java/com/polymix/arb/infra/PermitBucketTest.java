package com.polymix.arb.infra;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PermitBucketTest {

    private static final long SECOND = 1_000_000_000L;

    private final AtomicLong now = new AtomicLong();

    @Test
    void burstIsServedWithoutWaiting() {
        AbstractVenueClient.PermitBucket bucket = new AbstractVenueClient.PermitBucket(2, 2, now::get);

        assertEquals(0, bucket.reserve());
        assertEquals(0, bucket.reserve());
        assertEquals(SECOND / 2, bucket.reserve());
    }

    @Test
    void queuedCallersReserveSuccessiveSlots() {
        AbstractVenueClient.PermitBucket bucket = new AbstractVenueClient.PermitBucket(2, 1, now::get);

        assertEquals(0, bucket.reserve());
        assertEquals(SECOND / 2, bucket.reserve());
        assertEquals(SECOND, bucket.reserve());
    }

    @Test
    void refillIsCappedAtBurst() {
        AbstractVenueClient.PermitBucket bucket = new AbstractVenueClient.PermitBucket(2, 2, now::get);
        bucket.reserve();
        bucket.reserve();

        now.addAndGet(10 * SECOND);

        assertEquals(0, bucket.reserve());
        assertEquals(0, bucket.reserve());
        assertEquals(SECOND / 2, bucket.reserve());
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new AbstractVenueClient.PermitBucket(0, 1, now::get));
        assertThrows(IllegalArgumentException.class, () -> new AbstractVenueClient.PermitBucket(1, 0, now::get));
    }
}
