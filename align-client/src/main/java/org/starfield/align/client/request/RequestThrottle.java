package org.starfield.align.client.request;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Limits the rate and total number of requests sent to a remote service by one process.
 * Callers invoke {@link #acquire()} before each request.
 */
public class RequestThrottle {

    private final long minIntervalMilliseconds;
    private final int maxRequests;

    private int requestCount;
    private long lastRequestTime;

    /**
     * @param  minIntervalMilliseconds  minimum time between the start of consecutive requests.
     * @param  maxRequests              maximum number of requests allowed.
     */
    public RequestThrottle(final long minIntervalMilliseconds,
                           final int maxRequests) {
        this.minIntervalMilliseconds = minIntervalMilliseconds;
        this.maxRequests = maxRequests;
        this.requestCount = 0;
        this.lastRequestTime = 0;
    }

    public synchronized int getRequestCount() {
        return requestCount;
    }

    /**
     * Waits until the minimum interval since the previous request has passed.
     *
     * @throws IllegalStateException
     *   if the maximum number of requests has already been acquired.
     *
     * @throws InterruptedException
     *   if the wait is interrupted.
     */
    public synchronized void acquire()
            throws IllegalStateException, InterruptedException {

        if (requestCount >= maxRequests) {
            throw new IllegalStateException("too many requests, all " + maxRequests + " allowed requests were made");
        }

        if (requestCount > 0) {
            long waitMilliseconds = (lastRequestTime + minIntervalMilliseconds) - System.currentTimeMillis();
            while (waitMilliseconds > 0) {
                LOG.debug("acquire: waiting {}ms before next request", waitMilliseconds);
                wait(waitMilliseconds);
                waitMilliseconds = (lastRequestTime + minIntervalMilliseconds) - System.currentTimeMillis();
            }
        }

        requestCount++;
        lastRequestTime = System.currentTimeMillis();
    }

    private static final Logger LOG = LoggerFactory.getLogger(RequestThrottle.class);
}
