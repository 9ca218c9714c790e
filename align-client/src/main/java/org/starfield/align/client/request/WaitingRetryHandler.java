package org.starfield.align.client.request;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Arrays;

import javax.net.ssl.SSLException;

import org.apache.http.impl.client.DefaultHttpRequestRetryHandler;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A retry handler that, unlike the default one, also retries idempotent requests that failed with an
 * {@link UnknownHostException} and waits before each of those retries to ride out transient DNS problems.
 */
public class WaitingRetryHandler extends DefaultHttpRequestRetryHandler {

    private final long waitMilliseconds;

    public WaitingRetryHandler() {
        this(5000);
    }

    public WaitingRetryHandler(final long waitMilliseconds) {
        super(3, false, Arrays.asList(InterruptedIOException.class, ConnectException.class, SSLException.class));
        this.waitMilliseconds = waitMilliseconds;
    }

    public long getWaitMilliseconds() {
        return waitMilliseconds;
    }

    @Override
    public boolean retryRequest(final IOException exception,
                                final int executionCount,
                                final HttpContext context) {

        boolean retry = super.retryRequest(exception, executionCount, context);

        if (retry && (exception instanceof UnknownHostException)) {
            LOG.info("retryRequest: waiting {}ms before retrying request that failed from UnknownHostException",
                     waitMilliseconds);
            try {
                Thread.sleep(waitMilliseconds);
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.warn("retryRequest: retry wait was interrupted, giving up", ie);
                retry = false;
            }
        }

        return retry;
    }

    private static final Logger LOG = LoggerFactory.getLogger(WaitingRetryHandler.class);

}
