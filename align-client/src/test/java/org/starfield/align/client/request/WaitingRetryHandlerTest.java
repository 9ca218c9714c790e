package org.starfield.align.client.request;

import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;

import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link WaitingRetryHandler} class.
 */
public class WaitingRetryHandlerTest {

    @Test
    public void testRetryRequest() {

        final WaitingRetryHandler handler = new WaitingRetryHandler(50);
        final HttpClientContext context = HttpClientContext.create();
        context.setAttribute(HttpClientContext.HTTP_REQUEST, new HttpGet("http://localhost/index.php?page=1"));

        final long start = System.currentTimeMillis();
        Assert.assertTrue("unknown host should be retried",
                          handler.retryRequest(new UnknownHostException("archive"), 1, context));
        Assert.assertTrue("retry should wait", System.currentTimeMillis() - start >= 50);

        Assert.assertFalse("unknown host should not be retried after 3 attempts",
                           handler.retryRequest(new UnknownHostException("archive"), 4, context));
        Assert.assertFalse("connect failures should not be retried",
                           handler.retryRequest(new ConnectException("refused"), 1, context));
        Assert.assertTrue("other idempotent failures should be retried",
                          handler.retryRequest(new IOException("reset"), 1, context));
    }

}
