package com.storefront.scraper.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Logs check requests with their round-trip time. The body is left unread.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        log.debug("→ {} {}", request.method(), request.url());

        long startNs = System.nanoTime();
        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← FAILED after {}ms: {}", elapsedMs, e.getMessage());
            throw e;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        log.debug("← {} {} | Total: {}ms", response.code(), request.url().host(), elapsedMs);
        return response;
    }
}
