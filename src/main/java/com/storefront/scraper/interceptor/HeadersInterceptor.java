package com.storefront.scraper.interceptor;

import lombok.RequiredArgsConstructor;
import okhttp3.Interceptor;
import okhttp3.Request;

import java.io.IOException;
import java.util.Map;

/**
 * Makes check traffic look like an ordinary browser fetch.
 */
@RequiredArgsConstructor
public class HeadersInterceptor implements Interceptor {

    private final String userAgent;
    private final Map<String, String> headers;

    @Override
    public okhttp3.Response intercept(Interceptor.Chain chain) throws IOException {
        Request original = chain.request();

        Request.Builder builder = original.newBuilder()
                .header("User-Agent", userAgent != null ? userAgent : "Mozilla/5.0")
                .header("Accept", "application/json, text/plain, */*")
                .header("Connection", "keep-alive");

        headers.forEach((key, value) -> {
            if (!key.equalsIgnoreCase("user-agent")) {
                builder.header(key, value);
            }
        });

        return chain.proceed(builder.build());
    }
}
