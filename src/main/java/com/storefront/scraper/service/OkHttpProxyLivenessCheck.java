package com.storefront.scraper.service;

import com.storefront.scraper.enums.ProxyProtocol;
import com.storefront.scraper.interceptor.HeadersInterceptor;
import com.storefront.scraper.interfaces.ProxyLivenessCheck;
import com.storefront.scraper.model.ProxyEndpoint;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.Map;

/**
 * Issues a lightweight GET through the candidate proxy.
 */
@Component
@Slf4j
public class OkHttpProxyLivenessCheck implements ProxyLivenessCheck {

    private static final String CHECK_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final OkHttpClient baseClient;
    private final String checkUrl;

    public OkHttpProxyLivenessCheck(OkHttpClient checkHttpClient,
                                    @Value("${scraper.proxy.check.url:https://httpbin.org/ip}") String checkUrl) {
        this.baseClient = checkHttpClient;
        this.checkUrl = checkUrl;
    }

    @Override
    public boolean isAlive(ProxyEndpoint endpoint) {
        OkHttpClient client = clientFor(endpoint);
        Request request = new Request.Builder().url(checkUrl).get().build();
        try (Response response = client.newCall(request).execute()) {
            boolean ok = response.isSuccessful();
            if (!ok) {
                log.debug("Proxy check rejected | proxy={} | status={}", endpoint.id(), response.code());
            }
            return ok;
        } catch (IOException e) {
            log.debug("Proxy check failed | proxy={} | error={}", endpoint.id(), e.getMessage());
            return false;
        }
    }

    OkHttpClient clientFor(ProxyEndpoint endpoint) {
        Proxy.Type type = endpoint.getProtocol() == ProxyProtocol.SOCKS5 ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
        OkHttpClient.Builder builder = baseClient.newBuilder()
                .proxy(new Proxy(type, InetSocketAddress.createUnresolved(endpoint.getHost(), endpoint.getPort())))
                .addInterceptor(new HeadersInterceptor(CHECK_USER_AGENT, Map.of("Cache-Control", "no-cache")));
        if (endpoint.hasCredentials()) {
            String credential = Credentials.basic(endpoint.getUsername(),
                    endpoint.getPassword() == null ? "" : endpoint.getPassword());
            builder.proxyAuthenticator((route, response) -> {
                if (response.request().header("Proxy-Authorization") != null) {
                    return null;
                }
                return response.request().newBuilder().header("Proxy-Authorization", credential).build();
            });
        }
        return builder.build();
    }
}
