package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.common.ExchangeCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 后端 REST 调用的公共封装：JSON POST、非 2xx 转为 BackendFailureException、取消信号中止等待与读取。
 */
public class BackendHttp {
    private static final Logger log = LoggerFactory.getLogger(BackendHttp.class);

    private final HttpClient httpClient;
    private final String backend;

    public BackendHttp(String backend) {
        this(backend, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public BackendHttp(String backend, HttpClient httpClient) {
        this.backend = backend;
        this.httpClient = httpClient;
    }

    public String postJson(String url, Map<String, String> headers, String body, long timeoutMs, CancellationToken cancel) {
        HttpRequest req = request(url, headers, body, timeoutMs, "application/json");
        HttpResponse<String> resp = await(httpClient.sendAsync(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)), cancel);
        log.debug("{} call status: {} bodyLen={}", backend, resp.statusCode(), resp.body() == null ? 0 : resp.body().length());
        if (resp.statusCode() / 100 != 2) {
            throw new BackendFailureException(backend, resp.statusCode(), "HTTP " + resp.statusCode() + ": " + preview(resp.body(), 300), null);
        }
        return resp.body();
    }

    /**
     * 以流方式读取响应体；调用方负责关闭返回的流。取消时流会被关闭，读取方随即收到 IOException。
     */
    public InputStream postStream(String url, Map<String, String> headers, String body, long timeoutMs, CancellationToken cancel) {
        HttpRequest req = request(url, headers, body, timeoutMs, "text/event-stream");
        HttpResponse<InputStream> resp = await(httpClient.sendAsync(req, HttpResponse.BodyHandlers.ofInputStream()), cancel);
        log.debug("{} stream status: {}", backend, resp.statusCode());
        if (resp.statusCode() / 100 != 2) {
            String errBody = "";
            try (InputStream es = resp.body()) {
                errBody = new String(es.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("{} read error body failed", backend, e);
            }
            throw new BackendFailureException(backend, resp.statusCode(), "stream HTTP " + resp.statusCode() + " body=" + preview(errBody, 300), null);
        }
        return resp.body();
    }

    /**
     * 在取消信号触发时关闭资源，返回的注册需在读取结束后移除。
     */
    public static CancellationToken.Registration closeOnCancel(CancellationToken cancel, Closeable resource) {
        return cancel.onCancel(() -> closeQuietly(resource));
    }

    public static void closeQuietly(Closeable resource) {
        try {
            resource.close();
        } catch (IOException e) {
            log.debug("Close resource failed", e);
        }
    }

    private HttpRequest request(String url, Map<String, String> headers, String body, long timeoutMs, String accept) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(url))
                .header("Content-Type", "application/json")
                .header("Accept", accept)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (timeoutMs > 0) {
            b.timeout(Duration.ofMillis(timeoutMs));
        }
        if (headers != null) {
            headers.forEach(b::header);
        }
        return b.build();
    }

    private <T> HttpResponse<T> await(CompletableFuture<HttpResponse<T>> future, CancellationToken cancel) {
        CancellationToken.Registration reg = cancel.onCancel(() -> future.cancel(true));
        try {
            return future.join();
        } catch (CancellationException e) {
            throw new ExchangeCancelledException(cancel.getReason());
        } catch (CompletionException e) {
            if (cancel.isCancelled()) {
                throw new ExchangeCancelledException(cancel.getReason());
            }
            throw new BackendFailureException(backend, "request failed: " + e.getCause(), e.getCause());
        } finally {
            reg.remove();
        }
    }

    public static String preview(String s, int max) {
        if (s == null) return "";
        String t = s.replace('\n', ' ');
        return t.length() <= max ? t : t.substring(0, max) + "...";
    }
}
