package com.replaybot.cn.data;

import com.replaybot.cn.config.Config;
import com.replaybot.cn.model.ServerCandidate;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Eastmoney single-quote lookup used for previous-close prices.
 * {@code fltt=2} makes the server return decimal prices instead of scaled integers.
 * Every lookup opens its own connection and closes it before returning; nothing is pooled.
 */
public final class EastmoneyClient implements QuoteSource, EndpointProbe {
    private static final String PLACEHOLDER = "-";

    private final String path;
    private final String field;
    private final String userAgent;
    private final String probeSecid;
    private final Duration timeout;
    private final Duration probeTimeout;

    public EastmoneyClient(Config config) {
        this.path = normalizePath(config.getString("eastmoney.path", "/api/qt/stock/get"));
        this.field = config.getString("eastmoney.field", "f60");
        this.userAgent = config.getString("eastmoney.user_agent", "replaybot-downloader/1.0");
        this.probeSecid = config.getString("eastmoney.probe_secid", "1.000001");
        this.timeout = Duration.ofSeconds(Math.max(1, config.getInt("eastmoney.timeout_sec", 10)));
        this.probeTimeout = Duration.ofSeconds(Math.max(1, config.getInt("eastmoney.probe_timeout_sec", 2)));
    }

    @Override
    public QuoteResult fetchPreClose(ServerCandidate server, String code) {
        String secid = SecidMapper.secid(code);
        Reply reply;
        try {
            reply = send(server, secid, timeout);
        } catch (IOException e) {
            return QuoteResult.error(server.label() + " io: " + describe(e));
        }
        if (reply.status / 100 != 2) {
            return QuoteResult.error("eastmoney http status=" + reply.status + " secid=" + secid);
        }
        return parseQuote(reply.body, field);
    }

    @Override
    public boolean probe(ServerCandidate server) throws IOException {
        Reply reply = send(server, probeSecid, probeTimeout);
        if (reply.status / 100 != 2) {
            return false;
        }
        try {
            return new JSONObject(reply.body).optJSONObject("data") != null;
        } catch (JSONException e) {
            return false;
        }
    }

    /**
     * Extracts {@code data.<field>}; null, missing or the {@code "-"} placeholder are invalid.
     */
    static QuoteResult parseQuote(String body, String field) {
        JSONObject root;
        try {
            root = new JSONObject(body == null ? "" : body);
        } catch (JSONException e) {
            return QuoteResult.error("unparseable eastmoney payload: " + describe(e));
        }
        JSONObject data = root.optJSONObject("data");
        if (data == null) {
            return QuoteResult.invalid("missing data object");
        }
        Object raw = data.opt(field);
        if (raw == null || raw == JSONObject.NULL) {
            return QuoteResult.invalid("missing field " + field);
        }
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else {
            String text = raw.toString().trim();
            if (text.isEmpty() || PLACEHOLDER.equals(text)) {
                return QuoteResult.invalid("placeholder value for " + field);
            }
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return QuoteResult.invalid("non-numeric " + field + "=" + text);
            }
        }
        if (!Double.isFinite(value) || value <= 0.0) {
            return QuoteResult.invalid(String.format(Locale.ROOT, "non-positive %s=%s", field, raw));
        }
        return QuoteResult.ok(value);
    }

    private Reply send(ServerCandidate server, String secid, Duration limit) throws IOException {
        String url = String.format(
                Locale.ROOT,
                "http://%s:%d%s?secid=%s&fields=%s&fltt=2",
                server.host(),
                server.port(),
                path,
                URLEncoder.encode(secid, StandardCharsets.UTF_8),
                URLEncoder.encode(field, StandardCharsets.UTF_8)
        );
        HttpURLConnection conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
        try {
            conn.setRequestMethod("GET");
            conn.setInstanceFollowRedirects(true);
            conn.setUseCaches(false);
            conn.setConnectTimeout((int) limit.toMillis());
            conn.setReadTimeout((int) limit.toMillis());
            conn.setRequestProperty("User-Agent", userAgent);
            conn.setRequestProperty("Referer", "https://quote.eastmoney.com/");
            conn.setRequestProperty("Connection", "close");
            int status = conn.getResponseCode();
            InputStream stream = status >= 400 ? conn.getErrorStream() : conn.getInputStream();
            if (stream == null) {
                return new Reply(status, "");
            }
            try (InputStream in = stream) {
                return new Reply(status, new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        } finally {
            conn.disconnect();
        }
    }

    private static final class Reply {
        final int status;
        final String body;

        Reply(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }

    private static String normalizePath(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            return "/api/qt/stock/get";
        }
        return value.startsWith("/") ? value : "/" + value;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
