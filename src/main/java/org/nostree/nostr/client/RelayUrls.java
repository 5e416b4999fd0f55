package org.nostree.nostr.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Relay URL normalization.
 * Scheme and host are lower-cased, a missing scheme becomes {@code wss://}, a trailing
 * slash is dropped. Sessions and routes are keyed by the normalized form so that
 * {@code wss://Relay.Example.com/} and {@code wss://relay.example.com} share one socket.
 */
public final class RelayUrls {

    private static final Logger logger = LoggerFactory.getLogger(RelayUrls.class);

    /**
     * Normalize a relay URL.
     *
     * @param url Raw URL as found in a tag or configuration
     * @return Normalized {@code ws://} or {@code wss://} URL
     * @throws IllegalArgumentException if the URL is blank, not ws/wss, or has no host
     */
    public static String normalize(String url) {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("Relay URL is empty");
        }
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "wss://" + candidate;
        }

        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid relay URL: " + url, e);
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("Relay URL must use ws:// or wss://: " + url);
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Relay URL has no host: " + url);
        }

        StringBuilder normalized = new StringBuilder();
        normalized.append(scheme).append("://").append(host.toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            normalized.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath();
        if (path != null) {
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            normalized.append(path);
        }
        if (uri.getRawQuery() != null) {
            normalized.append('?').append(uri.getRawQuery());
        }
        return normalized.toString();
    }

    /**
     * Normalize a relay URL, returning empty instead of throwing.
     */
    public static Optional<String> tryNormalize(String url) {
        try {
            return Optional.of(normalize(url));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Normalize and de-duplicate a list of relay URLs, keeping first-seen order.
     * Invalid entries are logged and skipped.
     */
    public static List<String> normalizeAll(Collection<String> urls) {
        Set<String> normalized = new LinkedHashSet<>();
        if (urls == null) {
            return new ArrayList<>();
        }
        for (String url : urls) {
            Optional<String> value = tryNormalize(url);
            if (value.isPresent()) {
                normalized.add(value.get());
            } else {
                logger.warn("Skipping invalid relay URL: {}", url);
            }
        }
        return new ArrayList<>(normalized);
    }

    private RelayUrls() {
        // Utility class, no instantiation
    }
}
