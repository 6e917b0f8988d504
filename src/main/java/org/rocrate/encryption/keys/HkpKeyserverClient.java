/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except
 * in compliance with the License. A copy of the License is located at
 *
 * http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 */

package org.rocrate.encryption.keys;

import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Retrieves ASCII-armored public keys from an HKP key server. Lookups are best effort: every
 * failure is reported as a {@link KeyserverWarning} and never thrown.
 */
public class HkpKeyserverClient {

    public static final String LOOKUP_PATH = "/pks/lookup";
    public static final int HKP_PORT = 11371;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private static final String ARMOR_HEADER = "-----BEGIN PGP PUBLIC KEY BLOCK-----";

    private final HttpClient httpClient;
    private final Duration timeout;

    public HkpKeyserverClient() {
        this(HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), DEFAULT_TIMEOUT);
    }

    public HkpKeyserverClient(final HttpClient httpClient, final Duration timeout) {
        this.httpClient = requireNonNull(httpClient, "httpClient is required");
        this.timeout = requireNonNull(timeout, "timeout is required");
    }

    /**
     * The machine-readable HKP lookup URI for one key.
     *
     * @throws IllegalArgumentException if the key server URL is malformed or has an unsupported scheme.
     */
    public static URI lookupUri(final String keyserverUrl, final String fingerprint) {
        notBlank(fingerprint, "fingerprint is required");
        final String search = URLEncoder.encode("0x" + fingerprint, StandardCharsets.UTF_8);
        return URI.create(httpBase(keyserverUrl) + LOOKUP_PATH + "?op=get&options=mr&search=" + search);
    }

    /**
     * Translates a key server URL to the HTTP base URL it is served on. {@code hkp://} maps to
     * {@code http://} on port {@value #HKP_PORT} unless a port is given, and {@code hkps://} maps to
     * {@code https://}. HTTP(S) URLs are kept as they are.
     *
     * @throws IllegalArgumentException if the URL is malformed, has no host or has another scheme.
     */
    public static String httpBase(final String keyserverUrl) {
        notBlank(keyserverUrl, "keyserverUrl is required");
        final URI uri = URI.create(StringUtils.removeEnd(keyserverUrl.trim(), "/"));
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Key server URL has no scheme or host: " + keyserverUrl);
        }
        final String path = StringUtils.defaultString(uri.getRawPath());
        switch (uri.getScheme().toLowerCase(Locale.ROOT)) {
            case "hkp":
                return "http://" + uri.getRawAuthority() + (uri.getPort() == -1 ? ":" + HKP_PORT : "") + path;
            case "hkps":
                return "https://" + uri.getRawAuthority() + path;
            case "http":
            case "https":
                return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority() + path;
            default:
                throw new IllegalArgumentException("Unsupported key server scheme " + uri.getScheme());
        }
    }

    /**
     * Fetches each fingerprint in turn.
     *
     * @param keyserverUrl The base URL of the key server.
     * @param fingerprints The fingerprints to look up.
     * @return The armored key blocks that were returned, and the warnings for those that were not.
     */
    public Lookup fetch(final String keyserverUrl, final Collection<String> fingerprints) {
        notBlank(keyserverUrl, "keyserverUrl is required");
        requireNonNull(fingerprints, "fingerprints are required");

        final Map<String, String> armoredKeys = new LinkedHashMap<>();
        final List<KeyserverWarning> warnings = new ArrayList<>();
        for (String fingerprint : fingerprints) {
            try {
                final HttpRequest request = HttpRequest.newBuilder(lookupUri(keyserverUrl, fingerprint))
                        .timeout(timeout)
                        .GET()
                        .build();
                final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() != 200) {
                    warnings.add(KeyserverWarning.report(fingerprint, "HTTP status " + response.statusCode()));
                } else if (response.body() == null || !response.body().contains(ARMOR_HEADER)) {
                    warnings.add(KeyserverWarning.report(fingerprint, "response holds no armored public key"));
                } else {
                    armoredKeys.put(fingerprint, response.body());
                }
            } catch (IOException e) {
                warnings.add(KeyserverWarning.report(fingerprint, e.toString()));
            } catch (IllegalArgumentException e) {
                warnings.add(KeyserverWarning.report(fingerprint, "invalid key server URL: " + e.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                warnings.add(KeyserverWarning.report(fingerprint, "interrupted"));
                break;
            }
        }
        return new Lookup(armoredKeys, warnings);
    }

    /**
     * Raw key server responses, keyed by the fingerprint that was searched for.
     */
    public static final class Lookup {
        private final Map<String, String> armoredKeys;
        private final List<KeyserverWarning> warnings;

        Lookup(final Map<String, String> armoredKeys, final List<KeyserverWarning> warnings) {
            this.armoredKeys = Collections.unmodifiableMap(armoredKeys);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public Map<String, String> getArmoredKeys() {
            return armoredKeys;
        }

        public List<KeyserverWarning> getWarnings() {
            return warnings;
        }
    }
}
