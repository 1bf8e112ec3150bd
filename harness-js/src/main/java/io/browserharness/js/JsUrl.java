/*
 * The MIT License
 *
 * Copyright 2024 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.browserharness.js;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Parsed absolute URL, resolved against an optional base.
 */
public class JsUrl extends JsObject {

    final String protocol;
    final String username;
    final String password;
    final String hostname;
    final String port;
    final String pathname;
    String search;
    final String hash;
    final JsUrlSearchParams searchParams;

    JsUrl(String input, String base) {
        URI uri;
        try {
            uri = new URI(input.trim());
            if (base != null) {
                URI baseUri = new URI(base.trim());
                if (!baseUri.isAbsolute()) {
                    throw invalid(base);
                }
                uri = baseUri.resolve(uri);
            }
        } catch (URISyntaxException e) {
            throw invalid(input);
        }
        if (!uri.isAbsolute()) {
            throw invalid(input);
        }
        this.protocol = uri.getScheme().toLowerCase(Locale.ROOT) + ":";
        String userInfo = uri.getRawUserInfo();
        if (userInfo == null) {
            this.username = "";
            this.password = "";
        } else {
            int colon = userInfo.indexOf(':');
            this.username = colon < 0 ? userInfo : userInfo.substring(0, colon);
            this.password = colon < 0 ? "" : userInfo.substring(colon + 1);
        }
        this.hostname = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        int portNumber = uri.getPort();
        this.port = portNumber < 0 || portNumber == defaultPort(protocol) ? "" : String.valueOf(portNumber);
        String path = uri.getRawPath();
        this.pathname = path == null || path.isEmpty() ? (hostname.isEmpty() ? "" : "/") : path;
        String query = uri.getRawQuery();
        this.search = query == null || query.isEmpty() ? "" : "?" + query;
        String fragment = uri.getRawFragment();
        this.hash = fragment == null || fragment.isEmpty() ? "" : "#" + fragment;
        this.searchParams = new JsUrlSearchParams(search);
        this.searchParams.owner = this;
    }

    private static ScriptRuntimeException invalid(String input) {
        return new ScriptRuntimeException("Invalid URL: " + input);
    }

    private static int defaultPort(String protocol) {
        switch (protocol) {
            case "http:":
            case "ws:":
                return 80;
            case "https:":
            case "wss:":
                return 443;
            case "ftp:":
                return 21;
            default:
                return -1;
        }
    }

    void setQuery(String query) {
        search = query.isEmpty() ? "" : "?" + query;
    }

    String host() {
        return port.isEmpty() ? hostname : hostname + ":" + port;
    }

    String origin() {
        if (hostname.isEmpty()) {
            return "null";
        }
        return protocol + "//" + host();
    }

    String href() {
        StringBuilder sb = new StringBuilder(protocol);
        if (!hostname.isEmpty()) {
            sb.append("//");
            if (!username.isEmpty()) {
                sb.append(username);
                if (!password.isEmpty()) {
                    sb.append(':').append(password);
                }
                sb.append('@');
            }
            sb.append(host());
        }
        return sb.append(pathname).append(search).append(hash).toString();
    }

    @Override
    public String toString() {
        return href();
    }

}
