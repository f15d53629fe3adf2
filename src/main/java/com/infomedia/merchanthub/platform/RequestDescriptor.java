package com.infomedia.merchanthub.platform;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * What the platform detector is allowed to look at: the request path and its headers,
 * or nothing at all for console/background invocations.
 */
public record RequestDescriptor(boolean console, String path, Map<String, String> headers) {

    private static final RequestDescriptor CONSOLE = new RequestDescriptor(true, null, Map.of());

    public RequestDescriptor {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public static RequestDescriptor forConsole() {
        return CONSOLE;
    }

    public static RequestDescriptor of(String path, Map<String, String> headers) {
        return new RequestDescriptor(false, path, headers);
    }

    public static RequestDescriptor fromRequest(HttpServletRequest request, String... headerNames) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String name : headerNames) {
            String value = request.getHeader(name);
            if (value != null) {
                headers.put(name, value);
            }
        }
        return new RequestDescriptor(false, request.getRequestURI(), headers);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
