package com.lead.discovery.identity;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Browser characteristics that together identify a device.
 */
public record DeviceFingerprint(
        String userAgent,
        String screenResolution,
        String colorDepth,
        String timezone,
        String language,
        List<String> plugins,
        List<String> fonts,
        String canvasFingerprint,
        String webglFingerprint
) {
    public DeviceFingerprint {
        plugins = plugins != null ? List.copyOf(plugins) : List.of();
        fonts = fonts != null ? List.copyOf(fonts) : List.of();
    }

    /**
     * Reads the browser payload keys the content source reports. Missing keys become empty.
     */
    public static DeviceFingerprint fromBrowserData(Map<String, Object> data) {
        return new DeviceFingerprint(
                text(data, "userAgent"),
                text(data, "screenResolution"),
                text(data, "colorDepth"),
                text(data, "timezone"),
                text(data, "language"),
                list(data, "plugins"),
                list(data, "fonts"),
                text(data, "canvasFingerprint"),
                text(data, "webglFingerprint"));
    }

    /**
     * Pipe-joined component string. Plugins and fonts are sorted so their order never matters.
     */
    public String canonical() {
        return String.join("|",
                orEmpty(userAgent),
                orEmpty(screenResolution),
                orEmpty(colorDepth),
                orEmpty(timezone),
                orEmpty(language),
                plugins.stream().sorted().collect(Collectors.joining(",")),
                fonts.stream().sorted().collect(Collectors.joining(",")),
                orEmpty(canvasFingerprint),
                orEmpty(webglFingerprint));
    }

    public String digest() {
        return IdentifierHasher.hash(canonical());
    }

    private static String text(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? String.valueOf(value) : "";
    }

    private static List<String> list(Map<String, Object> data, String key) {
        if (data.get(key) instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
