package com.teamsbot.webhook;

import com.teamsbot.config.WebhookSettings;
import com.teamsbot.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which webhook destinations the bot may call. HTTPS only unless insecure URLs are
 * allowed, and no loopback or private-network hosts unless explicitly enabled.
 */
@Component
@RequiredArgsConstructor
public class WebhookUrlPolicy {

    private static final Set<String> BLOCKED_HOSTS = Set.of("localhost", "0.0.0.0", "::1", "[::1]");
    private static final Pattern NUMERIC_HOST =
            Pattern.compile("^(0x[0-9a-f]{0,8}|\\d{1,12})(\\.(0x[0-9a-f]{0,8}|\\d{1,12})){0,3}$");

    private final WebhookSettings settings;

    /**
     * @return the parsed destination
     * @throws InvalidRequestException if the URL is malformed or not allowed
     */
    public URI validate(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidRequestException("Webhook URL is required");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidRequestException("Malformed webhook URL: " + url);
        }

        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("https") && !(settings.isAllowInsecure() && scheme.equals("http"))) {
            throw new InvalidRequestException(settings.isAllowInsecure()
                    ? "Webhook URL must use http or https: " + url
                    : "Webhook URL must use https: " + url);
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new InvalidRequestException("Webhook URL is missing a host: " + url);
        }

        if (!settings.isAllowPrivateHosts() && isPrivateHost(host.toLowerCase(Locale.ROOT))) {
            throw new InvalidRequestException("Webhook URL points to a private or loopback host: " + host);
        }
        return uri;
    }

    private boolean isPrivateHost(String host) {
        if (BLOCKED_HOSTS.contains(host) || host.endsWith(".localhost")) {
            return true;
        }
        // Only literal addresses are checked, hostnames are not resolved here
        InetAddress address = literalAddress(host);
        if (address == null) {
            return false;
        }
        return address.isLoopbackAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isAnyLocalAddress()
                || isUniqueLocal(address);
    }

    private static InetAddress literalAddress(String host) {
        try {
            if (host.contains(":")) {
                return InetAddress.getByName(host.replace("[", "").replace("]", ""));
            }
            byte[] ipv4 = parseIpv4(host);
            return ipv4 != null ? InetAddress.getByAddress(ipv4) : null;
        } catch (UnknownHostException e) {
            throw new InvalidRequestException("Malformed webhook host: " + host);
        }
    }

    /**
     * Parses the IPv4 forms HTTP clients accept: dotted quads plus the shortened, decimal,
     * octal and hex forms such as {@code 2130706433} or {@code 0x7f.0.0.1}.
     *
     * @return the four address bytes, or null if {@code host} is not numeric
     */
    static byte[] parseIpv4(String host) {
        if (!NUMERIC_HOST.matcher(host).matches()) {
            return null;
        }
        String[] parts = host.split("\\.");
        long[] values = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = parsePart(parts[i], host);
        }

        long address = 0;
        for (int i = 0; i < parts.length - 1; i++) {
            if (values[i] > 0xFF) {
                throw new InvalidRequestException("Malformed webhook host: " + host);
            }
            address = (address << 8) | values[i];
        }
        int remainingBytes = 4 - (parts.length - 1);
        long last = values[parts.length - 1];
        if (last >= (1L << (8 * remainingBytes))) {
            throw new InvalidRequestException("Malformed webhook host: " + host);
        }
        address = (address << (8 * remainingBytes)) | last;

        return new byte[] {
                (byte) (address >>> 24), (byte) (address >>> 16), (byte) (address >>> 8), (byte) address
        };
    }

    private static long parsePart(String part, String host) {
        try {
            if (part.startsWith("0x")) {
                return part.length() == 2 ? 0 : Long.parseLong(part.substring(2), 16);
            }
            if (part.length() > 1 && part.startsWith("0")) {
                return Long.parseLong(part.substring(1), 8);
            }
            return Long.parseLong(part);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Malformed webhook host: " + host);
        }
    }

    // fc00::/7, which isSiteLocalAddress (fec0::/10) does not cover
    private static boolean isUniqueLocal(InetAddress address) {
        return address instanceof Inet6Address && (address.getAddress()[0] & 0xFE) == 0xFC;
    }
}
