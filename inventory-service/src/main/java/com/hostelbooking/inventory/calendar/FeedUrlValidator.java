package com.hostelbooking.inventory.calendar;

import com.hostelbooking.inventory.domain.exception.UnsafeFeedUrlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Only public HTTP(S) addresses may be fetched. Internal host names are refused by suffix, numeric
 * hosts must be a canonical dotted quad, and every address the host resolves to must be public.
 */
@Slf4j
@Component
public class FeedUrlValidator {

    private static final Pattern CANONICAL_IPV4 =
            Pattern.compile("(0|[1-9]\\d{0,2})(\\.(0|[1-9]\\d{0,2})){3}");
    private static final Pattern NUMERIC_HOST =
            Pattern.compile("(0x[0-9a-f]*|\\d+)(\\.(0x[0-9a-f]*|\\d+))*\\.?");

    /**
     * Name lookup used before a feed is fetched.
     */
    @FunctionalInterface
    public interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final HostResolver resolver;

    public FeedUrlValidator() {
        this(InetAddress::getAllByName);
    }

    public FeedUrlValidator(HostResolver resolver) {
        this.resolver = resolver;
    }

    public URI validate(String url) {
        if (url == null || url.isBlank()) {
            throw new UnsafeFeedUrlException(String.valueOf(url), "address is empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new UnsafeFeedUrlException(url, "malformed address");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new UnsafeFeedUrlException(url, "only http and https are allowed");
        }
        if (uri.getUserInfo() != null) {
            throw new UnsafeFeedUrlException(url, "credentials in the address are not allowed");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new UnsafeFeedUrlException(url, "host is missing");
        }
        host = host.toLowerCase(Locale.ROOT);
        if (host.equals("localhost") || host.endsWith(".localhost")
                || host.endsWith(".local") || host.endsWith(".internal")) {
            throw new UnsafeFeedUrlException(url, "internal host name");
        }
        if (NUMERIC_HOST.matcher(host).matches() && !isCanonicalIpv4(host)) {
            throw new UnsafeFeedUrlException(url, "numeric host is not a canonical IPv4 address");
        }
        String lookup = host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(lookup);
        } catch (UnknownHostException e) {
            throw new UnsafeFeedUrlException(url, "host does not resolve");
        }
        if (addresses == null || addresses.length == 0) {
            throw new UnsafeFeedUrlException(url, "host does not resolve");
        }
        for (InetAddress address : addresses) {
            if (isPrivateAddress(address)) {
                log.warn("Feed host {} resolves to non-public address {}", host, address.getHostAddress());
                throw new UnsafeFeedUrlException(url, "private or loopback address");
            }
        }
        return uri;
    }

    private boolean isCanonicalIpv4(String host) {
        if (!CANONICAL_IPV4.matcher(host).matches()) {
            return false;
        }
        for (String octet : host.split("\\.")) {
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }

    private boolean isPrivateAddress(InetAddress address) {
        byte[] bytes = address.getAddress();
        boolean uniqueLocalV6 = bytes.length == 16 && (bytes[0] & 0xfe) == 0xfc;
        boolean carrierGradeNat = bytes.length == 4 && (bytes[0] & 0xff) == 100 && (bytes[1] & 0xc0) == 64;
        return address.isLoopbackAddress()
                || address.isAnyLocalAddress()
                || address.isSiteLocalAddress()
                || address.isLinkLocalAddress()
                || address.isMulticastAddress()
                || uniqueLocalV6
                || carrierGradeNat;
    }
}
