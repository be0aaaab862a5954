package io.s24x7.exporter.client;

/**
 * Regional Site24x7 data centres. Each region has its own API host and Zoho accounts host.
 *
 * @see <a href="https://www.site24x7.com/help/api/">Site24x7 API</a>
 */
public enum Site24x7Region {
    COM("site24x7.com"),
    EU("site24x7.eu"),
    CN("site24x7.cn"),
    IN("site24x7.in"),
    NET_AU("site24x7.net.au");

    private final String domain;

    Site24x7Region(String domain) {
        this.domain = domain;
    }

    public String domain() {
        return domain;
    }

    public String apiUrl() {
        return "https://www." + domain + "/api";
    }

    /**
     * Zoho accounts host for this region, e.g. {@code https://accounts.zoho.net.au}.
     */
    public String accountsUrl() {
        return "https://accounts.zoho." + domain.substring(domain.indexOf('.') + 1);
    }

    public static Site24x7Region fromDomain(String domain) {
        for (Site24x7Region region : values()) {
            if (region.domain.equalsIgnoreCase(domain) || region.name().equalsIgnoreCase(domain)) {
                return region;
            }
        }
        throw new IllegalArgumentException("Unknown Site24x7 endpoint: " + domain);
    }
}
