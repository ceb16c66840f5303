package org.wikimedia.eventbus.common;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;
import com.google.common.escape.Escaper;
import com.google.common.net.PercentEscaper;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Identity of the wiki events are produced for and how its pages are addressed.
 */
@Value
@Accessors(fluent = true)
public class SiteInfo {
    // Same safe set as MediaWiki's wfUrlencode()
    private static final Escaper URL_ESCAPER = new PercentEscaper("-_.;@$!*(),/~:", false);

    /** Database name of the local wiki, emitted as {@code database}. */
    String dbName;
    /** Domain of the local wiki, emitted as {@code meta.domain}. */
    String serverName;
    /** Server part of canonical URLs, for example {@code https://en.wikipedia.org}. */
    String canonicalServer;
    /** Path template where {@code $1} is replaced by the page title. */
    String articlePath;
    /** Localized name of the user namespace. */
    String userNamespace;
    /** Domains of other wikis of the farm, keyed by wiki id. */
    Map<String, String> wikiDomains;

    public SiteInfo(String dbName, String serverName, String canonicalServer, String articlePath) {
        this(dbName, serverName, canonicalServer, articlePath, "User", ImmutableMap.of());
    }

    public SiteInfo(String dbName, String serverName, String canonicalServer, String articlePath,
                    String userNamespace, Map<String, String> wikiDomains) {
        this.dbName = dbName;
        this.serverName = serverName;
        this.canonicalServer = canonicalServer;
        this.articlePath = articlePath;
        this.userNamespace = userNamespace;
        this.wikiDomains = ImmutableMap.copyOf(wikiDomains);
    }

    public String articleUrl(String prefixedDbKey) {
        return canonicalServer + localUrl(prefixedDbKey);
    }

    /**
     * Server relative URL of a page, as used for links.
     */
    public String localUrl(String prefixedDbKey) {
        return articlePath.replace("$1", urlencode(prefixedDbKey));
    }

    public String userPageUrl(String userName) {
        return articleUrl(userNamespace + ":" + userName.replace(' ', '_'));
    }

    /**
     * Domain of the given wiki, the local one when no wiki id is given.
     * Unknown wiki ids have no domain.
     */
    @Nullable
    public String domainOf(@Nullable String wikiId) {
        if (wikiId == null || wikiId.equals(dbName)) return serverName;
        return wikiDomains.get(wikiId);
    }

    public static String urlencode(String value) {
        return URL_ESCAPER.escape(value);
    }
}
