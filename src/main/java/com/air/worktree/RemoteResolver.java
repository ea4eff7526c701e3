package com.air.worktree;

import java.util.Map;

/**
 * Maps a source tree name (e.g. {@code netdev/net-next}) to a git remote name and URL.
 */
public class RemoteResolver {

    public static final String DEFAULT_URL_TEMPLATE = "git://git.kernel.org/pub/scm/linux/kernel/git/{tree}.git";

    private final String urlTemplate;
    private final Map<String, String> urls;

    public RemoteResolver(String urlTemplate, Map<String, String> urls) {
        this.urlTemplate = urlTemplate == null || urlTemplate.isBlank() ? DEFAULT_URL_TEMPLATE : urlTemplate;
        this.urls = urls == null ? Map.of() : Map.copyOf(urls);
    }

    /** Explicit mapping wins over the template. */
    public String url(String tree) {
        String explicit = urls.get(tree);
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        return urlTemplate.replace("{tree}", tree);
    }

    /** Remote name safe for use in {@code refs/remotes/<name>/...}. */
    public String remoteName(String tree) {
        return tree.replaceAll("[^A-Za-z0-9._-]", "-");
    }
}
