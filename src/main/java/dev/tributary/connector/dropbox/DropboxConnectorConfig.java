package dev.tributary.connector.dropbox;

import dev.tributary.config.ConfigurationException;
import java.util.Locale;

/**
 * Settings for the {@code dropbox} connector.
 *
 * @param token          OAuth access token, redacted from {@link #toString()}
 * @param remoteUrl      root folder as {@code dropbox://<folder>}
 * @param recursive      list subfolders
 * @param apiBaseUrl     RPC endpoint host
 * @param contentBaseUrl content-download endpoint host
 */
public record DropboxConnectorConfig(
        String token,
        String remoteUrl,
        boolean recursive,
        String apiBaseUrl,
        String contentBaseUrl
) {

    public static final String SCHEME = "dropbox://";
    public static final String DEFAULT_API_BASE_URL = "https://api.dropboxapi.com";
    public static final String DEFAULT_CONTENT_BASE_URL = "https://content.dropboxapi.com";

    public DropboxConnectorConfig {
        if (token == null || token.isBlank()) {
            throw new ConfigurationException("Dropbox connector requires an access token (--token)");
        }
        if (remoteUrl == null || !remoteUrl.toLowerCase(Locale.ROOT).startsWith(SCHEME)) {
            throw new ConfigurationException("Dropbox remote URL must start with " + SCHEME + ", got: " + remoteUrl);
        }
        apiBaseUrl = stripTrailingSlash(apiBaseUrl == null ? DEFAULT_API_BASE_URL : apiBaseUrl);
        contentBaseUrl = stripTrailingSlash(contentBaseUrl == null ? DEFAULT_CONTENT_BASE_URL : contentBaseUrl);
    }

    /**
     * Folder in Dropbox API form: empty string for the account root, otherwise {@code /a/b}.
     */
    public String folderPath() {
        String folder = remoteUrl.substring(SCHEME.length()).strip();
        while (folder.endsWith("/")) {
            folder = folder.substring(0, folder.length() - 1);
        }
        while (folder.startsWith("/")) {
            folder = folder.substring(1);
        }
        return folder.isEmpty() ? "" : "/" + folder;
    }

    @Override
    public String toString() {
        return "DropboxConnectorConfig[token=***, remoteUrl=" + remoteUrl + ", recursive=" + recursive
                + ", apiBaseUrl=" + apiBaseUrl + ", contentBaseUrl=" + contentBaseUrl + "]";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
