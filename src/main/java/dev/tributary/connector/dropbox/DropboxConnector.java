package dev.tributary.connector.dropbox;

import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import dev.tributary.connector.ConnectionException;
import dev.tributary.connector.Connector;
import dev.tributary.document.DocumentRecord;
import dev.tributary.document.DocumentRecordFactory;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Connector over the Dropbox HTTP API v2.
 *
 * <p>Records are keyed by {@code path_lower} and their relative paths are derived from it, so a
 * rename that only changes casing keeps every cached artifact in place. The display path is kept in
 * the record metadata. A missing root folder yields an empty listing rather than an error.
 */
public class DropboxConnector implements Connector {

    public static final String ID = "dropbox";

    static final String API_ARG_HEADER = "Dropbox-API-Arg";

    private static final Logger log = LoggerFactory.getLogger(DropboxConnector.class);

    private final DropboxConnectorConfig config;
    private final RestClient restClient;
    private final DocumentRecordFactory recordFactory;
    // Dropbox-API-Arg travels in a header, so the JSON must stay ASCII.
    private final ObjectWriter apiArgWriter;

    private volatile boolean initialized;

    public DropboxConnector(DropboxConnectorConfig config, RestClient restClient, ObjectMapper objectMapper,
                            DocumentRecordFactory recordFactory) {
        this.config = config;
        this.restClient = restClient;
        this.recordFactory = recordFactory;
        this.apiArgWriter = objectMapper.writer().with(JsonWriteFeature.ESCAPE_NON_ASCII);
    }

    @Override
    public String id() {
        return ID;
    }

    /**
     * Validates the token with {@code /2/check/user}. Subsequent calls are no-ops.
     */
    @Override
    public synchronized void initialize() throws ConnectionException {
        if (initialized) {
            return;
        }
        try {
            restClient.post()
                    .uri(config.apiBaseUrl() + "/2/check/user")
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("query", "tributary"))
                    .retrieve()
                    .toBodilessEntity();
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new ConnectionException("Dropbox rejected the access token", e);
        } catch (RestClientException e) {
            throw new ConnectionException("Dropbox API unreachable at " + config.apiBaseUrl(), e);
        }
        initialized = true;
        log.info("Connected to Dropbox ({})", config.remoteUrl());
    }

    @Override
    public List<DocumentRecord> listDocuments() throws ConnectionException {
        String folder = config.folderPath();
        List<DocumentRecord> records = new ArrayList<>();
        try {
            DropboxListFolderResponse page = listFolder(folder);
            collectFiles(page, folder, records);
            while (page.hasMore()) {
                page = continueListing(page.cursor());
                collectFiles(page, folder, records);
            }
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new ConnectionException("Dropbox rejected the access token", e);
        } catch (HttpClientErrorException.Conflict e) {
            if (e.getResponseBodyAsString().contains("not_found")) {
                log.info("Dropbox folder {} does not exist, nothing to process", config.remoteUrl());
                return List.of();
            }
            throw new ConnectionException("Dropbox refused to list " + config.remoteUrl(), e);
        } catch (RestClientException e) {
            throw new ConnectionException("Failed to list " + config.remoteUrl(), e);
        }
        log.info("Found {} files under {} (recursive={})", records.size(), config.remoteUrl(), config.recursive());
        return records;
    }

    /**
     * Streams {@code /2/files/download}. The HTTP response stays open until the returned stream is
     * closed.
     */
    @Override
    public InputStream openContent(DocumentRecord record) throws IOException {
        String argument = apiArgWriter.writeValueAsString(Map.of("path", downloadKey(record)));
        try {
            return restClient.post()
                    .uri(config.contentBaseUrl() + "/2/files/download")
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .header(API_ARG_HEADER, argument)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            int status = response.getStatusCode().value();
                            response.close();
                            throw new IOException("Dropbox download of " + record.sourceIdentity()
                                    + " failed with HTTP " + status);
                        }
                        return new ResponseInputStream(response);
                    }, false);
        } catch (RestClientException e) {
            throw new IOException("Dropbox download of " + record.sourceIdentity() + " failed", e);
        }
    }

    @Override
    public void cleanup() {
        initialized = false;
        log.debug("Released Dropbox session for {}", config.remoteUrl());
    }

    private DropboxListFolderResponse listFolder(String folder) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", folder);
        body.put("recursive", config.recursive());
        body.put("include_non_downloadable_files", false);
        return rpc("/2/files/list_folder", body);
    }

    private DropboxListFolderResponse continueListing(String cursor) {
        return rpc("/2/files/list_folder/continue", Map.of("cursor", cursor));
    }

    private DropboxListFolderResponse rpc(String endpoint, Map<String, Object> body) {
        DropboxListFolderResponse response = restClient.post()
                .uri(config.apiBaseUrl() + endpoint)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(DropboxListFolderResponse.class);
        if (response == null) {
            throw new RestClientException("Empty response from Dropbox " + endpoint);
        }
        return response;
    }

    private void collectFiles(DropboxListFolderResponse page, String folder, List<DocumentRecord> records) {
        for (DropboxEntry entry : page.entries()) {
            if (!entry.isFile() || entry.pathLower() == null) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            putIfPresent(metadata, "id", entry.id());
            putIfPresent(metadata, "path_display", entry.pathDisplay());
            putIfPresent(metadata, "server_modified", entry.serverModified());
            putIfPresent(metadata, "content_hash", entry.contentHash());
            records.add(recordFactory.create(
                    entry.pathLower(), relativePath(entry, folder), entry.size(), metadata));
        }
    }

    static String relativePath(DropboxEntry entry, String folder) {
        String path = entry.pathLower();
        String folderLower = folder.toLowerCase(Locale.ROOT);
        if (!folderLower.isEmpty() && path.startsWith(folderLower + "/")) {
            path = path.substring(folderLower.length() + 1);
        }
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return path;
    }

    private static String downloadKey(DocumentRecord record) {
        Object id = record.metadata().get("id");
        return id != null ? id.toString() : record.sourceIdentity();
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }

    private String bearer() {
        return "Bearer " + config.token();
    }

    private static final class ResponseInputStream extends FilterInputStream {

        private final ClientHttpResponse response;

        ResponseInputStream(ClientHttpResponse response) throws IOException {
            super(response.getBody());
            this.response = response;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                response.close();
            }
        }
    }
}
