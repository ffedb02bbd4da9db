package dev.tributary.connector.dropbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a {@code files/list_folder} page. Only {@code file} entries become records.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DropboxEntry(
        @JsonProperty(".tag") String tag,
        String id,
        String name,
        @JsonProperty("path_lower") String pathLower,
        @JsonProperty("path_display") String pathDisplay,
        Long size,
        @JsonProperty("server_modified") String serverModified,
        @JsonProperty("content_hash") String contentHash
) {

    public boolean isFile() {
        return "file".equals(tag);
    }
}
