package dev.tributary.connector.dropbox;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One page of {@code files/list_folder} or {@code files/list_folder/continue}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DropboxListFolderResponse(
        List<DropboxEntry> entries,
        String cursor,
        @JsonProperty("has_more") boolean hasMore
) {
    public DropboxListFolderResponse {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
