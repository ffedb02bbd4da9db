package dev.tributary.connector.dropbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tributary.connector.Connector;
import dev.tributary.connector.ConnectorFactory;
import dev.tributary.connector.ConnectorOptions;
import dev.tributary.document.DocumentRecordFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds {@link DropboxConnector}s. Base URLs can be overridden with {@code --api-url} and
 * {@code --content-url} (or {@code tributary.connector.dropbox.api-url} / {@code content-url}).
 *
 * <p>The connector speaks plain HTTP through {@link RestClient}, so it declares no
 * {@linkplain #requiredDependencies() optional dependencies}.
 */
@Component
public class DropboxConnectorFactory implements ConnectorFactory {

    private final RestClient.Builder restClientBuilder;
    private final ObjectMapper objectMapper;

    public DropboxConnectorFactory(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        this.restClientBuilder = restClientBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return DropboxConnector.ID;
    }

    @Override
    public Connector create(ConnectorOptions options, DocumentRecordFactory recordFactory) {
        DropboxConnectorConfig config = new DropboxConnectorConfig(
                options.require("token"),
                options.require("remote-url"),
                options.flag("recursive", false),
                options.get("api-url").orElse(null),
                options.get("content-url").orElse(null));
        return new DropboxConnector(config, restClientBuilder.clone().build(), objectMapper, recordFactory);
    }
}
