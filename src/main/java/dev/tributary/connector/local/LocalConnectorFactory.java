package dev.tributary.connector.local;

import dev.tributary.connector.Connector;
import dev.tributary.connector.ConnectorFactory;
import dev.tributary.connector.ConnectorOptions;
import dev.tributary.document.DocumentRecordFactory;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

@Component
public class LocalConnectorFactory implements ConnectorFactory {

    @Override
    public String id() {
        return LocalConnector.ID;
    }

    @Override
    public Connector create(ConnectorOptions options, DocumentRecordFactory recordFactory) {
        LocalConnectorConfig config = new LocalConnectorConfig(
                Path.of(options.require("remote-url")),
                options.flag("recursive", false),
                options.get("file-glob").orElse(null));
        return new LocalConnector(config, recordFactory);
    }
}
