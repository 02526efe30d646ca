package dao.ore.bmine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    /**
     * Block-engine bundle endpoint (JSON-RPC sendBundle).
     */
    private String bundleUrl = "https://ny.mainnet.block-engine.jito.wtf/api/v1/bundles";

    /**
     * Websocket stream of landed-tip percentiles.
     */
    private String tipStreamUrl = "ws://bundles-api-rest.jito.wtf/api/v1/bundles/tip_stream";

    /**
     * Tip accounts; one is picked at random for each bundle's bribe.
     */
    private List<String> tipRecipients = new ArrayList<>();

    /**
     * Delay before reconnecting the tip stream after a disconnect.
     */
    private long reconnectDelayMs = 5000;
}
