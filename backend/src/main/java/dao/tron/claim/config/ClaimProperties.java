package dao.tron.claim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "claim")
@Data
public class ClaimProperties {

    /**
     * Merkle root active at startup (hex format with 0x prefix).
     * Example: 0x82067662081cf3c1061cae00166d580285a337264c1eb3c91673579a814d32ea
     * Left blank, the ledger starts on the all-zero root and accepts no claim until a rotation.
     */
    private String initialRoot;

    /**
     * Address holding administrative authority at startup (base58 format)
     * Example: TKWvD71EMFTpFVGZyqqX9fC6MQgcR9H76M
     */
    private String authority;

    /**
     * Start with claims paused
     * Default: false
     */
    private boolean paused = false;

    /**
     * Longest proof path accepted; anything longer fails verification.
     * Default: 32
     */
    private int maxProofDepth = 32;
}
