package dao.tron.claim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "node")
@Data
public class NodeProperties {

    /**
     * gRPC endpoint for TRON full node. Blank means Nile testnet defaults.
     * Example: grpc.nile.trongrid.io:50051
     */
    private String endpoint;

    /**
     * gRPC endpoint for TRON solidity node
     * Example: grpc.nile.trongrid.io:50061
     */
    private String solidityEndpoint;

    /**
     * Distributor private key (hex format, 64 characters)
     */
    private String privateKey;

    /**
     * Fee limit (sun) for TRC20 transfers
     */
    private long feeLimit = 100_000_000L;

    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Timeout for getting TransactionInfo after broadcasting a tx.
         */
        private long txInfoTimeoutSeconds = 60;
        /**
         * Initial poll interval for TransactionInfo.
         */
        private long txInfoPollInitialMs = 250;
        /**
         * Maximum poll interval for TransactionInfo (backoff cap).
         */
        private long txInfoPollMaxMs = 2000;
    }
}
