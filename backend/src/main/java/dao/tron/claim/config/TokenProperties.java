package dao.tron.claim.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

@Configuration
@ConfigurationProperties(prefix = "token")
@Data
public class TokenProperties {

    /**
     * Claim token contract address (base58 format)
     * Example: TR7NHqjeKQxGTCi8q8ZY4pL8otSzgjLj6t
     */
    private String address;

    /**
     * Ledger backend: "in-memory" or "trident"
     */
    private String mode = "in-memory";

    /**
     * Holder that pays out claims in in-memory mode
     */
    private String distributor = "distributor";

    /**
     * Claim token balance credited to the distributor at startup (in-memory mode only)
     */
    private BigInteger initialSupply = BigInteger.ZERO;
}
