package dao.tron.claim.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SweepRequest {

    @NotBlank
    private String asset;           // foreign token contract (base58)

    @NotBlank
    private String to;

    @NotBlank
    private String amount;          // string decimal
}
