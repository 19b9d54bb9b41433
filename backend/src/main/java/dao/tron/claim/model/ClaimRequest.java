package dao.tron.claim.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class ClaimRequest {

    @NotBlank
    private String amount;          // string decimal, uint256

    @NotNull
    private List<String> proof;     // hex-encoded bytes32[], bottom-up
}
