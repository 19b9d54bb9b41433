package dao.tron.claim.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RootRotationRequest {

    @NotBlank
    private String merkleRoot;      // 0x-prefixed bytes32
}
