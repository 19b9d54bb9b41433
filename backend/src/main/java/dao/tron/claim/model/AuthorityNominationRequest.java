package dao.tron.claim.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AuthorityNominationRequest {

    @NotBlank
    private String nominee;
}
