package dao.ore.bmine.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Manual claim trigger. Blank fields fall back to the configured claim settings.
 */
@Data
public class ClaimRequest {

    private String beneficiary;     // base58 owner

    @PositiveOrZero
    private Double threshold;       // UI amount
}
