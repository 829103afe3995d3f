package com.setupbrain.api.dto.request;

import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

/**
 * Request to close the open paper position by hand.
 */
@Data
public class ManualCloseRequest {

    /** Exit price. When null the latest market price is used. */
    @Positive
    private BigDecimal price;
}
