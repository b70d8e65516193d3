package com.optionscalper.api.dto.request;

import java.math.BigDecimal;
import lombok.Data;

/**
 * New protective levels for a position. A missing, zero or negative value clears that level.
 */
@Data
public class ProtectionRequest {

    private BigDecimal stopLoss;
    private BigDecimal target;
    private BigDecimal trailingDistance;
}
