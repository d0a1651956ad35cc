package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.RedeemPointsCommand;
import com.example.fulfillment.application.dto.RedemptionResult;

public interface RedeemPointsUseCase {

    /**
     * Converts points into a discount. Validation failures leave the ledger untouched.
     *
     * @throws com.example.fulfillment.domain.exception.LoyaltyValidationException with the rejection reason
     */
    RedemptionResult redeemPoints(RedeemPointsCommand command);
}
