package com.ayende.backend.service;

import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.enums.CurrencyPosition;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders amounts with the business's symbol, symbol position and decimal places,
 * e.g. {@code $54.99} or {@code 54.99€}.
 */
@Component
public class CurrencyFormatter {

    public String format(Tenant tenant, BigDecimal amount) {
        BigDecimal value = amount != null ? amount : BigDecimal.ZERO;
        String number = value.setScale(tenant.getDecimalPlaces(), RoundingMode.HALF_UP).toPlainString();

        if (tenant.getCurrencyPosition() == CurrencyPosition.AFTER) {
            return number + tenant.getCurrencySymbol();
        }
        return tenant.getCurrencySymbol() + number;
    }
}
