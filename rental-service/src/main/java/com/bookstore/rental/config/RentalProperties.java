package com.bookstore.rental.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Typed configuration for rental rules.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "rental")
public class RentalProperties {

    /**
     * Late fee charged per started day past the due date, applied when a rental is returned.
     */
    private BigDecimal lateFeePerDay = BigDecimal.ONE;
}
