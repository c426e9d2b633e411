package com.xcc.challenge.funnel.exception;

/**
 * No published summary for the requested customer. Mapped to 404 by {@link GlobalExceptionHandler}.
 */
public class CustomerNotFoundException extends RuntimeException {

    public CustomerNotFoundException(String customerId) {
        super("No funnel summary for customer " + customerId);
    }
}
