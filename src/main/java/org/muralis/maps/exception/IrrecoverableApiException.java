package org.muralis.maps.exception;

public class IrrecoverableApiException extends ApiException {
    
    public IrrecoverableApiException(String message) {
        super(message);
    }
}
