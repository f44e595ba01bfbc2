package it.autograph.service;

public class SignatureNotFoundException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public SignatureNotFoundException(String message) {
        super(message);
    }
}
