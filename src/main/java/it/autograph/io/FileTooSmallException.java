package it.autograph.io;

import java.io.IOException;

public class FileTooSmallException extends IOException {

    private static final long serialVersionUID = 1L;

    public FileTooSmallException(String message) {
        super(message);
    }
}
