package com.acme.perfgate.transport;

public record HttpReply(int status, String body) {
    public boolean success() {
        return status >= 200 && status < 300;
    }

    public boolean clientError() {
        return status >= 400 && status < 500;
    }
}
