package dev.chatstore.storage.domain;

public class InvalidSessionNameException extends ChatStoreException {

    public InvalidSessionNameException() {
        super("Session name must not be blank");
    }

    @Override
    public String code() {
        return "INVALID_NAME";
    }
}
