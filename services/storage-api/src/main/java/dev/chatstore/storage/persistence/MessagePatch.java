package dev.chatstore.storage.persistence;

/**
 * Sparse set of message field assignments.
 *
 * <p>Fields that were never assigned on the patch are left untouched. {@code errorMessage} tracks
 * assignment separately so that a patch can clear it by assigning {@code null}.</p>
 */
public final class MessagePatch {

    private String content;
    private MessageStatus status;
    private String partialContent;
    private String errorMessage;
    private boolean errorMessageAssigned;

    private MessagePatch() {
    }

    public static MessagePatch create() {
        return new MessagePatch();
    }

    public MessagePatch content(String content) {
        this.content = content;
        return this;
    }

    public MessagePatch status(MessageStatus status) {
        this.status = status;
        return this;
    }

    public MessagePatch partialContent(String partialContent) {
        this.partialContent = partialContent;
        return this;
    }

    public MessagePatch errorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
        this.errorMessageAssigned = true;
        return this;
    }

    public MessagePatch clearErrorMessage() {
        return errorMessage(null);
    }

    void applyTo(MessageEntity message) {
        if (content != null) message.setContent(content);
        if (status != null) message.setStatus(status);
        if (partialContent != null) message.setPartialContent(partialContent);
        if (errorMessageAssigned) message.setErrorMessage(errorMessage);
    }
}
