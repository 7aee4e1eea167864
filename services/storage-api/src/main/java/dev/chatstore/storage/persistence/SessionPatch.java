package dev.chatstore.storage.persistence;

/**
 * Sparse set of session field assignments. A {@code null} component is left untouched.
 */
public record SessionPatch(String name, Boolean favorite) {

    public static SessionPatch name(String name) {
        return new SessionPatch(name, null);
    }

    public static SessionPatch favorite(boolean favorite) {
        return new SessionPatch(null, favorite);
    }

    void applyTo(SessionEntity session) {
        if (name != null) session.setName(name);
        if (favorite != null) session.setFavorite(favorite);
    }
}
