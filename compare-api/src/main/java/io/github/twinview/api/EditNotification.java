package io.github.twinview.api;

/**
 * A buffer modification as reported by the editor of one compared view.
 *
 * @param type what happened
 * @param position character offset where the change starts
 * @param length number of characters inserted or deleted
 * @param linesAdded line breaks added (positive) or removed (negative); always 0 for {@link
 *     ModificationType#BEFORE_DELETE}
 * @param action whether the change was made by the user or replayed by undo / redo
 */
public record EditNotification(ModificationType type, int position, int length, int linesAdded, EditAction action) {

    public static EditNotification beforeDelete(int position, int length, EditAction action) {
        return new EditNotification(ModificationType.BEFORE_DELETE, position, length, 0, action);
    }

    public static EditNotification deleted(int position, int length, int linesRemoved, EditAction action) {
        return new EditNotification(ModificationType.DELETE_TEXT, position, length, -linesRemoved, action);
    }

    public static EditNotification inserted(int position, int length, int linesAdded, EditAction action) {
        return new EditNotification(ModificationType.INSERT_TEXT, position, length, linesAdded, action);
    }

    public boolean isTextChange() {
        return type == ModificationType.DELETE_TEXT || type == ModificationType.INSERT_TEXT;
    }
}
