package io.github.twinview.api;

/**
 * Unchecked failure of a {@link TextView} buffer operation. The compare engine cannot recover from these locally;
 * the session that issued the operation is abandoned.
 */
public class TextViewException extends RuntimeException {
    public TextViewException(String message) {
        super(message);
    }

    public TextViewException(String message, Throwable cause) {
        super(message, cause);
    }
}
