package im.arun.xml2csv.xml;

import java.io.IOException;

/**
 * Raised when input bytes are not a well-formed document.
 */
public class DocumentParseException extends IOException {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
