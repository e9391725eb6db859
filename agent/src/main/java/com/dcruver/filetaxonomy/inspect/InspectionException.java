package com.dcruver.filetaxonomy.inspect;

/**
 * Content could not be read or interpreted. Analysis carries on with the file name alone.
 */
public class InspectionException extends Exception {

    public InspectionException(String message) {
        super(message);
    }

    public InspectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
