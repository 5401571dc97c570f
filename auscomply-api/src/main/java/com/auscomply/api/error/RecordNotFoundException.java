package com.auscomply.api.error;

public class RecordNotFoundException extends RuntimeException {
    public RecordNotFoundException(String message) { super(message); }

    public static RecordNotFoundException of(String recordType, Object id) {
        return new RecordNotFoundException(recordType + " not found: " + id);
    }
}
