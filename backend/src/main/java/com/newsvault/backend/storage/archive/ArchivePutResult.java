package com.newsvault.backend.storage.archive;

import lombok.Value;

@Value
public class ArchivePutResult {
    boolean ok;
    // Stored location on success, error message on failure
    String locationOrError;

    public static ArchivePutResult stored(String location) {
        return new ArchivePutResult(true, location);
    }

    public static ArchivePutResult failed(String error) {
        return new ArchivePutResult(false, error);
    }
}
