package com.pantiviewer.model;

public enum IngestOutcome {
    NEW,                    // A Location was created
    DUPLICATE,              // The path is already cataloged, possibly by a concurrent writer
    SKIPPED_UNSUPPORTED,    // Not a media type the catalog accepts
    ERROR                   // Unreadable or failed to commit; retried on the next scan
}
