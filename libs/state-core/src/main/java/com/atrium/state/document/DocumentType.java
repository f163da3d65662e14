package com.atrium.state.document;

public enum DocumentType {
    FOLDER,
    FILE,
    LINK
}
