package com.psl.search.service;

public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String id) {
        super("No paper with id " + id);
    }
}
